package com.wellstim.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WellStimulationApplication {

    public static void main(String[] args) {
        SpringApplication.run(WellStimulationApplication.class, args);
    }
}
