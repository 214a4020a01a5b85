package com.wellstim.extraction.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds an API number from loose digit runs when no labelled API was found.
 *
 * Best effort only: there is no check digit, so any 10, 12 or 14 digit run can
 * be returned. Longer runs are preferred because they carry the sidetrack and
 * event codes.
 */
@Component
@Slf4j
public class ApiNumberRecovery {

    // Digits with spaces, hyphens or slashes between them
    private static final Pattern SEPARATED_RUN = Pattern.compile("(?:\\d[\\s\\-/\\\\]*){10,14}");
    private static final Pattern CONTIGUOUS_RUN = Pattern.compile("\\b\\d{10,14}\\b");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern EN_EM_DASH = Pattern.compile("[\\u2013\\u2014]");

    public Optional<String> recover(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String normalized = EN_EM_DASH.matcher(text).replaceAll("-");

        // LinkedHashSet keeps first-seen order while dropping repeats
        LinkedHashSet<String> seen = new LinkedHashSet<>();

        Matcher separated = SEPARATED_RUN.matcher(normalized);
        while (separated.find()) {
            String digits = NON_DIGIT.matcher(separated.group()).replaceAll("");
            if (digits.length() >= 10 && digits.length() <= 14) {
                seen.add(digits);
            }
        }

        Matcher contiguous = CONTIGUOUS_RUN.matcher(normalized);
        while (contiguous.find()) {
            seen.add(contiguous.group());
        }

        List<String> candidates = new ArrayList<>(seen);
        // stable sort: equal lengths keep first-seen order
        candidates.sort(Comparator.comparingInt(String::length).reversed());

        for (String digits : candidates) {
            String formatted = format(digits);
            if (formatted != null) {
                log.debug("Recovered API {} from {} candidate runs", formatted, candidates.size());
                return Optional.of(formatted);
            }
        }
        return Optional.empty();
    }

    /**
     * 2-3-5 grouping, extended by 2-digit sidetrack and event codes.
     * Any other length is not an API number.
     */
    static String format(String digits) {
        return switch (digits.length()) {
            case 10 -> digits.substring(0, 2) + "-" + digits.substring(2, 5) + "-" + digits.substring(5);
            case 12 -> digits.substring(0, 2) + "-" + digits.substring(2, 5) + "-" + digits.substring(5, 10)
                    + "-" + digits.substring(10);
            case 14 -> digits.substring(0, 2) + "-" + digits.substring(2, 5) + "-" + digits.substring(5, 10)
                    + "-" + digits.substring(10, 12) + "-" + digits.substring(12);
            default -> null;
        };
    }
}
