package com.wellstim.extraction.service;

import com.wellstim.extraction.entity.StimulationData;
import com.wellstim.extraction.entity.Well;
import com.wellstim.extraction.model.ParsedRecord;
import com.wellstim.extraction.model.UpsertOutcome;
import com.wellstim.extraction.model.UpsertOutcome.Action;
import com.wellstim.extraction.repository.StimulationDataRepository;
import com.wellstim.extraction.repository.WellRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Writes one document's well and stimulation records as a single unit of work.
 *
 * Wells are keyed by API number, stimulations by (well, date). Defaults are
 * applied before writing, so a field the document did not yield is reset to
 * its default ("N/A" or 0) on update. Only the API number and the stimulation
 * date are left untouched when missing. Persistence errors are not caught here.
 */
@Service
@Slf4j
public class WellUpsertService {

    private final WellRepository wellRepo;
    private final StimulationDataRepository stimulationRepo;

    public WellUpsertService(WellRepository wellRepo, StimulationDataRepository stimulationRepo) {
        this.wellRepo = wellRepo;
        this.stimulationRepo = stimulationRepo;
    }

    @Transactional
    public UpsertOutcome upsert(ParsedRecord wellFields, ParsedRecord stimulationFields, Path source) {
        // 1. Defaults (API excluded), then drop whatever is still missing
        ParsedRecord wellPayload = FieldNormalizer
                .applyDefaults(wellFields, WellReportFields.WELL)
                .withoutMissing();

        // 2. No API number, no writes
        String api = wellPayload.getString("api");
        if (api == null) {
            log.warn("Skipping {} because no API number was parsed", source);
            return UpsertOutcome.skipped();
        }

        // 3. Resolve the well
        Action wellAction;
        Optional<Well> existing = wellRepo.findByApi(api);
        Well well;
        if (existing.isEmpty()) {
            well = new Well();
            writeFields(well, wellPayload);
            well = wellRepo.save(well);
            wellAction = Action.CREATED;
            log.info("Inserted new well {} from {}", api, fileName(source));
        } else {
            well = existing.get();
            writeFields(well, wellPayload);
            wellAction = Action.UPDATED;
            log.info("Updated existing well {} from {}", api, fileName(source));
        }

        // 4. Stimulation payload (date excluded from defaults)
        ParsedRecord stimPayload = FieldNormalizer
                .applyDefaults(stimulationFields, WellReportFields.STIMULATION)
                .withoutMissing();
        if (stimPayload.isEmpty()) {
            return new UpsertOutcome(api, wellAction, Action.NONE);
        }

        // 5. Match on (well, date); undated rows always append
        return new UpsertOutcome(api, wellAction, upsertStimulation(well, stimPayload));
    }

    private Action upsertStimulation(Well well, ParsedRecord stimPayload) {
        LocalDate date = stimPayload.getDate("dateStimulated");

        Optional<StimulationData> existing = date == null
                ? Optional.empty()
                : stimulationRepo.findByWellAndDateStimulated(well, date);

        if (existing.isPresent()) {
            writeFields(existing.get(), stimPayload);
            log.debug("Updated stimulation {} for well {}", date, well.getApi());
            return Action.UPDATED;
        }

        StimulationData stimulation = new StimulationData();
        writeFields(stimulation, stimPayload);
        well.addStimulation(stimulation);
        stimulationRepo.save(stimulation);
        log.debug("Added stimulation {} for well {}", date, well.getApi());
        return Action.CREATED;
    }

    /**
     * Copies every payload entry onto the bean property of the same name.
     */
    private void writeFields(Object entity, ParsedRecord payload) {
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(entity);
        payload.forEach(wrapper::setPropertyValue);
    }

    private String fileName(Path source) {
        return source == null || source.getFileName() == null ? String.valueOf(source) : source.getFileName().toString();
    }
}
