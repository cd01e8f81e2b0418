package edustats.oecd.pipeline.transformer;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.GraduationRecord;
import edustats.oecd.pipeline.service.CountryResolver;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Graduation rates. Rows outside [0, 120] are dropped; the completion rate
 * is derived as graduation rate / 100.
 */
public class GraduationCleaner extends AbstractRecordCleaner<GraduationRecord> {

    public static final double MIN_RATE = 0;
    public static final double MAX_RATE = 120;

    static final String DEFAULT_EDUCATION_LEVEL = "All Levels";

    public GraduationCleaner(PipelineConfig config, CountryResolver countryResolver, Clock clock) {
        super(DatasetKind.GRADUATION, config, countryResolver, clock);
    }

    @Override
    protected List<Candidate> applyRange(List<Candidate> candidates) {
        return keepBetween(candidates, MIN_RATE, MAX_RATE);
    }

    @Override
    protected GraduationRecord toRecord(Candidate candidate, LocalDate extractionDate) {
        return new GraduationRecord(
                candidate.getCountry().getCode(),
                candidate.getCountry().getName(),
                candidate.getYear(),
                candidate.getMeasure(),
                candidate.text(DEFAULT_EDUCATION_LEVEL, "education_level", "isc11"),
                CleanRecord.DEFAULT_DATA_SOURCE,
                extractionDate);
    }
}
