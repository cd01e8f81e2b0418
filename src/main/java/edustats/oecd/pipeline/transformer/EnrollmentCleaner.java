package edustats.oecd.pipeline.transformer;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.EnrollmentRecord;
import edustats.oecd.pipeline.service.CountryResolver;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Enrollment rates. Rows outside [0, 200] are dropped; rates above 100
 * are legitimate for gross enrollment.
 */
public class EnrollmentCleaner extends AbstractRecordCleaner<EnrollmentRecord> {

    public static final double MIN_RATE = 0;
    public static final double MAX_RATE = 200;

    public EnrollmentCleaner(PipelineConfig config, CountryResolver countryResolver, Clock clock) {
        super(DatasetKind.ENROLLMENT, config, countryResolver, clock);
    }

    @Override
    protected List<Candidate> applyRange(List<Candidate> candidates) {
        return keepBetween(candidates, MIN_RATE, MAX_RATE);
    }

    @Override
    protected EnrollmentRecord toRecord(Candidate candidate, LocalDate extractionDate) {
        return new EnrollmentRecord(
                candidate.getCountry().getCode(),
                candidate.getCountry().getName(),
                candidate.getYear(),
                candidate.getMeasure(),
                candidate.text(NOT_SPECIFIED, "education_level", "isc11"),
                candidate.text(NOT_SPECIFIED, "gender", "sex"),
                CleanRecord.DEFAULT_DATA_SOURCE,
                extractionDate);
    }
}
