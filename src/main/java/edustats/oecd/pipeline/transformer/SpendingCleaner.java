package edustats.oecd.pipeline.transformer;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.SpendingRecord;
import edustats.oecd.pipeline.service.CountryResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Education spending in USD.
 *
 * The bound depends on the batch: values outside the batch's 1st to 99th
 * percentile band are dropped, so the same row can survive in one batch and
 * not in another.
 */
@Slf4j
public class SpendingCleaner extends AbstractRecordCleaner<SpendingRecord> {

    public static final double LOWER_QUANTILE = 0.01;
    public static final double UPPER_QUANTILE = 0.99;

    public SpendingCleaner(PipelineConfig config, CountryResolver countryResolver, Clock clock) {
        super(DatasetKind.SPENDING, config, countryResolver, clock);
    }

    @Override
    protected List<Candidate> applyRange(List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return candidates;
        }

        List<Double> sorted = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            sorted.add(candidate.getMeasure());
        }
        Collections.sort(sorted);

        double low = CleanerUtils.percentile(sorted, LOWER_QUANTILE);
        double high = CleanerUtils.percentile(sorted, UPPER_QUANTILE);
        log.debug("Spending outlier band for {} values: [{}, {}]", sorted.size(), low, high);

        return keepBetween(candidates, low, high);
    }

    @Override
    protected SpendingRecord toRecord(Candidate candidate, LocalDate extractionDate) {
        return new SpendingRecord(
                candidate.getCountry().getCode(),
                candidate.getCountry().getName(),
                candidate.getYear(),
                candidate.getMeasure(),
                candidate.text(NOT_SPECIFIED, "education_level", "isc11"),
                CleanRecord.DEFAULT_DATA_SOURCE,
                extractionDate);
    }
}
