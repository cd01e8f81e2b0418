package edustats.oecd.pipeline.transformer;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.CleaningResult;
import edustats.oecd.pipeline.model.CountryInfo;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.DropReason;
import edustats.oecd.pipeline.model.FlatRecord;
import edustats.oecd.pipeline.service.CountryResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shared cleaning pass. Subclasses supply the range rule and build the
 * typed record.
 *
 * Steps, in order:
 * 1. Column normalization ({@link CleanerUtils#normalizeColumnName})
 * 2. Kind filter on the indicator column, when the column exists
 * 3. Required dimensions: location, time and value
 * 4. Country resolution
 * 5. Year parse and window check
 * 6. Measure parse
 * 7. Range filter ({@link #applyRange})
 * 8. Record construction with derived and provenance fields
 */
@Slf4j
public abstract class AbstractRecordCleaner<T extends CleanRecord> implements RecordCleaner<T> {

    protected static final String LOCATION_COLUMN = "country_code";
    protected static final String INDICATOR_COLUMN = "indicator";
    protected static final String NOT_SPECIFIED = "Not Specified";

    private final DatasetKind kind;
    protected final PipelineConfig config;
    protected final CountryResolver countryResolver;
    private final Clock clock;

    protected AbstractRecordCleaner(DatasetKind kind, PipelineConfig config,
                                    CountryResolver countryResolver, Clock clock) {
        this.kind = kind;
        this.config = config;
        this.countryResolver = countryResolver;
        this.clock = clock;
    }

    @Override
    public DatasetKind getKind() {
        return kind;
    }

    @Override
    public CleaningResult<T> cleanWithReport(List<FlatRecord> raw) {
        log.info("Cleaning {} data: {} records", kind.getKey(), raw.size());

        Map<DropReason, Integer> drops = new EnumMap<>(DropReason.class);
        List<Candidate> candidates = new ArrayList<>(raw.size());

        for (FlatRecord record : raw) {
            Map<String, Object> fields = CleanerUtils.normalizeColumns(record);

            if (fields.containsKey(INDICATOR_COLUMN) && !matchesKind(fields.get(INDICATOR_COLUMN))) {
                drop(drops, DropReason.KIND_MISMATCH);
                continue;
            }

            Object location = CleanerUtils.firstPresent(fields, LOCATION_COLUMN, "country", "location");
            Object time = CleanerUtils.firstPresent(fields, "year", "time");
            if (location == null || location.toString().isBlank() || time == null
                    || !fields.containsKey(FlatRecord.VALUE_KEY)) {
                drop(drops, DropReason.MISSING_DIMENSION);
                continue;
            }

            CountryInfo country = countryResolver.resolve(location.toString());

            Integer year = CleanerUtils.parseYear(time);
            if (year == null) {
                drop(drops, DropReason.INVALID_YEAR);
                continue;
            }
            if (!config.isYearInWindow(year)) {
                drop(drops, DropReason.YEAR_OUT_OF_WINDOW);
                continue;
            }

            Double measure = CleanerUtils.parseMeasure(fields.get(FlatRecord.VALUE_KEY));
            if (measure == null) {
                drop(drops, DropReason.INVALID_VALUE);
                continue;
            }

            candidates.add(new Candidate(country, year, measure, fields));
        }

        List<Candidate> inRange = applyRange(candidates);
        int outOfRange = candidates.size() - inRange.size();
        if (outOfRange > 0) {
            drops.merge(DropReason.OUT_OF_RANGE, outOfRange, Integer::sum);
        }

        LocalDate extractionDate = LocalDate.now(clock);
        List<T> records = new ArrayList<>(inRange.size());
        for (Candidate candidate : inRange) {
            records.add(toRecord(candidate, extractionDate));
        }

        CleaningResult<T> result = new CleaningResult<>(raw.size(), records, drops);
        log.info("Cleaned {} data: {} records kept, {} dropped {}",
                kind.getKey(), records.size(), result.getTotalDropped(), result.getDrops());
        return result;
    }

    /**
     * Keep the candidates whose measure is within the kind's bound,
     * preserving order.
     */
    protected abstract List<Candidate> applyRange(List<Candidate> candidates);

    /**
     * Build the typed record, including derived and provenance fields.
     */
    protected abstract T toRecord(Candidate candidate, LocalDate extractionDate);

    /**
     * Keep the candidates whose measure lies in [min, max], both inclusive.
     */
    protected static List<Candidate> keepBetween(List<Candidate> candidates, double min, double max) {
        List<Candidate> kept = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            double measure = candidate.getMeasure();
            if (measure >= min && measure <= max) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private boolean matchesKind(Object indicator) {
        return indicator != null && indicator.toString().contains(kind.getIndicatorMarker());
    }

    private static void drop(Map<DropReason, Integer> drops, DropReason reason) {
        drops.merge(reason, 1, Integer::sum);
    }

    /**
     * A row that passed parsing but not yet the range filter.
     */
    protected static final class Candidate {
        private final CountryInfo country;
        private final int year;
        private final double measure;
        private final Map<String, Object> fields;

        Candidate(CountryInfo country, int year, double measure, Map<String, Object> fields) {
            this.country = country;
            this.year = year;
            this.measure = measure;
            this.fields = fields;
        }

        public CountryInfo getCountry() {
            return country;
        }

        public int getYear() {
            return year;
        }

        public double getMeasure() {
            return measure;
        }

        /** Text of an optional dimension, or the fallback when absent */
        public String text(String fallback, String... columns) {
            return CleanerUtils.textOrDefault(fields, fallback, columns);
        }
    }
}
