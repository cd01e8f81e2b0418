package edustats.oecd.pipeline.transformer;

import edustats.oecd.pipeline.model.FlatRecord;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column and value helpers shared by every record cleaner.
 *
 * Column name rules:
 * 1. Lower-case and trim
 * 2. Every non-word character becomes an underscore
 * 3. Runs of underscores collapse to one
 * 4. Fixed synonyms: time_period → year, ref_area → country,
 *    obs_value → value, location → country_code
 */
@Slf4j
public final class CleanerUtils {

    private static final Map<String, String> COLUMN_SYNONYMS = Map.of(
            "time_period", "year",
            "ref_area", "country",
            "obs_value", "value",
            "location", "country_code");

    private CleanerUtils() {
    }

    /**
     * Normalize a single column name.
     *
     * Examples:
     * "LOCATION" → "country_code"
     * "TIME" → "time"
     * " Obs Value " → "obs_value" → "value"
     * "Education--Level" → "education_level"
     */
    public static String normalizeColumnName(String name) {
        if (name == null) {
            return "";
        }
        String normalized = name.toLowerCase(Locale.ROOT).trim()
                .replaceAll("(?U)\\W", "_")
                .replaceAll("_+", "_");
        return COLUMN_SYNONYMS.getOrDefault(normalized, normalized);
    }

    /**
     * Copy a record's fields under normalized names. When two raw names
     * normalize to the same column, the first one in record order is kept.
     */
    public static Map<String, Object> normalizeColumns(FlatRecord record) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : record.getFields().entrySet()) {
            String column = normalizeColumnName(field.getKey());
            if (normalized.containsKey(column)) {
                log.debug("Column '{}' normalizes to existing column '{}', keeping first value",
                        field.getKey(), column);
                continue;
            }
            normalized.put(column, field.getValue());
        }
        return normalized;
    }

    /**
     * Value of the first column present with a non-null value.
     */
    public static Object firstPresent(Map<String, Object> fields, String... columns) {
        for (String column : columns) {
            Object value = fields.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Text of the first non-blank column, or the fallback.
     */
    public static String textOrDefault(Map<String, Object> fields, String fallback, String... columns) {
        Object value = firstPresent(fields, columns);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        return value.toString().trim();
    }

    /**
     * Parse a year. Integral decimals such as "2022.0" are accepted.
     *
     * @return the year, or null when the value is not an integer
     */
    public static Integer parseYear(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Integer) {
            return (Integer) raw;
        }
        try {
            return new BigDecimal(raw.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /**
     * Parse a measure to a finite double.
     *
     * @return the value, or null when unparseable, NaN or infinite
     */
    public static Double parseMeasure(Object raw) {
        if (raw == null) {
            return null;
        }
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else {
            try {
                value = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return value;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * For n sorted values the position is {@code (n - 1) * q}; the result
     * interpolates between the values at floor and ceiling of that position.
     *
     * @param sorted   values in ascending order, not empty
     * @param quantile in [0, 1]
     */
    public static double percentile(List<Double> sorted, double quantile) {
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute a percentile of no values");
        }
        if (quantile < 0 || quantile > 1) {
            throw new IllegalArgumentException("Quantile must be within [0, 1]: " + quantile);
        }
        double position = (sorted.size() - 1) * quantile;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double lowerValue = sorted.get(lower);
        if (lower == upper) {
            return lowerValue;
        }
        return lowerValue + (sorted.get(upper) - lowerValue) * (position - lower);
    }
}
