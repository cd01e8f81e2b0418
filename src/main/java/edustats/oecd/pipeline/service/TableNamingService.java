package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.model.DatasetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Resolves and validates the configured table names.
 *
 * Table names are interpolated into DDL and DML, so each one must already
 * be a plain lower-case SQL identifier: letters, digits and underscores,
 * not starting with a digit, at most 63 characters (PostgreSQL limit).
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class TableNamingService {

    private static final Logger logger = LoggerFactory.getLogger(TableNamingService.class);

    // PostgreSQL identifier limit
    private static final int POSTGRESQL_MAX_IDENTIFIER_LENGTH = 63;

    private final PipelineConfig config;

    public TableNamingService(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Validated fact table name for a dataset kind.
     */
    public String factTable(DatasetKind kind) {
        return requireSafeIdentifier(config.getFactTable(kind));
    }

    /**
     * Validated country reference table name.
     */
    public String countryTable() {
        return requireSafeIdentifier(config.getTables().getCountries());
    }

    /**
     * Check that a configured name is usable as-is in SQL.
     *
     * @param name configured table name
     * @return the name, unchanged
     * @throws IllegalArgumentException if the name would need sanitizing
     */
    public String requireSafeIdentifier(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be empty");
        }

        String sanitized = sanitizeTableName(name);
        if (!sanitized.equals(name)) {
            logger.error("Configured table name '{}' is not a safe identifier (suggested: '{}')", name, sanitized);
            throw new IllegalArgumentException(
                    "Table name '" + name + "' must be lower-case letters, digits and underscores; try '"
                            + sanitized + "'");
        }
        if (Character.isDigit(name.charAt(0))) {
            throw new IllegalArgumentException("Table name '" + name + "' cannot start with a digit");
        }
        if (name.length() > POSTGRESQL_MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException("Table name '" + name + "' exceeds "
                    + POSTGRESQL_MAX_IDENTIFIER_LENGTH + " characters");
        }
        return name;
    }

    /**
     * Sanitize a name to be safe for SQL.
     *
     * Transformation steps:
     * 1. Convert to lowercase
     * 2. Replace all non-alphanumeric characters (except underscore) with
     * underscore
     * 3. Replace multiple consecutive underscores with single underscore
     * 4. Remove leading/trailing underscores
     *
     * Examples:
     * "Enrollment-Data" → "enrollment_data"
     * "COUNTRY__METADATA" → "country_metadata"
     * "_spending_" → "spending"
     *
     * @param name the raw name
     * @return sanitized name safe for PostgreSQL
     */
    public String sanitizeTableName(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }

        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_{2,}", "_")
                .replaceAll("^_|_$", "");
    }
}
