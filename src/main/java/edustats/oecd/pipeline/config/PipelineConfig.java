package edustats.oecd.pipeline.config;

import edustats.oecd.pipeline.model.DatasetKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pipeline configuration bound from application.properties.
 *
 * Maps directly to properties under the pipeline prefix:
 * - pipeline.source.base-url
 * - pipeline.source.timeout-seconds
 * - pipeline.source.request-pause-ms
 * - pipeline.source.datasets.{enrollment,graduation,spending}
 * - pipeline.years.start / pipeline.years.end
 * - pipeline.tables.{enrollment,graduation,spending,countries}
 * - pipeline.output.enabled / raw-dir / processed-dir
 * - pipeline.loader.batch-size / query-timeout-seconds
 * - pipeline.run-on-startup
 *
 * A single instance is injected into every component that needs it.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineConfig {

    // ========================================
    // REMOTE SOURCE (pipeline.source.*)
    // ========================================

    private Source source = new Source();

    @Data
    public static class Source {
        /** Base URL, the dataset code is appended directly */
        private String baseUrl = "https://stats.oecd.org/SDMX-JSON/data/";

        /** Request deadline for a single dataset fetch */
        private int timeoutSeconds = 30;

        /** Pause between consecutive dataset fetches */
        private long requestPauseMs = 1000;

        /** Dataset code per kind, defaults to the kind's standard code */
        private Map<DatasetKind, String> datasets = defaultDatasets();

        private static Map<DatasetKind, String> defaultDatasets() {
            Map<DatasetKind, String> defaults = new EnumMap<>(DatasetKind.class);
            for (DatasetKind kind : DatasetKind.values()) {
                defaults.put(kind, kind.getDefaultDatasetCode());
            }
            return defaults;
        }
    }

    // ========================================
    // REPORTING WINDOW (pipeline.years.*)
    // ========================================

    private Years years = new Years();

    @Data
    public static class Years {
        /** First valid reporting year, inclusive */
        private int start = 2000;

        /** Last valid reporting year, inclusive */
        private int end = 2023;
    }

    // ========================================
    // TABLE NAMES (pipeline.tables.*)
    // ========================================

    private Tables tables = new Tables();

    @Data
    public static class Tables {
        private String enrollment = "enrollment_data";
        private String graduation = "graduation_data";
        private String spending = "spending_data";
        private String countries = "country_metadata";
    }

    // ========================================
    // INTERMEDIATE ARTIFACTS (pipeline.output.*)
    // ========================================

    private Output output = new Output();

    @Data
    public static class Output {
        /** Write raw and cleaned CSV artifacts for each run */
        private boolean enabled = true;

        private String rawDir = "data/raw";

        private String processedDir = "data/processed";
    }

    // ========================================
    // LOADER (pipeline.loader.*)
    // ========================================

    private Loader loader = new Loader();

    @Data
    public static class Loader {
        /** Rows per JDBC batch for fact table appends */
        private int batchSize = 500;

        /** Statement timeout for schema, load and count statements */
        private int queryTimeoutSeconds = 300;
    }

    /** Run the pipeline once the application is ready */
    private boolean runOnStartup = false;

    // ========================================
    // HELPER METHODS
    // ========================================

    /**
     * Get the dataset code for a kind, falling back to the kind's default
     * when the property map has no entry for it.
     *
     * @param kind dataset kind
     * @return dataset code, e.g. EDU_ENRL
     */
    public String getDatasetCode(DatasetKind kind) {
        String code = source.getDatasets().get(kind);
        if (code == null || code.isBlank()) {
            return kind.getDefaultDatasetCode();
        }
        return code.trim();
    }

    /**
     * Get the fact table name for a kind.
     *
     * @param kind dataset kind
     * @return configured table name
     */
    public String getFactTable(DatasetKind kind) {
        switch (kind) {
            case ENROLLMENT:
                return tables.getEnrollment();
            case GRADUATION:
                return tables.getGraduation();
            case SPENDING:
                return tables.getSpending();
            default:
                throw new IllegalArgumentException("Unknown dataset kind: " + kind);
        }
    }

    /**
     * Check whether a year falls inside the configured reporting window.
     */
    public boolean isYearInWindow(int year) {
        return year >= years.getStart() && year <= years.getEnd();
    }
}
