package edustats.oecd.pipeline.model;

import java.util.Collections;
import java.util.Map;

/**
 * The three fact datasets pulled from the statistics API.
 *
 * Each kind carries its default dataset code, the indicator marker used to
 * keep only matching rows, and any extra query parameters for the fetch.
 */
public enum DatasetKind {

    ENROLLMENT("enrollment", "EDU_ENRL", "ENRL", Collections.emptyMap()),
    GRADUATION("graduation", "EDU_GRAD", "GRAD", Collections.emptyMap()),
    SPENDING("spending", "EDU_FIN", "FIN", Map.of("measure", "USD"));

    private final String key;
    private final String defaultDatasetCode;
    private final String indicatorMarker;
    private final Map<String, String> extraParams;

    DatasetKind(String key, String defaultDatasetCode, String indicatorMarker, Map<String, String> extraParams) {
        this.key = key;
        this.defaultDatasetCode = defaultDatasetCode;
        this.indicatorMarker = indicatorMarker;
        this.extraParams = extraParams;
    }

    /** Lower-case name used in artifact file names and result maps */
    public String getKey() {
        return key;
    }

    public String getDefaultDatasetCode() {
        return defaultDatasetCode;
    }

    public String getIndicatorMarker() {
        return indicatorMarker;
    }

    public Map<String, String> getExtraParams() {
        return extraParams;
    }
}
