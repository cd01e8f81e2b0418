package edustats.oecd.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one pipeline run.
 */
@Data
@NoArgsConstructor
public class PipelineRunResultDto {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("status")
    private String status;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("finished_at")
    private LocalDateTime finishedAt;

    @JsonProperty("datasets")
    private Map<String, DatasetSummary> datasets = new LinkedHashMap<>();

    @JsonProperty("countries_upserted")
    private int countriesUpserted;

    @JsonProperty("raw_artifact_dir")
    private String rawArtifactDir;

    @JsonProperty("processed_artifact_dir")
    private String processedArtifactDir;

    /**
     * Per dataset kind counts.
     */
    @Data
    @NoArgsConstructor
    public static class DatasetSummary {

        @JsonProperty("dataset_code")
        private String datasetCode;

        @JsonProperty("fetched_records")
        private int fetchedRecords;

        @JsonProperty("clean_records")
        private int cleanRecords;

        @JsonProperty("dropped_records")
        private Map<String, Integer> droppedRecords = new LinkedHashMap<>();

        @JsonProperty("loaded_records")
        private int loadedRecords;
    }
}
