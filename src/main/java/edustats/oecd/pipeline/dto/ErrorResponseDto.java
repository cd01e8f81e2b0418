package edustats.oecd.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error body returned when a pipeline stage fails behind the REST surface.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDto {

    /** Stage error type, e.g. FETCH_FAILED */
    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;

    public ErrorResponseDto(String error, String message, String runId) {
        this.error = error;
        this.message = message;
        this.runId = runId;
        this.timestamp = LocalDateTime.now();
    }
}
