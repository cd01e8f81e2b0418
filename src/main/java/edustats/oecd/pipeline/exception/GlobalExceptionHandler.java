package edustats.oecd.pipeline.exception;

import edustats.oecd.pipeline.dto.ErrorResponseDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline failures to HTTP responses.
 *
 * Upstream problems (fetch, decode) are reported as 502, local problems
 * (artifacts, database) as 500 and a concurrent run request as 409.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String FETCH_FAILED = "FETCH_FAILED";
    public static final String DECODE_FAILED = "DECODE_FAILED";
    public static final String STORE_FAILED = "STORE_FAILED";
    public static final String ARTIFACT_FAILED = "ARTIFACT_FAILED";
    public static final String RUN_IN_PROGRESS = "RUN_IN_PROGRESS";
    public static final String PIPELINE_FAILED = "PIPELINE_FAILED";

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<ErrorResponseDto> handleFetchException(FetchException e) {
        return respond(HttpStatus.BAD_GATEWAY, FETCH_FAILED, e);
    }

    @ExceptionHandler(DecodeException.class)
    public ResponseEntity<ErrorResponseDto> handleDecodeException(DecodeException e) {
        return respond(HttpStatus.BAD_GATEWAY, DECODE_FAILED, e);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponseDto> handleStoreException(StoreException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, STORE_FAILED, e);
    }

    @ExceptionHandler(ArtifactException.class)
    public ResponseEntity<ErrorResponseDto> handleArtifactException(ArtifactException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ARTIFACT_FAILED, e);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponseDto> handlePipelineException(PipelineException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, PIPELINE_FAILED, e);
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<ErrorResponseDto> handleRunInProgress(RunInProgressException e) {
        log.warn("{}: {}", RUN_IN_PROGRESS, e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponseDto(RUN_IN_PROGRESS, e.getMessage(), e.getActiveRunId()));
    }

    private ResponseEntity<ErrorResponseDto> respond(HttpStatus status, String error, PipelineException e) {
        log.error("{} (run {}): {}", error, e.getRunId(), e.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(error, e.getMessage(), e.getRunId()));
    }
}
