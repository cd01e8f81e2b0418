package edustats.oecd.pipeline.exception;

/**
 * Base type for stage-level failures. Any of these halts the pipeline run
 * and is surfaced to the caller unchanged.
 */
public class PipelineException extends RuntimeException {

    /** Set by the orchestrator once the failure leaves a run */
    private String runId;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }
}
