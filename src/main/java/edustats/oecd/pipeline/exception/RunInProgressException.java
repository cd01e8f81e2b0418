package edustats.oecd.pipeline.exception;

/**
 * Thrown when a run is requested while another run is active in this process.
 */
public class RunInProgressException extends IllegalStateException {

    private final String activeRunId;

    public RunInProgressException(String activeRunId) {
        super("Pipeline run " + activeRunId + " is already in progress");
        this.activeRunId = activeRunId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}
