package edustats.oecd.pipeline.exception;

/**
 * Network failure, non-2xx status or unreadable body while fetching a dataset.
 */
public class FetchException extends PipelineException {

    private final String datasetCode;
    private final Integer statusCode;

    public FetchException(String datasetCode, String message, Throwable cause) {
        super(message, cause);
        this.datasetCode = datasetCode;
        this.statusCode = null;
    }

    public FetchException(String datasetCode, int statusCode) {
        super(String.format("Dataset %s returned HTTP %d", datasetCode, statusCode));
        this.datasetCode = datasetCode;
        this.statusCode = statusCode;
    }

    public String getDatasetCode() {
        return datasetCode;
    }

    /** HTTP status when the server answered, null for transport failures */
    public Integer getStatusCode() {
        return statusCode;
    }
}
