package edustats.oecd.pipeline.exception;

/**
 * Failure writing an intermediate CSV or JSON artifact.
 */
public class ArtifactException extends PipelineException {

    public ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
