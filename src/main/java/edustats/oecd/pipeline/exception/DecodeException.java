package edustats.oecd.pipeline.exception;

/**
 * Malformed observation key. Aborts decoding of the whole dataset.
 */
public class DecodeException extends PipelineException {

    private final String observationKey;

    public DecodeException(String observationKey, Throwable cause) {
        super("Malformed observation key: '" + observationKey + "'", cause);
        this.observationKey = observationKey;
    }

    public String getObservationKey() {
        return observationKey;
    }
}
