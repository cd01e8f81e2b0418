package edustats.oecd.pipeline.exception;

/**
 * Schema creation or write failure. Rows already written in the current
 * batch are not rolled back.
 */
public class StoreException extends PipelineException {

    private final String tableName;

    public StoreException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
