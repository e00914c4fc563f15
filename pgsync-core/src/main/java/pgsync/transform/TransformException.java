package pgsync.transform;

/**
 * A single record could not be turned into a document. The sync engine isolates
 * this failure to the record; it never aborts the batch.
 */
public final class TransformException extends Exception {
    private final String tableName;

    public TransformException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
