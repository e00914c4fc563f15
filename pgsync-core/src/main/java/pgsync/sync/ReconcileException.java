package pgsync.sync;

/**
 * One or more index operations of a batch failed; the batch must roll back.
 */
final class ReconcileException extends RuntimeException {
    ReconcileException(String message) {
        super(message);
    }
}
