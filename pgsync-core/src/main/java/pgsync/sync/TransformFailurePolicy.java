package pgsync.sync;

/**
 * What happens to queue entries of a record whose transformation failed.
 */
public enum TransformFailurePolicy {
    /**
     * Log the failure and acknowledge the entries with the rest of the batch. The
     * record is synced again on its next change.
     */
    ACKNOWLEDGE,
    /**
     * Log the failure and leave the entries in the queue. They are not claimed again
     * during the same run.
     */
    RETAIN
}
