package pgsync.sync;

/**
 * Outcome of one {@link SyncEngine#sync} run.
 *
 * @param success             {@code false} when a batch failed or the run could not start
 * @param batches             committed batches
 * @param processed           queue entries acknowledged
 * @param upserted            documents sent for upsert
 * @param deleted             documents deleted (including ones already absent)
 * @param skipped             records excluded because their transformation failed
 * @param unknownTableEntries entries acknowledged without effect because their table is not mapped
 * @param retained            entries left in the queue under {@link TransformFailurePolicy#RETAIN}
 * @param error               failure description, {@code null} on success
 */
public record SyncResult(
    boolean success,
    int batches,
    long processed,
    long upserted,
    long deleted,
    long skipped,
    long unknownTableEntries,
    long retained,
    String error) {

    static SyncResult empty() {
        return new SyncResult(true, 0, 0, 0, 0, 0, 0, 0, null);
    }

    static SyncResult failed(String error) {
        return new SyncResult(false, 0, 0, 0, 0, 0, 0, 0, error);
    }
}
