package pgsync.spi;

/**
 * Observability hook for exporting sync counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics.
 */
public interface SyncMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    SyncMetrics NOOP = new Noop();

    /**
     * Increments the count of committed batches.
     */
    void incrementBatchSuccess();

    /**
     * Increments the count of rolled back batches.
     */
    void incrementBatchFailure();

    /**
     * Adds queue entries removed after their effect was applied.
     */
    void addAcknowledged(int count);

    void addUpserted(int count);

    void addDeleted(int count);

    /**
     * Increments the count of records excluded because their transformation failed.
     */
    void incrementRecordSkipped();

    /**
     * Increments the count of entries whose table has no mapping.
     */
    default void incrementUnknownTable() {
    }

    /**
     * Records the number of pending queue entries seen at the start of a run.
     */
    void recordQueueDepth(long depth);

    /**
     * Records the age (in milliseconds) of the oldest entry in the latest claimed batch.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements SyncMetrics {
        @Override
        public void incrementBatchSuccess() {
        }

        @Override
        public void incrementBatchFailure() {
        }

        @Override
        public void addAcknowledged(int count) {
        }

        @Override
        public void addUpserted(int count) {
        }

        @Override
        public void addDeleted(int count) {
        }

        @Override
        public void incrementRecordSkipped() {
        }

        @Override
        public void recordQueueDepth(long depth) {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
