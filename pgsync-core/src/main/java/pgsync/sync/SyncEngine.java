package pgsync.sync;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import pgsync.document.Document;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.model.QueueEntry;
import pgsync.model.QueueStatus;
import pgsync.spi.ChangeQueue;
import pgsync.spi.ConnectionProvider;
import pgsync.spi.DeleteOutcome;
import pgsync.spi.ImportResult;
import pgsync.spi.IndexClient;
import pgsync.spi.RowFetcher;
import pgsync.spi.SyncMetrics;
import pgsync.transform.DocumentPipeline;
import pgsync.transform.TransformException;

/**
 * Drains the change queue into the search index, one batch per transaction.
 *
 * <p>Each batch claims entries, keeps the latest entry per record, fetches the current
 * rows of inserted/updated records, converts them to documents, applies upserts and
 * deletes to the index and finally deletes the claimed entries. The transaction
 * commits only after every index operation of the batch succeeded; otherwise it
 * rolls back, the entries stay queued and the run stops. Runs end when a claim comes
 * back empty.
 *
 * <p>Delivery is at-least-once: a batch rolled back after some index writes succeeded
 * is applied again by a later run. Index writes are idempotent, so replays converge.
 *
 * <p>Create instances via {@link #builder()}. A single engine runs batches
 * sequentially; concurrent runs (in this or other processes) are kept apart by the
 * queue's row locks.
 *
 * @see SyncEngine.Builder
 */
public final class SyncEngine {
    private static final Logger logger = Logger.getLogger(SyncEngine.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ChangeQueue changeQueue;
    private final RowFetcher rowFetcher;
    private final IndexClient indexClient;
    private final TableMappingRegistry tables;
    private final DocumentPipeline pipeline;
    private final SyncMetrics metrics;
    private final int batchSize;
    private final TransformFailurePolicy transformFailurePolicy;
    private final Clock clock;

    private SyncEngine(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.changeQueue = Objects.requireNonNull(builder.changeQueue, "changeQueue");
        this.rowFetcher = Objects.requireNonNull(builder.rowFetcher, "rowFetcher");
        this.indexClient = Objects.requireNonNull(builder.indexClient, "indexClient");
        this.tables = Objects.requireNonNull(builder.tables, "tables");
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("tables must not be empty");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.pipeline = builder.pipeline != null ? builder.pipeline : new DocumentPipeline();
        this.metrics = builder.metrics != null ? builder.metrics : SyncMetrics.NOOP;
        this.transformFailurePolicy = builder.transformFailurePolicy != null
            ? builder.transformFailurePolicy
            : TransformFailurePolicy.ACKNOWLEDGE;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TableMappingRegistry tables() {
        return tables;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Syncs every configured table with the configured batch size.
     */
    public SyncResult sync() {
        return sync(List.of(), batchSize);
    }

    /**
     * Runs batches until the queue holds no more entries for {@code tableNames}.
     *
     * <p>Never throws for operational failures: a missing queue table, an unreachable
     * database or a failed batch yield an unsuccessful result. Batches committed before
     * a failure stay committed and are counted in the result.
     *
     * @param tableNames tables to sync; {@code null} or empty means all configured tables
     * @param batchSize  maximum entries claimed per batch
     * @return the run outcome
     */
    public SyncResult sync(Collection<String> tableNames, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        Set<String> selected = tableNames == null || tableNames.isEmpty()
            ? tables.names()
            : new LinkedHashSet<>(tableNames);
        for (String name : selected) {
            if (!tables.contains(name)) {
                logger.log(Level.WARNING, "Table ''{0}'' is not configured; its queue entries will be "
                    + "acknowledged without effect", name);
            }
        }

        Connection conn;
        try {
            conn = connectionProvider.getConnection();
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to obtain a database connection", e);
            return SyncResult.failed("Failed to obtain a database connection: " + e.getMessage());
        }
        try {
            return run(conn, selected, batchSize);
        } finally {
            close(conn);
        }
    }

    /**
     * Reports queue depth and breakdown.
     */
    public QueueStatus status() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return changeQueue.status(conn);
        } catch (SQLException | RuntimeException e) {
            throw new IllegalStateException("Failed to read queue status: " + e.getMessage(), e);
        }
    }

    private SyncResult run(Connection conn, Set<String> selected, int batchSize) {
        try {
            conn.setAutoCommit(true);
            if (!changeQueue.exists(conn)) {
                logger.severe("Change queue table does not exist; run setup first");
                return SyncResult.failed("Change queue table does not exist; run setup first");
            }
            long pending = changeQueue.pendingCount(conn, selected);
            metrics.recordQueueDepth(pending);
            if (pending == 0) {
                metrics.recordOldestLagMs(0);
                logger.info("No pending changes in the queue");
                return SyncResult.empty();
            }
            logger.log(Level.INFO, "{0} pending changes in the queue", pending);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to inspect the change queue", e);
            return SyncResult.failed("Failed to inspect the change queue: " + e.getMessage());
        }

        Totals totals = new Totals();
        Set<Long> retained = new HashSet<>();
        while (true) {
            int batchNumber = totals.batches + 1;
            BatchReport report;
            try {
                report = processBatch(conn, selected, retained, batchSize, batchNumber);
            } catch (SQLException | RuntimeException e) {
                metrics.incrementBatchFailure();
                logger.log(Level.SEVERE, "Batch " + batchNumber + " failed and was rolled back; "
                    + "its entries remain queued", e);
                return totals.toResult(false, "Batch " + batchNumber + " failed: " + e.getMessage());
            }
            if (report == null) {
                break;
            }
            totals.add(report);
            metrics.incrementBatchSuccess();
        }
        logger.log(Level.INFO, "Sync finished: {0} batches, {1} entries processed",
            new Object[] {totals.batches, totals.processed});
        return totals.toResult(true, null);
    }

    /**
     * Runs one batch in its own transaction.
     *
     * @return the batch report, or {@code null} when nothing was claimed
     */
    private BatchReport processBatch(Connection conn, Set<String> selected, Set<Long> retained,
                                     int limit, int batchNumber) throws SQLException {
        conn.setAutoCommit(false);
        boolean committed = false;
        try {
            List<QueueEntry> claimed = changeQueue.claim(conn, selected, retained, limit);
            if (claimed.isEmpty()) {
                conn.commit();
                committed = true;
                return null;
            }
            Instant oldest = claimed.get(0).createdAt();
            if (oldest != null) {
                metrics.recordOldestLagMs(Math.max(0L, Duration.between(oldest, clock.instant()).toMillis()));
            }

            BatchPlan plan = BatchPlan.of(claimed, tables);
            logger.log(Level.INFO, "Batch {0}: claimed {1} entries, {2} unique records",
                new Object[] {batchNumber, claimed.size(), plan.recordCount()});
            for (int i = 0; i < plan.unknownTableEntries(); i++) {
                metrics.incrementUnknownTable();
            }
            if (plan.unknownTableEntries() > 0) {
                logger.log(Level.WARNING, "Batch {0}: acknowledging {1} entries for unmapped tables",
                    new Object[] {batchNumber, plan.unknownTableEntries()});
            }

            Map<String, List<Document>> upserts = new LinkedHashMap<>();
            Map<String, List<String>> deletes = new LinkedHashMap<>();
            plan.deletesByCollection().forEach((collection, ids) -> deletes.put(collection, new ArrayList<>(ids)));
            Set<Long> retainedNow = new HashSet<>();
            int skipped = 0;

            for (Map.Entry<String, List<String>> fetch : plan.fetchesByTable().entrySet()) {
                TableMapping mapping = tables.get(fetch.getKey());
                Map<String, Map<String, Object>> rows = rowFetcher.fetch(conn, mapping, fetch.getValue());
                for (String recordId : fetch.getValue()) {
                    Map<String, Object> row = rows.get(recordId);
                    if (row == null) {
                        deletes.computeIfAbsent(mapping.collection(), k -> new ArrayList<>()).add(recordId);
                        continue;
                    }
                    try {
                        upserts.computeIfAbsent(mapping.collection(), k -> new ArrayList<>())
                            .add(pipeline.normalize(row, mapping));
                    } catch (TransformException e) {
                        skipped++;
                        metrics.incrementRecordSkipped();
                        logger.log(Level.WARNING, "Skipping record " + recordId + " of table '"
                            + mapping.name() + "': " + e.getMessage(), e);
                        if (transformFailurePolicy == TransformFailurePolicy.RETAIN) {
                            retainedNow.addAll(plan.entryIds(mapping.name(), recordId));
                        }
                    }
                }
            }

            int upserted = upsertAll(upserts);
            int deleted = deleteAll(deletes);

            List<Long> ackIds = new ArrayList<>(claimed.size());
            for (QueueEntry entry : claimed) {
                if (!retainedNow.contains(entry.id())) {
                    ackIds.add(entry.id());
                }
            }
            int acknowledged = ackIds.isEmpty() ? 0 : changeQueue.delete(conn, ackIds);
            conn.commit();
            committed = true;
            retained.addAll(retainedNow);

            metrics.addAcknowledged(acknowledged);
            metrics.addUpserted(upserted);
            metrics.addDeleted(deleted);
            logger.log(Level.INFO, "Batch {0}: {1} upserted, {2} deleted, {3} skipped, {4} entries acknowledged",
                new Object[] {batchNumber, upserted, deleted, skipped, acknowledged});
            return new BatchReport(acknowledged, upserted, deleted, skipped,
                plan.unknownTableEntries(), retainedNow.size());
        } finally {
            if (!committed) {
                rollback(conn);
            }
        }
    }

    private int upsertAll(Map<String, List<Document>> upserts) {
        int upserted = 0;
        int failures = 0;
        for (Map.Entry<String, List<Document>> entry : upserts.entrySet()) {
            String collection = entry.getKey();
            List<Document> documents = entry.getValue();
            if (documents.isEmpty()) {
                continue;
            }
            List<ImportResult> results;
            try {
                results = indexClient.upsert(collection, documents);
            } catch (RuntimeException e) {
                failures++;
                logger.log(Level.SEVERE, "Bulk upsert into '" + collection + "' failed", e);
                continue;
            }
            if (results.size() != documents.size()) {
                failures++;
                logger.log(Level.SEVERE, "Bulk upsert into ''{0}'' returned {1} results for {2} documents",
                    new Object[] {collection, results.size(), documents.size()});
            }
            for (ImportResult result : results) {
                if (!result.success()) {
                    failures++;
                    logger.log(Level.SEVERE, "Error upserting document {0} into ''{1}'': {2}",
                        new Object[] {result.documentId(), collection, result.error()});
                }
            }
            upserted += documents.size();
        }
        if (failures > 0) {
            throw new ReconcileException(failures + " upsert failure(s)");
        }
        return upserted;
    }

    private int deleteAll(Map<String, List<String>> deletes) {
        int deleted = 0;
        int failures = 0;
        for (Map.Entry<String, List<String>> entry : deletes.entrySet()) {
            String collection = entry.getKey();
            for (String documentId : entry.getValue()) {
                try {
                    DeleteOutcome outcome = indexClient.delete(collection, documentId);
                    if (outcome == DeleteOutcome.NOT_FOUND) {
                        logger.log(Level.FINE, "Document {0} already absent from ''{1}''",
                            new Object[] {documentId, collection});
                    }
                    deleted++;
                } catch (RuntimeException e) {
                    failures++;
                    logger.log(Level.SEVERE, "Error deleting document " + documentId + " from '" + collection + "'", e);
                }
            }
        }
        if (failures > 0) {
            throw new ReconcileException(failures + " delete failure(s)");
        }
        return deleted;
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Rollback failed", e);
        }
    }

    private static void close(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to close connection", e);
        }
    }

    private record BatchReport(int acknowledged, int upserted, int deleted, int skipped,
                               int unknownTableEntries, int retained) {
    }

    private static final class Totals {
        private int batches;
        private long processed;
        private long upserted;
        private long deleted;
        private long skipped;
        private long unknown;
        private long retained;

        void add(BatchReport report) {
            batches++;
            processed += report.acknowledged();
            upserted += report.upserted();
            deleted += report.deleted();
            skipped += report.skipped();
            unknown += report.unknownTableEntries();
            retained += report.retained();
        }

        SyncResult toResult(boolean success, String error) {
            return new SyncResult(success, batches, processed, upserted, deleted, skipped, unknown, retained, error);
        }
    }

    /**
     * Builder for {@link SyncEngine}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ChangeQueue changeQueue;
        private RowFetcher rowFetcher;
        private IndexClient indexClient;
        private TableMappingRegistry tables;
        private DocumentPipeline pipeline;
        private SyncMetrics metrics;
        private int batchSize = 100;
        private TransformFailurePolicy transformFailurePolicy;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b> Source of the one connection each run works on.
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder changeQueue(ChangeQueue changeQueue) {
            this.changeQueue = changeQueue;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder rowFetcher(RowFetcher rowFetcher) {
            this.rowFetcher = rowFetcher;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder indexClient(IndexClient indexClient) {
            this.indexClient = indexClient;
            return this;
        }

        /**
         * <b>Required.</b> The tracked tables; must not be empty.
         */
        public Builder tables(TableMappingRegistry tables) {
            this.tables = tables;
            return this;
        }

        /**
         * Optional. Defaults to a pipeline reading naive timestamps as UTC.
         */
        public Builder pipeline(DocumentPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        /**
         * Optional. Defaults to {@link SyncMetrics#NOOP}.
         */
        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to {@code 100}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Optional. Defaults to {@link TransformFailurePolicy#ACKNOWLEDGE}.
         */
        public Builder transformFailurePolicy(TransformFailurePolicy transformFailurePolicy) {
            this.transformFailurePolicy = transformFailurePolicy;
            return this;
        }

        /**
         * Optional. Used for lag measurement; defaults to the system UTC clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SyncEngine build() {
            return new SyncEngine(this);
        }
    }
}
