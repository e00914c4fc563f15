package pgsync.sync;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.model.QueueEntry;

/**
 * Claimed entries reduced to one operation per record.
 *
 * <p>For every {@code (recordId, tableName)} the entry with the greatest
 * {@code (createdAt, id)} wins; records keep the order in which they first appear in
 * the claim. Upserts are grouped by table for fetching, deletes by collection.
 */
final class BatchPlan {
    static final Comparator<QueueEntry> LATEST =
        Comparator.comparing(QueueEntry::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(QueueEntry::id);

    private final List<QueueEntry> claimed;
    private final Map<RecordKey, QueueEntry> latest;
    private final Map<RecordKey, List<Long>> entryIds;
    private final Map<String, List<String>> fetchesByTable;
    private final Map<String, List<String>> deletesByCollection;
    private final int unknownTableEntries;

    private BatchPlan(List<QueueEntry> claimed, TableMappingRegistry tables) {
        this.claimed = List.copyOf(claimed);
        this.latest = new LinkedHashMap<>();
        this.entryIds = new LinkedHashMap<>();
        for (QueueEntry entry : claimed) {
            RecordKey key = new RecordKey(entry.recordId(), entry.tableName());
            latest.merge(key, entry, (current, candidate) -> LATEST.compare(candidate, current) > 0 ? candidate : current);
            entryIds.computeIfAbsent(key, k -> new ArrayList<>()).add(entry.id());
        }

        this.fetchesByTable = new LinkedHashMap<>();
        this.deletesByCollection = new LinkedHashMap<>();
        int unknown = 0;
        for (QueueEntry entry : latest.values()) {
            TableMapping mapping = tables.get(entry.tableName());
            if (mapping == null) {
                unknown += entryIds.get(new RecordKey(entry.recordId(), entry.tableName())).size();
                continue;
            }
            if (entry.operationType().isUpsert()) {
                fetchesByTable.computeIfAbsent(mapping.name(), k -> new ArrayList<>()).add(entry.recordId());
            } else {
                deletesByCollection.computeIfAbsent(mapping.collection(), k -> new ArrayList<>()).add(entry.recordId());
            }
        }
        this.unknownTableEntries = unknown;
    }

    static BatchPlan of(List<QueueEntry> claimed, TableMappingRegistry tables) {
        return new BatchPlan(claimed, tables);
    }

    List<QueueEntry> claimed() {
        return claimed;
    }

    /** Surviving entry per record, in first-appearance order. */
    List<QueueEntry> latest() {
        return List.copyOf(latest.values());
    }

    int recordCount() {
        return latest.size();
    }

    /** Record ids to fetch, by table name. */
    Map<String, List<String>> fetchesByTable() {
        return fetchesByTable;
    }

    /** Record ids to delete, by collection name. */
    Map<String, List<String>> deletesByCollection() {
        return deletesByCollection;
    }

    /** Claimed entries (not records) whose table has no mapping. */
    int unknownTableEntries() {
        return unknownTableEntries;
    }

    /** All claimed queue ids for one record. */
    List<Long> entryIds(String tableName, String recordId) {
        List<Long> ids = entryIds.get(new RecordKey(recordId, tableName));
        return ids == null ? List.of() : ids;
    }

    private record RecordKey(String recordId, String tableName) {
    }
}
