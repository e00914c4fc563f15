package pgsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time snapshot of the change queue.
 *
 * @param queueExists whether the queue table exists at all
 * @param depth       total pending entries
 * @param oldest      {@code created_at} of the oldest entry, {@code null} when empty
 * @param newest      {@code created_at} of the newest entry, {@code null} when empty
 * @param breakdown   table name → operation → pending count, ordered by table then operation
 */
public record QueueStatus(
    boolean queueExists,
    long depth,
    Instant oldest,
    Instant newest,
    Map<String, Map<OperationType, Long>> breakdown
) {
    public QueueStatus {
        Objects.requireNonNull(breakdown, "breakdown");
        Map<String, Map<OperationType, Long>> copy = new LinkedHashMap<>();
        breakdown.forEach((table, ops) -> copy.put(table, Collections.unmodifiableMap(new LinkedHashMap<>(ops))));
        breakdown = Collections.unmodifiableMap(copy);
    }

    /**
     * Status reported when the queue table has not been created yet.
     */
    public static QueueStatus missing() {
        return new QueueStatus(false, 0L, null, null, Map.of());
    }

    public boolean isEmpty() {
        return depth == 0L;
    }
}
