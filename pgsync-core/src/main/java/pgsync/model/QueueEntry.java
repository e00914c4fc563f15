package pgsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only view of one change queue row.
 *
 * <p>{@code tableName} is the logical tracked name. For view-backed sources it is
 * the view's name even though the trigger fired on the view's reference table.
 *
 * @param id            identifier assigned by the queue store, used to target deletion
 * @param recordId      primary key of the changed row, rendered as text
 * @param tableName     logical source name
 * @param operationType the mutation that was recorded
 * @param createdAt     enqueue time; defines claim order. {@code null} when the store
 *                      did not record one; such entries order after timestamped ones
 */
public record QueueEntry(
    long id,
    String recordId,
    String tableName,
    OperationType operationType,
    Instant createdAt
) {
    public QueueEntry {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(operationType, "operationType");
    }
}
