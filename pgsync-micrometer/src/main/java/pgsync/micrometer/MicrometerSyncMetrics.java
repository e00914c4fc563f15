package pgsync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import pgsync.spi.SyncMetrics;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link SyncMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pgsync.batch.success}: committed batches</li>
 *   <li>{@code pgsync.batch.failure}: rolled back batches</li>
 *   <li>{@code pgsync.entries.acknowledged}: queue entries removed after being applied</li>
 *   <li>{@code pgsync.documents.upserted}: documents sent for upsert</li>
 *   <li>{@code pgsync.documents.deleted}: documents deleted from the index</li>
 *   <li>{@code pgsync.records.skipped}: records whose transformation failed</li>
 *   <li>{@code pgsync.entries.unknown-table}: entries for unmapped tables</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code pgsync.queue.depth}: pending entries at the start of the latest run</li>
 *   <li>{@code pgsync.lag.oldest.ms}: age of the oldest entry in the latest batch</li>
 * </ul>
 *
 * @see SyncMetrics
 */
public final class MicrometerSyncMetrics implements SyncMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter batchSuccess;
  private final Counter batchFailure;
  private final Counter acknowledged;
  private final Counter upserted;
  private final Counter deleted;
  private final Counter skipped;
  private final Counter unknownTable;
  private final Gauge depthGauge;
  private final Gauge lagGauge;

  private final AtomicLong queueDepth = new AtomicLong();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "pgsync"}.
   */
  public MicrometerSyncMetrics(MeterRegistry registry) {
    this(registry, "pgsync");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "catalog.pgsync"})
   */
  public MicrometerSyncMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.batchSuccess = counter(namePrefix + ".batch.success", "Batches committed");
    this.batchFailure = counter(namePrefix + ".batch.failure", "Batches rolled back");
    this.acknowledged = counter(namePrefix + ".entries.acknowledged", "Queue entries acknowledged");
    this.upserted = counter(namePrefix + ".documents.upserted", "Documents upserted");
    this.deleted = counter(namePrefix + ".documents.deleted", "Documents deleted");
    this.skipped = counter(namePrefix + ".records.skipped", "Records skipped after a transformation failure");
    this.unknownTable = counter(namePrefix + ".entries.unknown-table", "Entries acknowledged for unmapped tables");

    this.depthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicLong::get)
        .description("Pending queue entries")
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .description("Age of the oldest claimed entry in milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementBatchSuccess() {
    if (closed) return;
    batchSuccess.increment();
  }

  @Override
  public void incrementBatchFailure() {
    if (closed) return;
    batchFailure.increment();
  }

  @Override
  public void addAcknowledged(int count) {
    if (closed) return;
    acknowledged.increment(count);
  }

  @Override
  public void addUpserted(int count) {
    if (closed) return;
    upserted.increment(count);
  }

  @Override
  public void addDeleted(int count) {
    if (closed) return;
    deleted.increment(count);
  }

  @Override
  public void incrementRecordSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementUnknownTable() {
    if (closed) return;
    unknownTable.increment();
  }

  @Override
  public void recordQueueDepth(long depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(batchSuccess, batchFailure, acknowledged, upserted, deleted,
        skipped, unknownTable, depthGauge, lagGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
