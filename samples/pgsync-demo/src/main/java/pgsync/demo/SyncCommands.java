package pgsync.demo;

import pgsync.jdbc.ChangeQueueException;
import pgsync.jdbc.PostgresSyncInstaller;
import pgsync.jdbc.QueueBackfill;
import pgsync.jdbc.SetupReport;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.model.OperationType;
import pgsync.model.QueueStatus;
import pgsync.provision.CollectionProvisioner;
import pgsync.provision.ProvisionReport;
import pgsync.spi.CollectionInfo;
import pgsync.spi.IndexClient;
import pgsync.spi.IndexClientException;
import pgsync.spi.RowFetcher;
import pgsync.sync.SyncEngine;
import pgsync.sync.SyncResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * The setup, sync and status commands. Each returns {@code true} on success and
 * reports progress through the log.
 */
@Component
public class SyncCommands {

  private static final Logger log = LoggerFactory.getLogger(SyncCommands.class);

  private final DataSource dataSource;
  private final SyncEngine engine;
  private final PostgresSyncInstaller installer;
  private final CollectionProvisioner provisioner;
  private final QueueBackfill backfill;
  private final RowFetcher rowFetcher;
  private final IndexClient indexClient;

  public SyncCommands(DataSource dataSource, SyncEngine engine, PostgresSyncInstaller installer,
      CollectionProvisioner provisioner, QueueBackfill backfill, RowFetcher rowFetcher,
      IndexClient indexClient) {
    this.dataSource = dataSource;
    this.engine = engine;
    this.installer = installer;
    this.provisioner = provisioner;
    this.backfill = backfill;
    this.rowFetcher = rowFetcher;
    this.indexClient = indexClient;
  }

  /**
   * Installs the queue and triggers, provisions collections and optionally enqueues
   * every existing row. Stops at the first failing step.
   */
  public boolean setup(TableMappingRegistry tables, boolean recreate, boolean backfillQueue) {
    log.info("Starting setup for tables {}", tables.names());
    try (Connection conn = dataSource.getConnection()) {
      SetupReport report = installer.install(conn, tables);
      log.info("Database objects ready: queue created={}, triggers created={}, already present={}",
          report.queueCreated(), report.triggersCreated(), report.triggersExisting());
    } catch (SQLException | ChangeQueueException | IllegalStateException e) {
      log.error("Failed to set up database objects: {}", e.getMessage(), e);
      return false;
    }

    try {
      ProvisionReport report = provisioner.provision(tables, recreate);
      log.info("Collections ready: created={}, recreated={}, validated={}",
          report.created(), report.recreated(), report.validated());
      report.differences().forEach((collection, diff) ->
          log.warn("Collection '{}' differs from its mapping (not altered): {}", collection, diff));
    } catch (IndexClientException e) {
      log.error("Failed to set up Typesense collections: {}", e.getMessage(), e);
      return false;
    }

    if (backfillQueue) {
      try (Connection conn = dataSource.getConnection()) {
        Map<String, Integer> queued = backfill.run(conn, tables);
        log.info("Backfill queued {}", queued);
      } catch (SQLException e) {
        log.error("Failed during queue backfill: {}", e.getMessage(), e);
        return false;
      }
    } else {
      log.info("Queue backfill skipped (use --backfill-queue to enable)");
    }
    log.info("Setup completed successfully");
    return true;
  }

  public boolean sync(TableMappingRegistry tables, int batchSize) {
    log.info("Syncing tables {} with batch size {}", tables.names(), batchSize);
    SyncResult result = engine.sync(tables.names(), batchSize);
    if (result.success()) {
      log.info("Sync completed: {} batches, {} entries, {} upserted, {} deleted, {} skipped",
          result.batches(), result.processed(), result.upserted(), result.deleted(), result.skipped());
    } else {
      log.error("Sync failed after {} committed batches ({} entries): {}",
          result.batches(), result.processed(), result.error());
    }
    if (result.retained() > 0) {
      log.warn("{} entries left in the queue after transformation failures", result.retained());
    }
    return result.success();
  }

  /**
   * Logs queue statistics followed by one line per table with its source row count,
   * trigger state and collection document count.
   */
  public boolean status(TableMappingRegistry tables) {
    QueueStatus queue;
    try {
      queue = engine.status();
    } catch (IllegalStateException e) {
      log.error("Could not read the sync queue: {}", e.getMessage(), e);
      return false;
    }
    if (!queue.queueExists()) {
      log.warn("Sync queue table does not exist. Run 'setup' to initialize the sync infrastructure");
    } else if (queue.isEmpty()) {
      log.info("Queue is empty (no pending jobs)");
    } else {
      log.info("Pending jobs: {} (oldest {}, newest {})", queue.depth(), queue.oldest(), queue.newest());
      for (Map.Entry<String, Map<OperationType, Long>> entry : queue.breakdown().entrySet()) {
        log.info("  {}: {}", entry.getKey(), entry.getValue());
      }
    }

    Map<String, CollectionInfo> collections;
    try {
      collections = indexClient.collections();
    } catch (IndexClientException e) {
      log.warn("Could not retrieve collections: {}", e.getMessage());
      collections = Map.of();
    }

    try (Connection conn = dataSource.getConnection()) {
      for (TableMapping table : tables.all()) {
        log.info(describe(conn, table, collections));
      }
    } catch (SQLException e) {
      log.error("Database connection failed: {}", e.getMessage(), e);
      return false;
    }
    return true;
  }

  String describe(Connection conn, TableMapping table, Map<String, CollectionInfo> collections) {
    String rows;
    try {
      rows = rowFetcher.count(conn, table) + " source rows";
    } catch (ChangeQueueException e) {
      rows = "source rows unavailable";
    }
    String trigger;
    try {
      trigger = installer.triggerInstalled(conn, table) ? "trigger installed" : "trigger not found";
    } catch (ChangeQueueException e) {
      trigger = "trigger state unavailable";
    }
    CollectionInfo info = collections.get(table.collection());
    String documents = info == null ? "collection missing" : info.numDocuments() + " documents";
    return "Table '" + table.name() + "': " + rows + ", " + trigger
        + " -> '" + table.collection() + "': " + documents;
  }
}
