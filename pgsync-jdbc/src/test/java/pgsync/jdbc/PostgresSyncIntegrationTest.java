package pgsync.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import pgsync.document.DocValue;
import pgsync.jdbc.queue.PostgresChangeQueue;
import pgsync.mapping.FieldSpec;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.model.OperationType;
import pgsync.model.QueueEntry;
import pgsync.sync.SyncEngine;
import pgsync.sync.SyncResult;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresSyncIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("pgsync_test");

  private static PGSimpleDataSource dataSource;

  private final PostgresChangeQueue queue = new PostgresChangeQueue();
  private final PostgresSyncInstaller installer = new PostgresSyncInstaller();

  private final TableMapping products = TableMapping.builder("products")
      .collection("products")
      .field(FieldSpec.builder("id").type("string").build())
      .field(FieldSpec.builder("name").type("string").build())
      .field(FieldSpec.builder("price").type("float").build())
      .field(FieldSpec.builder("updated_at").type("date").build())
      .build();

  private final TableMapping authorView = TableMapping.builder("author_view")
      .collection("authors")
      .referenceTable("authors")
      .primaryKey("author_id")
      .field(FieldSpec.builder("id").type("string").sourceColumn("author_id").build())
      .field(FieldSpec.builder("display_name").type("string").build())
      .build();

  @BeforeAll
  static void initDataSource() {
    dataSource = new PGSimpleDataSource();
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
  }

  @BeforeEach
  void resetSchema() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("DROP SCHEMA public CASCADE");
      st.execute("CREATE SCHEMA public");
      st.execute("CREATE TABLE products (id SERIAL PRIMARY KEY, name TEXT NOT NULL, price NUMERIC(10, 2), "
          + "updated_at TIMESTAMPTZ DEFAULT NOW())");
      st.execute("CREATE TABLE authors (author_id INTEGER PRIMARY KEY, first_name TEXT, last_name TEXT)");
      st.execute("CREATE VIEW author_view AS SELECT author_id, first_name || ' ' || last_name AS display_name "
          + "FROM authors");
    }
  }

  @Test
  void installCreatesQueueFunctionsAndTriggers() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      SetupReport report = installer.install(conn, TableMappingRegistry.of(products, authorView));

      assertTrue(report.queueCreated());
      assertEquals(List.of("trigger_products_to_typesense", "trigger_authors_to_author_view_typesense"),
          report.triggersCreated());
      assertTrue(queue.exists(conn));
      assertTrue(installer.triggerExists(conn, "trigger_products_to_typesense", "products"));
      assertTrue(installer.triggerExists(conn, "trigger_authors_to_author_view_typesense", "authors"));
    }
  }

  @Test
  void triggerStateFollowsInstall() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      assertFalse(installer.triggerInstalled(conn, products));
      assertFalse(installer.triggerInstalled(conn, authorView));

      installer.install(conn, TableMappingRegistry.of(products, authorView));

      assertTrue(installer.triggerInstalled(conn, products));
      assertTrue(installer.triggerInstalled(conn, authorView));
    }
  }

  @Test
  void queueRejectsEntriesWithoutTimestamp() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      installer.install(conn, TableMappingRegistry.of(products));

      assertThrows(SQLException.class, () -> st.execute("INSERT INTO " + TableNames.DEFAULT_QUEUE_TABLE
          + " (record_id, table_name, operation_type, created_at) VALUES ('1', 'products', 'INSERT', NULL)"));
    }
  }

  @Test
  void fetchBindsTypedKeys() throws Exception {
    TableMapping stores = TableMapping.builder("stores")
        .collection("stores")
        .field(FieldSpec.builder("id").type("string").build())
        .field(FieldSpec.builder("opens_at").type("string").build())
        .build();
    String storeId = "1b4e28ba-2fa1-11d2-883f-0016d3cca427";
    JdbcRowFetcher fetcher = new JdbcRowFetcher();
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("INSERT INTO products (name, price) VALUES ('Widget', 5)");
      st.execute("CREATE TABLE stores (id UUID PRIMARY KEY, opens_at TIME)");
      st.execute("INSERT INTO stores VALUES ('" + storeId + "', '14:30:00')");

      assertEquals(List.of("1"), List.copyOf(fetcher.fetch(conn, products, List.of("1", "x", "99")).keySet()));
      Map<String, Map<String, Object>> rows = fetcher.fetch(conn, stores, List.of(storeId, "not-a-uuid"));
      assertEquals(LocalTime.of(14, 30), rows.get(storeId).get("opens_at"));
    }
  }

  @Test
  void installIsIdempotent() throws Exception {
    TableMappingRegistry tables = TableMappingRegistry.of(products, authorView);
    try (Connection conn = dataSource.getConnection()) {
      installer.install(conn, tables);
      SetupReport again = installer.install(conn, tables);

      assertFalse(again.queueCreated());
      assertTrue(again.triggersCreated().isEmpty());
      assertEquals(2, again.triggersExisting().size());
    }
  }

  @Test
  void installFailsWithoutChangesWhenSourceIsMissing() throws Exception {
    TableMapping orders = TableMapping.builder("orders")
        .collection("orders")
        .field(FieldSpec.builder("id").type("string").build())
        .build();
    try (Connection conn = dataSource.getConnection()) {
      IllegalStateException e = assertThrows(IllegalStateException.class,
          () -> installer.install(conn, TableMappingRegistry.of(products, orders)));

      assertTrue(e.getMessage().contains("orders"));
      assertFalse(queue.exists(conn));
      assertTrue(conn.getAutoCommit());
    }
  }

  @Test
  void installRejectsViewWithoutReferenceTable() throws Exception {
    TableMapping bareView = TableMapping.builder("author_view")
        .collection("authors")
        .primaryKey("author_id")
        .field(FieldSpec.builder("id").type("string").sourceColumn("author_id").build())
        .build();
    try (Connection conn = dataSource.getConnection()) {
      IllegalStateException e = assertThrows(IllegalStateException.class,
          () -> installer.install(conn, TableMappingRegistry.of(bareView)));
      assertTrue(e.getMessage().contains("reference table"));
    }
  }

  @Test
  void triggersRecordEveryMutation() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      installer.install(conn, TableMappingRegistry.of(products, authorView));

      st.execute("INSERT INTO products (name, price) VALUES ('Widget', 5)");
      st.execute("UPDATE products SET price = 6 WHERE id = 1");
      st.execute("DELETE FROM products WHERE id = 1");
      st.execute("INSERT INTO authors VALUES (7, 'Ada', 'Lovelace')");

      List<QueueEntry> entries = queue.claim(conn, List.of("products", "author_view"), 10);

      assertEquals(List.of(OperationType.INSERT, OperationType.UPDATE, OperationType.DELETE, OperationType.INSERT),
          entries.stream().map(QueueEntry::operationType).collect(Collectors.toList()));
      assertEquals("1", entries.get(2).recordId());
      assertEquals("products", entries.get(2).tableName());
      assertEquals("7", entries.get(3).recordId());
      assertEquals("author_view", entries.get(3).tableName());
    }
  }

  @Test
  void concurrentClaimsAreDisjoint() throws Exception {
    try (Connection setup = dataSource.getConnection(); Statement st = setup.createStatement()) {
      installer.install(setup, TableMappingRegistry.of(products));
      st.execute("INSERT INTO products (name, price) SELECT 'p' || g, g FROM generate_series(1, 6) g");
    }

    try (Connection first = dataSource.getConnection(); Connection second = dataSource.getConnection()) {
      first.setAutoCommit(false);
      second.setAutoCommit(false);

      List<QueueEntry> a = queue.claim(first, List.of("products"), 4);
      List<QueueEntry> b = queue.claim(second, List.of("products"), 10);

      assertEquals(4, a.size());
      assertEquals(2, b.size());
      Set<Long> ids = new HashSet<>();
      a.forEach(e -> ids.add(e.id()));
      b.forEach(e -> assertTrue(ids.add(e.id()), "entry claimed twice: " + e.id()));

      first.rollback();
      second.rollback();
    }
  }

  @Test
  void syncDrainsTriggerFedQueue() throws Exception {
    TableMappingRegistry tables = TableMappingRegistry.of(products, authorView);
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      installer.install(conn, tables);
      st.execute("INSERT INTO products (name, price) VALUES ('Widget', 5), ('Gadget', 12)");
      st.execute("DELETE FROM products WHERE name = 'Gadget'");
      st.execute("INSERT INTO authors VALUES (7, 'Ada', 'Lovelace')");
    }
    StubIndexClient index = new StubIndexClient();
    SyncEngine engine = SyncEngine.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .changeQueue(queue)
        .rowFetcher(new JdbcRowFetcher())
        .indexClient(index)
        .tables(tables)
        .build();

    SyncResult result = engine.sync();

    assertTrue(result.success());
    assertEquals(4, result.processed());
    assertEquals(DocValue.of("Widget"), index.document("products", "1").get("name"));
    assertEquals(DocValue.of(5.0), index.document("products", "1").get("price"));
    assertTrue(index.document("products", "1").get("updated_at") instanceof DocValue.Int);
    assertNull(index.document("products", "2"));
    assertEquals(DocValue.of("Ada Lovelace"), index.document("authors", "7").get("display_name"));
    assertEquals(0, engine.status().depth());
  }

  @Test
  void backfillQueuesExistingRows() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("INSERT INTO products (name, price) VALUES ('a', 1), ('b', 2)");
      st.execute("INSERT INTO authors VALUES (7, 'Ada', 'Lovelace')");
      installer.install(conn, TableMappingRegistry.of(products, authorView));

      Map<String, Integer> queued = new QueueBackfill(queue).run(conn, TableMappingRegistry.of(products, authorView));

      assertEquals(Map.of("products", 2, "author_view", 1), queued);
      assertEquals(3, queue.pendingCount(conn, List.of()));
    }
  }
}
