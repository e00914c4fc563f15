package pgsync.provision;

import org.junit.jupiter.api.Test;
import pgsync.document.Document;
import pgsync.mapping.FieldSpec;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.spi.CollectionInfo;
import pgsync.spi.DeleteOutcome;
import pgsync.spi.ImportResult;
import pgsync.spi.IndexClient;
import pgsync.spi.IndexClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionProvisionerTest {

  private final TableMappingRegistry tables = TableMappingRegistry.of(
      TableMapping.builder("products")
          .collection("products")
          .field(FieldSpec.builder("id").type("string").build())
          .field(FieldSpec.builder("price").type("float").build())
          .field(FieldSpec.builder("created_at").type("date").build())
          .build(),
      TableMapping.builder("users")
          .collection("users")
          .field(FieldSpec.builder("id").type("string").build())
          .build());

  @Test
  void createsMissingCollections() {
    SchemaIndexClient index = new SchemaIndexClient();

    ProvisionReport report = new CollectionProvisioner(index).provision(tables, false);

    assertEquals(List.of("products", "users"), report.created());
    assertEquals(List.of("products", "users"), index.createdCollections);
  }

  @Test
  void validatesMatchingCollectionAndReportsDifferences() {
    SchemaIndexClient index = new SchemaIndexClient();
    index.existing.put("products", new CollectionInfo("products", 3,
        Map.of("id", "string", "price", "int32")));
    index.existing.put("users", new CollectionInfo("users", 1, Map.of("id", "string")));

    ProvisionReport report = new CollectionProvisioner(index).provision(tables, false);

    assertTrue(report.created().isEmpty());
    assertEquals(List.of("users"), report.validated());
    assertEquals(List.of(
        "field 'price' is int32, expected float",
        "missing field 'created_at'"), report.differences().get("products"));
    assertTrue(index.deletedCollections.isEmpty());
  }

  @Test
  void recreateDropsAndCreatesExistingCollections() {
    SchemaIndexClient index = new SchemaIndexClient();
    index.existing.put("users", new CollectionInfo("users", 10, Map.of("id", "string")));

    ProvisionReport report = new CollectionProvisioner(index).provision(tables, true);

    assertEquals(List.of("users"), report.recreated());
    assertEquals(List.of("users"), index.deletedCollections);
    assertEquals(List.of("products", "users"), report.created());
  }

  @Test
  void unreadableCollectionListIsTreatedAsEmpty() {
    SchemaIndexClient index = new SchemaIndexClient();
    index.listFailure = new IndexClientException("unauthorized", 401);

    ProvisionReport report = new CollectionProvisioner(index).provision(tables, false);

    assertEquals(2, report.created().size());
  }

  @Test
  void creationFailurePropagates() {
    SchemaIndexClient index = new SchemaIndexClient();
    index.createFailure = new IndexClientException("bad schema", 400);

    assertThrows(IndexClientException.class, () -> new CollectionProvisioner(index).provision(tables, false));
  }

  private static final class SchemaIndexClient implements IndexClient {
    final Map<String, CollectionInfo> existing = new LinkedHashMap<>();
    final List<String> createdCollections = new ArrayList<>();
    final List<String> deletedCollections = new ArrayList<>();
    IndexClientException listFailure;
    IndexClientException createFailure;

    @Override
    public List<ImportResult> upsert(String collection, List<Document> documents) {
      throw new UnsupportedOperationException();
    }

    @Override
    public DeleteOutcome delete(String collection, String documentId) {
      throw new UnsupportedOperationException();
    }

    @Override
    public Map<String, CollectionInfo> collections() {
      if (listFailure != null) {
        throw listFailure;
      }
      return existing;
    }

    @Override
    public void createCollection(TableMapping table) {
      if (createFailure != null) {
        throw createFailure;
      }
      createdCollections.add(table.collection());
    }

    @Override
    public void deleteCollection(String collection) {
      deletedCollections.add(collection);
      existing.remove(collection);
    }
  }
}
