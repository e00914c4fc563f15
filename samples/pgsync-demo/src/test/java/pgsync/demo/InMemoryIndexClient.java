package pgsync.demo;

import pgsync.document.Document;
import pgsync.mapping.TableMapping;
import pgsync.spi.CollectionInfo;
import pgsync.spi.DeleteOutcome;
import pgsync.spi.ImportResult;
import pgsync.spi.IndexClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class InMemoryIndexClient implements IndexClient {
  final Map<String, Map<String, Document>> collections = new LinkedHashMap<>();

  @Override
  public List<ImportResult> upsert(String collection, List<Document> documents) {
    List<ImportResult> results = new ArrayList<>();
    for (Document doc : documents) {
      collections.computeIfAbsent(collection, k -> new LinkedHashMap<>()).put(doc.id(), doc);
      results.add(ImportResult.ok(doc.id()));
    }
    return results;
  }

  @Override
  public DeleteOutcome delete(String collection, String documentId) {
    Map<String, Document> docs = collections.get(collection);
    return docs != null && docs.remove(documentId) != null ? DeleteOutcome.DELETED : DeleteOutcome.NOT_FOUND;
  }

  @Override
  public Map<String, CollectionInfo> collections() {
    Map<String, CollectionInfo> out = new LinkedHashMap<>();
    collections.forEach((name, docs) -> out.put(name, new CollectionInfo(name, docs.size(), Map.of())));
    return out;
  }

  @Override
  public void createCollection(TableMapping table) {
    collections.putIfAbsent(table.collection(), new LinkedHashMap<>());
  }

  @Override
  public void deleteCollection(String collection) {
    collections.remove(collection);
  }
}
