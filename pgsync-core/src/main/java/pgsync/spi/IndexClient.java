package pgsync.spi;

import java.util.List;
import java.util.Map;

import pgsync.document.Document;
import pgsync.mapping.TableMapping;

/**
 * Target search index operations.
 *
 * <p>Document writes are idempotent: upsert replaces a document by id and deleting a
 * missing document is not an error. Failures are reported as {@link IndexClientException}.
 * The Typesense implementation lives in the {@code pgsync-typesense} module.
 */
public interface IndexClient {

    /**
     * Bulk upserts documents into a collection.
     *
     * @return one result per document, in request order
     */
    List<ImportResult> upsert(String collection, List<Document> documents);

    /**
     * Deletes one document by id.
     */
    DeleteOutcome delete(String collection, String documentId);

    /**
     * Lists existing collections by name.
     */
    Map<String, CollectionInfo> collections();

    /**
     * Creates the collection of {@code table} from its schema.
     */
    void createCollection(TableMapping table);

    /**
     * Drops a collection and all of its documents.
     */
    void deleteCollection(String collection);
}
