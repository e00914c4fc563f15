package pgsync.spi;

/**
 * Per-document outcome of a bulk upsert, in request order.
 *
 * @param success    whether the index accepted the document
 * @param documentId id of the document, when the index reports it
 * @param error      error message for failed documents
 */
public record ImportResult(boolean success, String documentId, String error) {

    public static ImportResult ok(String documentId) {
        return new ImportResult(true, documentId, null);
    }

    public static ImportResult failed(String documentId, String error) {
        return new ImportResult(false, documentId, error);
    }
}
