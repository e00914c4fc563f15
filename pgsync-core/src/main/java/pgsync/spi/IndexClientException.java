package pgsync.spi;

/**
 * Thrown when the search index rejects a request or cannot be reached.
 */
public class IndexClientException extends RuntimeException {
    private final int statusCode;

    public IndexClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public IndexClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return the HTTP status code, or {@code -1} when no response was received
     */
    public int statusCode() {
        return statusCode;
    }
}
