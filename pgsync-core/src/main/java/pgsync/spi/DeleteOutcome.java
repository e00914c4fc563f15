package pgsync.spi;

/**
 * Result of a single document delete. Both outcomes count as success.
 */
public enum DeleteOutcome {
    DELETED,
    NOT_FOUND
}
