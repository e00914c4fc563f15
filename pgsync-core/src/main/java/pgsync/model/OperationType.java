package pgsync.model;

import java.util.Locale;

/**
 * Row mutation recorded by the change-capture trigger.
 */
public enum OperationType {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses the code stored in the {@code operation_type} column (trigger {@code TG_OP}).
     *
     * @throws IllegalArgumentException if the code is not one of INSERT, UPDATE, DELETE
     */
    public static OperationType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("operation_type must not be null");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Whether this operation requires re-reading the row and upserting it.
     */
    public boolean isUpsert() {
        return this != DELETE;
    }
}
