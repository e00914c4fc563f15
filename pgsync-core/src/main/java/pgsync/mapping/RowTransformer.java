package pgsync.mapping;

import java.util.Map;

/**
 * Per-table hook applied to a freshly fetched row before aliasing and pruning.
 *
 * <p>The row is keyed by source column name and is mutable; implementations may
 * rename keys, derive new fields or set defaults, and return either the same map or
 * a new one. Implementations must not perform I/O. Any exception thrown is treated
 * as a failure of that single record.
 */
@FunctionalInterface
public interface RowTransformer {

  /**
   * Transformer that returns the row unchanged.
   */
  RowTransformer IDENTITY = row -> row;

  Map<String, Object> transform(Map<String, Object> row);
}
