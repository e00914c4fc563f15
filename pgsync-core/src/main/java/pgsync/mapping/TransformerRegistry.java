package pgsync.mapping;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named {@link RowTransformer}s that table mappings refer to by identifier.
 *
 * <p>Lookups fail fast: a mapping naming an unregistered transformer is rejected
 * when the registry is resolved, not when the first row arrives.
 *
 * <pre>{@code
 * TransformerRegistry transformers = new TransformerRegistry()
 *     .register("transform_product", new ProductTransformer())
 *     .register("transform_user", row -> { row.putIfAbsent("status", "active"); return row; });
 * }</pre>
 */
public final class TransformerRegistry {
  private final Map<String, RowTransformer> transformers = new ConcurrentHashMap<>();

  /**
   * @throws IllegalStateException if another transformer is already registered under {@code name}
   */
  public TransformerRegistry register(String name, RowTransformer transformer) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(transformer, "transformer");
    RowTransformer previous = transformers.putIfAbsent(name, transformer);
    if (previous != null && previous != transformer) {
      throw new IllegalStateException("Transformer already registered: " + name);
    }
    return this;
  }

  /**
   * Resolves a transformer by name. A {@code null} or empty name yields
   * {@link RowTransformer#IDENTITY}.
   *
   * @throws IllegalArgumentException if the name is not registered
   */
  public RowTransformer resolve(String name) {
    if (name == null || name.isEmpty()) {
      return RowTransformer.IDENTITY;
    }
    RowTransformer transformer = transformers.get(name);
    if (transformer == null) {
      throw new IllegalArgumentException("Unknown transformer '" + name + "'. Registered: " + names());
    }
    return transformer;
  }

  public Set<String> names() {
    return new TreeSet<>(transformers.keySet());
  }
}
