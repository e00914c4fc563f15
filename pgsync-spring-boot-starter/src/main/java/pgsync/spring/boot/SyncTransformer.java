package pgsync.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers a Spring bean as a named row transformer.
 *
 * <p>The annotated bean must implement {@link pgsync.mapping.RowTransformer}. Tables
 * refer to it by name through {@code pgsync.tables[].transformer}.
 *
 * <pre>{@code
 * @Component
 * @SyncTransformer("products")
 * public class ProductTransformer implements RowTransformer {
 *   public Map<String, Object> transform(Map<String, Object> row) { ... }
 * }
 * }</pre>
 *
 * @see SyncTransformerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SyncTransformer {

  /**
   * Name tables use to select this transformer.
   */
  String value();
}
