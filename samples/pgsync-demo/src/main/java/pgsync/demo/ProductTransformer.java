package pgsync.demo;

import pgsync.mapping.RowTransformer;
import pgsync.spring.boot.SyncTransformer;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shapes {@code products} rows: renames {@code name} to {@code product_name}, flags cheap
 * products as on sale and fills defaults for the optional facets.
 *
 * <p>Defaults replace absent and null values alike. A price that is neither a number
 * nor numeric text rejects the row.
 */
@Component
@SyncTransformer("transform_product")
public class ProductTransformer implements RowTransformer {

  static final double SALE_THRESHOLD = 10.0;

  private final Clock clock;

  public ProductTransformer() {
    this(Clock.systemUTC());
  }

  ProductTransformer(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Map<String, Object> transform(Map<String, Object> row) {
    if (row.containsKey("name")) {
      row.put("product_name", row.remove("name"));
    }
    row.put("is_on_sale", price(row.get("price")) < SALE_THRESHOLD);

    defaultIfNull(row, "category", "Uncategorized");
    defaultIfNull(row, "brand", "Generic");
    defaultIfNull(row, "stock_quantity", 0);
    row.put("tags", tags(row.get("tags")));
    // date-typed, converted to epoch seconds downstream
    defaultIfNull(row, "created_at", clock.instant());
    return row;
  }

  /** Missing price counts as zero. */
  static double price(Object value) {
    if (value == null) {
      return 0.0;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof String s) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("price is not a number: '" + s + "'", e);
      }
    }
    throw new IllegalArgumentException("price is not a number: " + value.getClass().getSimpleName());
  }

  private static void defaultIfNull(Map<String, Object> row, String key, Object value) {
    if (row.get(key) == null) {
      row.put(key, value);
    }
  }

  static List<String> tags(Object value) {
    List<String> tags = new ArrayList<>();
    if (value instanceof String s) {
      for (String tag : s.split(",")) {
        if (!tag.isBlank()) {
          tags.add(tag.trim());
        }
      }
    } else if (value instanceof List<?> list) {
      for (Object tag : list) {
        if (tag != null) {
          tags.add(tag.toString());
        }
      }
    }
    return tags;
  }
}
