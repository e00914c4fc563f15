package pgsync.demo;

import pgsync.mapping.RowTransformer;
import pgsync.spring.boot.SyncTransformer;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shapes {@code users} rows: derives {@code full_name} and fills account defaults.
 */
@Component
@SyncTransformer("transform_user")
public class UserTransformer implements RowTransformer {

  private final Clock clock;

  public UserTransformer() {
    this(Clock.systemUTC());
  }

  UserTransformer(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Map<String, Object> transform(Map<String, Object> row) {
    if (row.get("full_name") == null) {
      row.put("full_name", fullName(row));
    }
    row.putIfAbsent("account_type", "free");
    row.putIfAbsent("status", "active");
    Object roles = row.get("roles");
    row.put("roles", roles == null ? List.of("user") : ProductTransformer.tags(roles));
    row.putIfAbsent("registered_at", clock.instant());
    row.putIfAbsent("is_verified", false);
    return row;
  }

  private static String fullName(Map<String, Object> row) {
    Object first = row.get("first_name");
    Object last = row.get("last_name");
    if (first != null && last != null) {
      return first + " " + last;
    }
    Object username = row.get("username");
    if (username != null) {
      return username.toString().toUpperCase(Locale.ROOT);
    }
    return "Unknown User";
  }
}
