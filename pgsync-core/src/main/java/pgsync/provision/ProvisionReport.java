package pgsync.provision;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link CollectionProvisioner#provision}.
 *
 * @param created     collections created
 * @param validated   existing collections whose fields match the mapping
 * @param recreated   collections dropped before being created again
 * @param differences per existing collection, human-readable schema differences
 */
public record ProvisionReport(
    List<String> created,
    List<String> validated,
    List<String> recreated,
    Map<String, List<String>> differences) {

    public ProvisionReport {
        created = List.copyOf(created);
        validated = List.copyOf(validated);
        recreated = List.copyOf(recreated);
        differences = Map.copyOf(differences);
    }
}
