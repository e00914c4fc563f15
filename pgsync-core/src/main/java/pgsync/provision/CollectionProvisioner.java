package pgsync.provision;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import pgsync.mapping.FieldSpec;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.spi.CollectionInfo;
import pgsync.spi.IndexClient;
import pgsync.spi.IndexClientException;

/**
 * Makes sure every mapped collection exists in the index.
 *
 * <p>Missing collections are created from the mapping. Existing collections are left
 * alone: fields that are missing or typed differently are reported, never altered.
 * With {@code recreate}, existing collections are dropped and created again, losing
 * their documents.
 */
public final class CollectionProvisioner {
    private static final Logger logger = Logger.getLogger(CollectionProvisioner.class.getName());

    private final IndexClient indexClient;

    public CollectionProvisioner(IndexClient indexClient) {
        this.indexClient = Objects.requireNonNull(indexClient, "indexClient");
    }

    /**
     * @throws IndexClientException if a collection cannot be created
     */
    public ProvisionReport provision(TableMappingRegistry tables, boolean recreate) {
        Map<String, CollectionInfo> existing;
        try {
            existing = new LinkedHashMap<>(indexClient.collections());
        } catch (IndexClientException e) {
            logger.log(Level.WARNING, "Could not list existing collections; assuming none exist", e);
            existing = new LinkedHashMap<>();
        }

        List<String> created = new ArrayList<>();
        List<String> validated = new ArrayList<>();
        List<String> recreated = new ArrayList<>();
        Map<String, List<String>> differences = new LinkedHashMap<>();

        for (TableMapping table : tables.all()) {
            String collection = table.collection();
            CollectionInfo info = existing.get(collection);

            if (recreate && info != null) {
                try {
                    indexClient.deleteCollection(collection);
                    logger.log(Level.INFO, "Deleted collection ''{0}'' for recreation", collection);
                    recreated.add(collection);
                    info = null;
                } catch (IndexClientException e) {
                    logger.log(Level.WARNING, "Could not delete collection '" + collection + "'", e);
                }
            }

            if (info == null) {
                indexClient.createCollection(table);
                logger.log(Level.INFO, "Created collection ''{0}'' for table ''{1}''",
                    new Object[] {collection, table.name()});
                created.add(collection);
                continue;
            }

            List<String> diff = diff(table, info);
            if (diff.isEmpty()) {
                validated.add(collection);
                logger.log(Level.INFO, "Collection ''{0}'' matches its mapping", collection);
            } else {
                differences.put(collection, diff);
                logger.log(Level.WARNING, "Collection ''{0}'' differs from its mapping: {1}. "
                    + "Recreate it to apply the mapping.", new Object[] {collection, diff});
            }
        }
        return new ProvisionReport(created, validated, recreated, differences);
    }

    static List<String> diff(TableMapping table, CollectionInfo info) {
        List<String> out = new ArrayList<>();
        for (FieldSpec field : table.schema()) {
            String actual = info.fieldTypes().get(field.name());
            String expected = field.type().wireName();
            if (actual == null) {
                out.add("missing field '" + field.name() + "'");
            } else if (!actual.equals(expected)) {
                out.add("field '" + field.name() + "' is " + actual + ", expected " + expected);
            }
        }
        return out;
    }
}
