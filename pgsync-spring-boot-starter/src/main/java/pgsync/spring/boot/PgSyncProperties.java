package pgsync.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import pgsync.jdbc.TableNames;
import pgsync.sync.TransformFailurePolicy;
import pgsync.typesense.TypesenseConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the sync engine.
 *
 * <pre>{@code
 * pgsync:
 *   typesense:
 *     host: localhost
 *     api-key: ${TYPESENSE_API_KEY}
 *   tables:
 *     - name: products
 *       collection: products
 *       transformer: products
 *       schema:
 *         - name: id
 *           type: string
 *         - name: price
 *           type: float
 *           sort: true
 * }</pre>
 *
 * @see PgSyncAutoConfiguration
 * @see TableMappings
 */
@ConfigurationProperties(prefix = "pgsync")
public class PgSyncProperties {

  /**
   * Change queue table written by the triggers.
   */
  private String queueTable = TableNames.DEFAULT_QUEUE_TABLE;

  /**
   * Maximum queue entries claimed per batch.
   */
  private int batchSize = 100;

  /**
   * Zone used to read timestamps without offset.
   */
  private String timezone = "UTC";

  /**
   * What happens to queue entries of records whose transformation fails.
   */
  private TransformFailurePolicy transformFailurePolicy = TransformFailurePolicy.ACKNOWLEDGE;

  private List<Table> tables = new ArrayList<>();

  private final Typesense typesense = new Typesense();
  private final Metrics metrics = new Metrics();

  public String getQueueTable() {
    return queueTable;
  }

  public void setQueueTable(String queueTable) {
    this.queueTable = queueTable;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public String getTimezone() {
    return timezone;
  }

  public void setTimezone(String timezone) {
    this.timezone = timezone;
  }

  public TransformFailurePolicy getTransformFailurePolicy() {
    return transformFailurePolicy;
  }

  public void setTransformFailurePolicy(TransformFailurePolicy transformFailurePolicy) {
    this.transformFailurePolicy = transformFailurePolicy;
  }

  public List<Table> getTables() {
    return tables;
  }

  public void setTables(List<Table> tables) {
    this.tables = tables;
  }

  public Typesense getTypesense() {
    return typesense;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Typesense {
    private String host;
    private int port = TypesenseConfig.DEFAULT_PORT;
    private String protocol = "http";
    private String apiKey;
    private Duration connectionTimeout = TypesenseConfig.DEFAULT_TIMEOUT;

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getProtocol() {
      return protocol;
    }

    public void setProtocol(String protocol) {
      this.protocol = protocol;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public Duration getConnectionTimeout() {
      return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
    }

    TypesenseConfig toConfig() {
      if (host == null || host.isBlank()) {
        throw new IllegalStateException("Missing Typesense host; set pgsync.typesense.host (PGSYNC_TYPESENSE_HOST)");
      }
      if (apiKey == null || apiKey.isBlank()) {
        throw new IllegalStateException("Missing Typesense API key; set pgsync.typesense.api-key (PGSYNC_TYPESENSE_API_KEY)");
      }
      return new TypesenseConfig(host, port, protocol, apiKey, connectionTimeout);
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "pgsync";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  /**
   * One tracked table or view.
   */
  public static class Table {
    private String name;
    private String collection;
    private String referenceTable;
    private String primaryKey = "id";
    private String transformer;
    private String defaultSortingField;
    private List<String> tokenSeparators;
    private List<String> symbolsToIndex;
    private List<Field> schema;

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getCollection() {
      return collection;
    }

    public void setCollection(String collection) {
      this.collection = collection;
    }

    public String getReferenceTable() {
      return referenceTable;
    }

    public void setReferenceTable(String referenceTable) {
      this.referenceTable = referenceTable;
    }

    public String getPrimaryKey() {
      return primaryKey;
    }

    public void setPrimaryKey(String primaryKey) {
      this.primaryKey = primaryKey;
    }

    public String getTransformer() {
      return transformer;
    }

    public void setTransformer(String transformer) {
      this.transformer = transformer;
    }

    public String getDefaultSortingField() {
      return defaultSortingField;
    }

    public void setDefaultSortingField(String defaultSortingField) {
      this.defaultSortingField = defaultSortingField;
    }

    public List<String> getTokenSeparators() {
      return tokenSeparators;
    }

    public void setTokenSeparators(List<String> tokenSeparators) {
      this.tokenSeparators = tokenSeparators;
    }

    public List<String> getSymbolsToIndex() {
      return symbolsToIndex;
    }

    public void setSymbolsToIndex(List<String> symbolsToIndex) {
      this.symbolsToIndex = symbolsToIndex;
    }

    public List<Field> getSchema() {
      return schema;
    }

    public void setSchema(List<Field> schema) {
      this.schema = schema;
    }
  }

  /**
   * One collection field. Unset flags take the defaults documented on
   * {@link pgsync.mapping.FieldSpec}.
   */
  public static class Field {
    private String name;
    private String type;
    private String sourceColumn;
    private Boolean optional;
    private Boolean facet;
    private Boolean index;
    private Boolean sort;
    private Boolean infix;
    private Boolean stem;
    private Boolean store;
    private String locale;
    private Integer numDim;
    private Map<String, Object> embed;

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getSourceColumn() {
      return sourceColumn;
    }

    public void setSourceColumn(String sourceColumn) {
      this.sourceColumn = sourceColumn;
    }

    public Boolean getOptional() {
      return optional;
    }

    public void setOptional(Boolean optional) {
      this.optional = optional;
    }

    public Boolean getFacet() {
      return facet;
    }

    public void setFacet(Boolean facet) {
      this.facet = facet;
    }

    public Boolean getIndex() {
      return index;
    }

    public void setIndex(Boolean index) {
      this.index = index;
    }

    public Boolean getSort() {
      return sort;
    }

    public void setSort(Boolean sort) {
      this.sort = sort;
    }

    public Boolean getInfix() {
      return infix;
    }

    public void setInfix(Boolean infix) {
      this.infix = infix;
    }

    public Boolean getStem() {
      return stem;
    }

    public void setStem(Boolean stem) {
      this.stem = stem;
    }

    public Boolean getStore() {
      return store;
    }

    public void setStore(Boolean store) {
      this.store = store;
    }

    public String getLocale() {
      return locale;
    }

    public void setLocale(String locale) {
      this.locale = locale;
    }

    public Integer getNumDim() {
      return numDim;
    }

    public void setNumDim(Integer numDim) {
      this.numDim = numDim;
    }

    public Map<String, Object> getEmbed() {
      return embed;
    }

    public void setEmbed(Map<String, Object> embed) {
      this.embed = embed;
    }
  }
}
