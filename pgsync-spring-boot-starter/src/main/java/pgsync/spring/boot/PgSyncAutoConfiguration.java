package pgsync.spring.boot;

import pgsync.jdbc.DataSourceConnectionProvider;
import pgsync.jdbc.JdbcRowFetcher;
import pgsync.jdbc.PostgresSyncInstaller;
import pgsync.jdbc.QueueBackfill;
import pgsync.jdbc.TableNames;
import pgsync.jdbc.queue.AbstractJdbcChangeQueue;
import pgsync.jdbc.queue.JdbcChangeQueues;
import pgsync.mapping.TableMappingRegistry;
import pgsync.mapping.TransformerRegistry;
import pgsync.provision.CollectionProvisioner;
import pgsync.spi.ConnectionProvider;
import pgsync.spi.IndexClient;
import pgsync.spi.RowFetcher;
import pgsync.spi.SyncMetrics;
import pgsync.sync.SyncEngine;
import pgsync.transform.DocumentPipeline;
import pgsync.typesense.TypesenseIndexClient;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Auto-configuration for the sync engine.
 *
 * <p>Wires a {@link SyncEngine} from a {@link DataSource} and {@link PgSyncProperties},
 * together with the setup helpers ({@link PostgresSyncInstaller}, {@link CollectionProvisioner},
 * {@link QueueBackfill}). Row transformers are picked up from beans annotated with
 * {@link SyncTransformer}.
 *
 * @see PgSyncProperties
 * @see PgSyncMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SyncEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(PgSyncProperties.class)
public class PgSyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcChangeQueue changeQueue(DataSource dataSource, PgSyncProperties props) {
    AbstractJdbcChangeQueue detected = JdbcChangeQueues.detect(dataSource);
    String queueTable = props.getQueueTable();
    if (!TableNames.DEFAULT_QUEUE_TABLE.equals(queueTable)) {
      return detected.withTableName(queueTable);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(RowFetcher.class)
  public JdbcRowFetcher rowFetcher() {
    return new JdbcRowFetcher();
  }

  @Bean
  @ConditionalOnMissingBean(IndexClient.class)
  public TypesenseIndexClient indexClient(PgSyncProperties props) {
    return new TypesenseIndexClient(props.getTypesense().toConfig());
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncTransformerRegistrar syncTransformerRegistrar(ListableBeanFactory beanFactory) {
    return new SyncTransformerRegistrar(beanFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public TransformerRegistry transformerRegistry(SyncTransformerRegistrar registrar) {
    return registrar.registry();
  }

  @Bean
  @ConditionalOnMissingBean
  public TableMappingRegistry tableMappingRegistry(PgSyncProperties props, TransformerRegistry transformers) {
    return TableMappings.build(props.getTables(), transformers);
  }

  @Bean
  @ConditionalOnMissingBean
  public DocumentPipeline documentPipeline(PgSyncProperties props) {
    try {
      return new DocumentPipeline(ZoneId.of(props.getTimezone()));
    } catch (DateTimeException e) {
      throw new IllegalStateException("Invalid pgsync.timezone: " + props.getTimezone(), e);
    }
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncEngine syncEngine(PgSyncProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcChangeQueue changeQueue,
      RowFetcher rowFetcher,
      IndexClient indexClient,
      TableMappingRegistry tables,
      DocumentPipeline pipeline,
      ObjectProvider<SyncMetrics> metricsProvider) {

    return SyncEngine.builder()
        .connectionProvider(connectionProvider)
        .changeQueue(changeQueue)
        .rowFetcher(rowFetcher)
        .indexClient(indexClient)
        .tables(tables)
        .pipeline(pipeline)
        .metrics(metricsProvider.getIfAvailable())
        .batchSize(props.getBatchSize())
        .transformFailurePolicy(props.getTransformFailurePolicy())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public CollectionProvisioner collectionProvisioner(IndexClient indexClient) {
    return new CollectionProvisioner(indexClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public PostgresSyncInstaller postgresSyncInstaller(PgSyncProperties props) {
    return new PostgresSyncInstaller(props.getQueueTable());
  }

  @Bean
  @ConditionalOnMissingBean
  public QueueBackfill queueBackfill(AbstractJdbcChangeQueue changeQueue) {
    return new QueueBackfill(changeQueue);
  }
}
