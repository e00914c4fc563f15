package pgsync.spring.boot;

import pgsync.sync.TransformFailurePolicy;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PgSyncPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(PgSyncProperties.class);
      assertEquals("typesense_sync_queue", props.getQueueTable());
      assertEquals(100, props.getBatchSize());
      assertEquals("UTC", props.getTimezone());
      assertEquals(TransformFailurePolicy.ACKNOWLEDGE, props.getTransformFailurePolicy());
      assertTrue(props.getTables().isEmpty());
      assertNull(props.getTypesense().getHost());
      assertEquals(8108, props.getTypesense().getPort());
      assertEquals("http", props.getTypesense().getProtocol());
      assertEquals(Duration.ofSeconds(10), props.getTypesense().getConnectionTimeout());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("pgsync", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "pgsync.queue-table=search_queue",
        "pgsync.batch-size=25",
        "pgsync.timezone=Europe/Berlin",
        "pgsync.transform-failure-policy=RETAIN",
        "pgsync.typesense.host=search.internal",
        "pgsync.typesense.port=443",
        "pgsync.typesense.protocol=https",
        "pgsync.typesense.api-key=secret",
        "pgsync.typesense.connection-timeout=3s",
        "pgsync.metrics.enabled=false",
        "pgsync.metrics.name-prefix=catalog.sync"
    ).run(ctx -> {
      var props = ctx.getBean(PgSyncProperties.class);
      assertEquals("search_queue", props.getQueueTable());
      assertEquals(25, props.getBatchSize());
      assertEquals("Europe/Berlin", props.getTimezone());
      assertEquals(TransformFailurePolicy.RETAIN, props.getTransformFailurePolicy());
      assertEquals("search.internal", props.getTypesense().getHost());
      assertEquals(443, props.getTypesense().getPort());
      assertEquals("https", props.getTypesense().getProtocol());
      assertEquals("secret", props.getTypesense().getApiKey());
      assertEquals(Duration.ofSeconds(3), props.getTypesense().getConnectionTimeout());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("catalog.sync", props.getMetrics().getNamePrefix());

      var config = props.getTypesense().toConfig();
      assertEquals("https://search.internal:443", config.baseUrl());
    });
  }

  @Test
  void bindsTables() {
    runner.withPropertyValues(
        "pgsync.tables[0].name=author_view",
        "pgsync.tables[0].collection=authors",
        "pgsync.tables[0].reference-table=authors",
        "pgsync.tables[0].primary-key=author_id",
        "pgsync.tables[0].default-sorting-field=rank",
        "pgsync.tables[0].token-separators=-,/",
        "pgsync.tables[0].schema[0].name=id",
        "pgsync.tables[0].schema[0].type=string",
        "pgsync.tables[0].schema[0].source-column=author_id",
        "pgsync.tables[0].schema[1].name=embedding",
        "pgsync.tables[0].schema[1].type=vector",
        "pgsync.tables[0].schema[1].num-dim=384",
        "pgsync.tables[0].schema[2].name=bio_embedding",
        "pgsync.tables[0].schema[2].type=float[]",
        "pgsync.tables[0].schema[2].embed.from=bio"
    ).run(ctx -> {
      var table = ctx.getBean(PgSyncProperties.class).getTables().get(0);
      assertEquals("author_view", table.getName());
      assertEquals("authors", table.getReferenceTable());
      assertEquals("author_id", table.getPrimaryKey());
      assertEquals("rank", table.getDefaultSortingField());
      assertEquals(List.of("-", "/"), table.getTokenSeparators());
      assertEquals(3, table.getSchema().size());
      assertEquals("author_id", table.getSchema().get(0).getSourceColumn());
      assertNull(table.getSchema().get(0).getOptional());
      assertEquals(384, table.getSchema().get(1).getNumDim());
      Map<String, Object> embed = table.getSchema().get(2).getEmbed();
      assertEquals("bio", embed.get("from"));
    });
  }

  @Test
  void missingApiKeyIsRejected() {
    var typesense = new PgSyncProperties.Typesense();
    typesense.setHost("localhost");
    var e = assertThrows(IllegalStateException.class, typesense::toConfig);
    assertTrue(e.getMessage().contains("pgsync.typesense.api-key"));
  }

  @Configuration
  @EnableConfigurationProperties(PgSyncProperties.class)
  static class PropsConfig {
  }
}
