package pgsync.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import pgsync.micrometer.MicrometerSyncMetrics;
import pgsync.spi.SyncMetrics;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerSyncMetrics} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code pgsync.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link PgSyncAutoConfiguration} so the {@link SyncMetrics}
 * bean is available for injection into the engine.
 */
@AutoConfiguration(before = PgSyncAutoConfiguration.class)
@ConditionalOnClass({MicrometerSyncMetrics.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "pgsync.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PgSyncProperties.class)
public class PgSyncMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(SyncMetrics.class)
  public MicrometerSyncMetrics micrometerSyncMetrics(MeterRegistry meterRegistry, PgSyncProperties props) {
    return new MicrometerSyncMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
