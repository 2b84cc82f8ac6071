package queues.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import queues.micrometer.MicrometerMetricsExporter;
import queues.spi.MetricsExporter;

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
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code queues.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link QueuesAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the broker.
 */
@AutoConfiguration(before = QueuesAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "queues.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(QueuesProperties.class)
public class QueuesMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, QueuesProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
