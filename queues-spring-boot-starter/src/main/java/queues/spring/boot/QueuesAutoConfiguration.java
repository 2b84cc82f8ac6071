package queues.spring.boot;

import queues.QueueBroker;
import queues.QueueConsumer;
import queues.dispatch.HandlerBatchDispatcher;
import queues.registry.DefaultWorkerRegistry;
import queues.spi.BatchDispatcher;
import queues.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the queue broker.
 *
 * <p>Wires a {@link QueueBroker} from {@link QueuesProperties}: every entry under
 * {@code queues.consumers} becomes the consumer of its queue, and batches are
 * delivered to the {@link QueueWorker @QueueWorker} beans named by those entries.
 *
 * @see QueuesProperties
 * @see QueuesMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(QueueBroker.class)
@EnableConfigurationProperties(QueuesProperties.class)
public class QueuesAutoConfiguration {
  private static final Logger logger = Logger.getLogger(QueuesAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public DefaultWorkerRegistry workerRegistry() {
    return new DefaultWorkerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public QueueWorkerRegistrar queueWorkerRegistrar(ListableBeanFactory beanFactory,
      DefaultWorkerRegistry workerRegistry) {
    return new QueueWorkerRegistrar(beanFactory, workerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(BatchDispatcher.class)
  public HandlerBatchDispatcher batchDispatcher(DefaultWorkerRegistry workerRegistry) {
    return new HandlerBatchDispatcher(workerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public QueueBroker queueBroker(QueuesProperties props,
      BatchDispatcher batchDispatcher,
      ObjectProvider<MetricsExporter> metricsProvider) {
    QueueBroker.Builder builder = QueueBroker.builder()
        .dispatcher(batchDispatcher)
        .flushThreads(props.getFlushThreads())
        .drainTimeoutMs(props.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    QueueBroker broker = builder.build();
    try {
      for (Map.Entry<String, QueuesProperties.Consumer> entry : props.getConsumers().entrySet()) {
        QueueConsumer consumer = toConsumer(entry.getKey(), entry.getValue());
        broker.setConsumer(consumer);
        logger.log(Level.FINE, "Configured {0}", consumer);
      }
    } catch (RuntimeException e) {
      broker.close();
      throw e;
    }
    return broker;
  }

  @Bean
  @ConditionalOnMissingBean
  public QueueProducers queueProducers(QueuesProperties props, QueueBroker queueBroker) {
    return new QueueProducers(queueBroker, props.getProducers());
  }

  static QueueConsumer toConsumer(String queueName, QueuesProperties.Consumer props) {
    if (props.getWorker() == null || props.getWorker().isEmpty()) {
      throw new IllegalStateException("queues.consumers." + queueName + ".worker must be set");
    }
    return QueueConsumer.builder(queueName, props.getWorker())
        .maxBatchSize(props.getMaxBatchSize())
        .maxBatchTimeoutSeconds(props.getMaxBatchTimeoutSeconds())
        .maxRetries(props.getMaxRetries())
        .deadLetterQueue(props.getDeadLetterQueue())
        .build();
  }
}
