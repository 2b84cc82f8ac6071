package queues.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the queue broker.
 *
 * <pre>
 * queues.flush-threads=4
 * queues.drain-timeout-ms=5000
 * queues.consumers.emails.worker=mailer
 * queues.consumers.emails.max-batch-size=10
 * queues.consumers.emails.dead-letter-queue=emails-dlq
 * queues.producers.EMAILS=emails
 * </pre>
 *
 * @see QueuesAutoConfiguration
 */
@ConfigurationProperties(prefix = "queues")
public class QueuesProperties {

    /**
     * Number of timer threads running flushes and synchronous consumer calls.
     */
    private int flushThreads = 4;

    /**
     * How long shutdown waits for consumer calls still running on the timer threads.
     */
    private long drainTimeoutMs = 5000;

    /**
     * Consumer configuration keyed by queue name.
     */
    private final Map<String, Consumer> consumers = new LinkedHashMap<>();

    /**
     * Producer bindings: binding name to queue name.
     */
    private final Map<String, String> producers = new LinkedHashMap<>();

    private final Metrics metrics = new Metrics();

    public int getFlushThreads() {
        return flushThreads;
    }

    public void setFlushThreads(int flushThreads) {
        this.flushThreads = flushThreads;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public Map<String, Consumer> getConsumers() {
        return consumers;
    }

    public Map<String, String> getProducers() {
        return producers;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Consumer {
        /**
         * Name of the worker receiving this queue's batches. Required.
         */
        private String worker;
        private int maxBatchSize = 5;
        private double maxBatchTimeoutSeconds = 1;
        private int maxRetries = 2;
        private String deadLetterQueue;

        public String getWorker() {
            return worker;
        }

        public void setWorker(String worker) {
            this.worker = worker;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public double getMaxBatchTimeoutSeconds() {
            return maxBatchTimeoutSeconds;
        }

        public void setMaxBatchTimeoutSeconds(double maxBatchTimeoutSeconds) {
            this.maxBatchTimeoutSeconds = maxBatchTimeoutSeconds;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public String getDeadLetterQueue() {
            return deadLetterQueue;
        }

        public void setDeadLetterQueue(String deadLetterQueue) {
            this.deadLetterQueue = deadLetterQueue;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "queues";

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
}
