package queues.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import queues.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily, one set per queue, each tagged with
 * {@code queue=<name>}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code queues.enqueued}: messages buffered</li>
 *   <li>{@code queues.dropped.unconsumed}: messages discarded because the queue has no consumer</li>
 *   <li>{@code queues.acked}: messages acknowledged by the consumer</li>
 *   <li>{@code queues.retried}: messages put back for another attempt</li>
 *   <li>{@code queues.dead.lettered}: messages moved to a dead-letter queue</li>
 *   <li>{@code queues.discarded}: messages dropped after their last attempt</li>
 *   <li>{@code queues.dispatch.failure}: batches that failed or reported a non-ok outcome</li>
 *   <li>{@code queues.flush.failure}: flush cycles that ended with an unhandled error</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code queues.pending.depth}: messages waiting in the queue's buffer</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code queues.dispatch.duration.ms}: time the consumer took to answer a batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final ConcurrentMap<String, QueueMeters> queues = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "queues"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "queues");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-broker use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.queues"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  private QueueMeters meters(String queue) {
    return queues.computeIfAbsent(queue, QueueMeters::new);
  }

  @Override
  public void incrementEnqueued(String queue, int count) {
    if (closed) return;
    meters(queue).enqueued.increment(count);
  }

  @Override
  public void incrementDroppedUnconsumed(String queue, int count) {
    if (closed) return;
    meters(queue).droppedUnconsumed.increment(count);
  }

  @Override
  public void incrementAcked(String queue, int count) {
    if (closed) return;
    meters(queue).acked.increment(count);
  }

  @Override
  public void incrementRetried(String queue, int count) {
    if (closed) return;
    meters(queue).retried.increment(count);
  }

  @Override
  public void incrementDeadLettered(String queue, int count) {
    if (closed) return;
    meters(queue).deadLettered.increment(count);
  }

  @Override
  public void incrementDiscarded(String queue, int count) {
    if (closed) return;
    meters(queue).discarded.increment(count);
  }

  @Override
  public void incrementDispatchFailure(String queue) {
    if (closed) return;
    meters(queue).dispatchFailure.increment();
  }

  @Override
  public void incrementFlushFailure(String queue) {
    if (closed) return;
    meters(queue).flushFailure.increment();
  }

  @Override
  public void recordDispatchDurationMs(String queue, long durationMs) {
    if (closed) return;
    meters(queue).dispatchDuration.record(durationMs);
  }

  @Override
  public void recordPendingDepth(String queue, int depth) {
    if (closed) return;
    meters(queue).pendingDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the broker is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (QueueMeters meters : queues.values()) {
      for (Meter meter : meters.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e;
          else first.addSuppressed(e);
        }
      }
    }
    queues.clear();
    if (first != null) throw first;
  }

  private final class QueueMeters {
    private final Counter enqueued;
    private final Counter droppedUnconsumed;
    private final Counter acked;
    private final Counter retried;
    private final Counter deadLettered;
    private final Counter discarded;
    private final Counter dispatchFailure;
    private final Counter flushFailure;
    private final DistributionSummary dispatchDuration;
    private final AtomicInteger pendingDepth = new AtomicInteger();
    private final Gauge pendingDepthGauge;

    private QueueMeters(String queue) {
      Tags tags = Tags.of("queue", queue);
      this.enqueued = counter(".enqueued", "Messages buffered", tags);
      this.droppedUnconsumed = counter(".dropped.unconsumed", "Messages discarded (no consumer)", tags);
      this.acked = counter(".acked", "Messages acknowledged by the consumer", tags);
      this.retried = counter(".retried", "Messages put back for another attempt", tags);
      this.deadLettered = counter(".dead.lettered", "Messages moved to a dead-letter queue", tags);
      this.discarded = counter(".discarded", "Messages dropped after their last attempt", tags);
      this.dispatchFailure = counter(".dispatch.failure", "Batches failed or answered with a non-ok outcome", tags);
      this.flushFailure = counter(".flush.failure", "Flush cycles ended with an unhandled error", tags);
      this.dispatchDuration = DistributionSummary.builder(namePrefix + ".dispatch.duration.ms")
          .description("Consumer answer time per batch in milliseconds")
          .tags(tags)
          .register(registry);
      this.pendingDepthGauge = Gauge.builder(namePrefix + ".pending.depth", pendingDepth, AtomicInteger::get)
          .description("Messages waiting in the queue's buffer")
          .tags(tags)
          .register(registry);
    }

    private Counter counter(String suffix, String description, Tags tags) {
      return Counter.builder(namePrefix + suffix)
          .description(description)
          .tags(tags)
          .register(registry);
    }

    private List<Meter> all() {
      return List.of(enqueued, droppedUnconsumed, acked, retried, deadLettered, discarded,
          dispatchFailure, flushFailure, dispatchDuration, pendingDepthGauge);
    }
  }
}
