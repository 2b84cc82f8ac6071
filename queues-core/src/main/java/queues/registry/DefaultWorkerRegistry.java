package queues.registry;

import queues.QueueHandler;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of worker handlers.
 *
 * <p>Each worker name maps to exactly one handler. One worker may consume any
 * number of queues; each queue has at most one consuming worker.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * WorkerRegistry registry = new DefaultWorkerRegistry()
 *     .register("mailer", batch -> batch.messages().forEach(mailer::send))
 *     .register("auditor", batch -> audit.record(batch));
 * }</pre>
 *
 * @see WorkerRegistry
 */
public final class DefaultWorkerRegistry implements WorkerRegistry {
  private final Map<String, QueueHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler of a worker.
   *
   * @param workerName the worker name
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered under {@code workerName}
   */
  public DefaultWorkerRegistry register(String workerName, QueueHandler handler) {
    Objects.requireNonNull(workerName, "workerName");
    Objects.requireNonNull(handler, "handler");
    QueueHandler existing = handlers.putIfAbsent(workerName, handler);
    if (existing != null) {
      throw new IllegalStateException("Worker already registered: " + workerName);
    }
    return this;
  }

  @Override
  public QueueHandler handlerFor(String workerName) {
    return workerName == null ? null : handlers.get(workerName);
  }

  /** Returns the registered worker names, sorted. */
  public Set<String> workerNames() {
    return new TreeSet<>(handlers.keySet());
  }
}
