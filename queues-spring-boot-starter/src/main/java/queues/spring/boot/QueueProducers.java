package queues.spring.boot;

import queues.QueueBroker;
import queues.WorkerQueue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named producer bindings from {@code queues.producers.<binding>=<queue>}.
 *
 * <p>Resolves a binding name to the bound {@link WorkerQueue}. The queue is
 * created on first lookup.
 */
public class QueueProducers {

    private final QueueBroker broker;
    private final Map<String, String> bindings;

    public QueueProducers(QueueBroker broker, Map<String, String> bindings) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /**
     * @param binding the binding name
     * @return the bound queue
     * @throws IllegalArgumentException if no queue is bound under {@code binding}
     */
    public WorkerQueue get(String binding) {
        String queueName = bindings.get(binding);
        if (queueName == null) {
            throw new IllegalArgumentException("No queue bound to producer \"" + binding + "\"");
        }
        return broker.getOrCreateQueue(queueName);
    }

    /** Returns the bindings, binding name to queue name. */
    public Map<String, String> bindings() {
        return bindings;
    }
}
