/**
 * Local queue broker: named queues that batch produced messages, deliver them to
 * a consuming worker, retry failures a bounded number of times and move exhausted
 * messages to a dead-letter queue.
 *
 * <p>Entry points are {@link queues.QueueBroker} for orchestration and producers,
 * and {@link queues.QueueHandler} for workers.
 */
package queues;
