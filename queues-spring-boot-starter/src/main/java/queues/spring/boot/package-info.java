/**
 * Spring Boot auto-configuration for the queue broker.
 *
 * <p>{@link queues.spring.boot.QueuesAutoConfiguration} wires a {@link queues.QueueBroker}
 * from {@code queues.*} application properties.
 *
 * <p>Use {@link queues.spring.boot.QueueWorker @QueueWorker} on
 * {@link queues.QueueHandler} beans to register workers declaratively.
 *
 * @see queues.spring.boot.QueuesAutoConfiguration
 * @see queues.spring.boot.QueuesProperties
 * @see queues.spring.boot.QueueWorker
 * @see queues.spring.boot.QueueWorkerRegistrar
 */
package queues.spring.boot;
