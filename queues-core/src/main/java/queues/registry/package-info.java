/**
 * Worker handler registration and lookup.
 *
 * @see queues.registry.DefaultWorkerRegistry
 */
package queues.registry;
