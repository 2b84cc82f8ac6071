/**
 * Service provider interfaces: the consumer call-out ({@link queues.spi.BatchDispatcher}),
 * timers ({@link queues.spi.FlushTimers}) and metrics ({@link queues.spi.MetricsExporter}).
 */
package queues.spi;
