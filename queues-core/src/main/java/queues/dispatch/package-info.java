/**
 * Batch flushing and consumer dispatch: the {@link queues.dispatch.FlushScheduler}
 * state machine, the {@link queues.dispatch.BatchReconciler} applying consumer
 * responses, and the in-process {@link queues.dispatch.HandlerBatchDispatcher}.
 */
package queues.dispatch;
