/**
 * Message model: the tagged {@link queues.model.MessageBody} variants, the
 * {@link queues.model.ContentType} tags and the buffered
 * {@link queues.model.QueueMessage}.
 */
package queues.model;
