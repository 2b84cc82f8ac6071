/**
 * Wire form of queued messages and the codec that converts to and from it.
 *
 * @see queues.wire.MessageCodec
 */
package queues.wire;
