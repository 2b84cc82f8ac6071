/**
 * Thread and timer utilities.
 */
package queues.util;
