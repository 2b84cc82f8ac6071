/**
 * Producer-facing limits.
 */
package queues.ingress;
