/**
 * Atomic batch claiming of pending rows.
 */
package workqueue.claim;
