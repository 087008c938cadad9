/**
 * Read-only queue depth reporting.
 */
package workqueue.status;
