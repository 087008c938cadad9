/**
 * Inspection and replay of terminally failed items.
 */
package workqueue.failed;
