/**
 * Completion and failure recording for claimed rows.
 */
package workqueue.record;
