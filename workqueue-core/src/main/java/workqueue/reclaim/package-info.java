/**
 * Timeout-based recovery of rows whose owner disappeared.
 */
package workqueue.reclaim;
