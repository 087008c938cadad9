/**
 * Backing-store health probes and aggregated health reports.
 */
package workqueue.health;
