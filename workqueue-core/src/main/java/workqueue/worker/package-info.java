/**
 * Polling worker that drives a {@link workqueue.worker.WorkHandler} over claimed items.
 */
package workqueue.worker;
