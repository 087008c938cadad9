/**
 * Backoff policies and a retrying executor for transient store failures.
 */
package workqueue.retry;
