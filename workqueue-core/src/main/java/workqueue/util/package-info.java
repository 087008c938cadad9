/**
 * Internal utilities.
 */
package workqueue.util;
