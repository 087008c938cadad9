/**
 * Value types describing queue rows and their lifecycle.
 */
package workqueue.model;
