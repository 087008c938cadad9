/**
 * Connection and transaction handling shared by all queue operations.
 */
package workqueue.store;
