package workqueue.model;

import java.time.Instant;

/**
 * A row handed out by a successful claim. The caller owns it until it reports
 * completion or failure, or until it is reclaimed as an orphan.
 *
 * @param id          store-assigned row id
 * @param category    queue partition the row was claimed from
 * @param payloadJson opaque JSON payload as enqueued
 * @param retryCount  number of previous failed attempts
 * @param createdAt   enqueue time
 */
public record ClaimedItem(
    long id,
    String category,
    String payloadJson,
    int retryCount,
    Instant createdAt
) {}
