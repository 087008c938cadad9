package workqueue.model;

import java.time.Instant;

/**
 * Full snapshot of a persisted queue row, used for diagnosis and failed-item management.
 */
public record QueueItem(
    long id,
    String category,
    String payloadJson,
    ItemState state,
    int retryCount,
    String claimedBy,
    Instant claimedAt,
    Instant createdAt,
    Instant completedAt,
    String resultJson,
    String error
) {}
