package tech.entragov.analyzer.review;

import tech.entragov.sdk.enums.ReviewStatus;

import java.time.Instant;

/**
 * @param completionRate decided / required, 1.0 when nothing is required
 */
public record InstanceCompletion(
    String instanceId,
    String displayName,
    ReviewStatus status,
    Instant end,
    int decisionsRequired,
    int decisionsCompleted,
    double completionRate
) {}
