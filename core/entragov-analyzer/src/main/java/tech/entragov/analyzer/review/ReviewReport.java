package tech.entragov.analyzer.review;

import tech.entragov.analyzer.model.Violation;
import tech.entragov.sdk.enums.ReviewStatus;

import java.util.List;
import java.util.Map;

/**
 * Access review completion.
 *
 * @param overallCompletionRate decisions made / decisions required across every instance
 * @param pendingInstanceIds    in-progress instances with undecided items
 */
public record ReviewReport(
    double overallCompletionRate,
    List<InstanceCompletion> instances,
    List<ReviewerParticipation> reviewers,
    Map<ReviewStatus, Integer> instancesByStatus,
    List<String> pendingInstanceIds,
    List<Violation> violations
) {}
