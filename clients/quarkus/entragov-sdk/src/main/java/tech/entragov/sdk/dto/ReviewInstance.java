package tech.entragov.sdk.dto;

import tech.entragov.sdk.enums.ReviewStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One occurrence of an access review, with its decisions keyed by decision id.
 *
 * @param reviewerIds reviewers contacted for this instance; undecided items are assigned to them
 */
public record ReviewInstance(
    String id,
    String definitionId,
    String displayName,
    ReviewStatus status,
    Instant start,
    Instant end,
    int decisionsRequired,
    int decisionsCompleted,
    Map<String, ReviewDecision> decisions,
    Set<String> reviewerIds
) {
    public ReviewInstance {
        decisions = decisions != null ? decisions : Map.of();
        reviewerIds = reviewerIds != null ? Set.copyOf(reviewerIds) : Set.of();
    }

    public int decisionsPending() {
        return Math.max(0, decisionsRequired - decisionsCompleted);
    }
}
