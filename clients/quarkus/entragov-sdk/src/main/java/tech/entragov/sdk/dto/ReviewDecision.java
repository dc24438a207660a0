package tech.entragov.sdk.dto;

import tech.entragov.sdk.enums.DecisionOutcome;

/**
 * @param reviewerId reviewer the decision is attributed to, null when unknown
 */
public record ReviewDecision(
    String id,
    String principalId,
    String reviewerId,
    DecisionOutcome outcome
) {}
