package tech.entragov.sdk.dto;

/**
 * An access review schedule definition.
 */
public record AccessReviewDefinition(
    String id,
    String displayName,
    String status
) {}
