package tech.entragov.sdk.dto;

/**
 * An entitlement management access package with its assignment policy summary.
 *
 * @param requiresApproval whether any assignment policy requires approval
 * @param hasExpiration    whether any assignment policy sets an expiration
 */
public record AccessPackage(
    String id,
    String displayName,
    String catalogId,
    boolean hidden,
    boolean requiresApproval,
    boolean hasExpiration,
    int assignmentCount
) {}
