package tech.entragov.sdk.dto;

/**
 * A directory role definition.
 */
public record RoleDefinition(
    String id,
    String displayName,
    boolean builtIn
) {}
