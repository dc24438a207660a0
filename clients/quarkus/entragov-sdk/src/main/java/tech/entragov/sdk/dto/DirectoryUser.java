package tech.entragov.sdk.dto;

import java.util.Set;

/**
 * A directory user and the ids of the groups it belongs to.
 */
public record DirectoryUser(
    String id,
    Set<String> groupIds
) {}
