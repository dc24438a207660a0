package tech.entragov.analyzer.pim;

/**
 * Assignment counts for one privileged role.
 *
 * @param pimAdoption whether the role is granted through eligible (just-in-time) assignments
 */
public record RoleUsage(
    String role,
    int eligible,
    int active,
    boolean pimAdoption
) {}
