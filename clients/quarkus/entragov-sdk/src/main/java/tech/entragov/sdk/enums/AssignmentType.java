package tech.entragov.sdk.enums;

/**
 * PIM assignment type.
 */
public enum AssignmentType {
    /** May activate the role on demand */
    ELIGIBLE,

    /** Holds the role now */
    ACTIVE
}
