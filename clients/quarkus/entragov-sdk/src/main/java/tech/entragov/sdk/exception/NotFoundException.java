package tech.entragov.sdk.exception;

/**
 * Exception thrown when a result set is empty where the directory always has data,
 * which points at missing permissions or a misconfigured tenant.
 */
public class NotFoundException extends GraphException {

    public NotFoundException(String message) {
        super(message, 404);
    }

    public static NotFoundException noRoleDefinitions() {
        return new NotFoundException(
            "No role definitions found. Check that the app registration has RoleManagement.Read.Directory"
        );
    }
}
