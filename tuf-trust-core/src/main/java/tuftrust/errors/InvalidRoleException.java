package tuftrust.errors;

/**
 * An operation was asked of a role that cannot take it, or would leave the
 * role in an invalid shape (e.g. fewer keys than its threshold).
 */
public class InvalidRoleException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String role;
    private final String reason;

    public InvalidRoleException(String role, String reason) {
        super("invalid role " + role + ": " + reason);
        this.role = role;
        this.reason = reason;
    }

    public String role() {
        return role;
    }

    public String reason() {
        return reason;
    }
}
