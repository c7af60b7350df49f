package tuftrust.errors;

/**
 * A target name falls outside the paths of the role asked to sign for it.
 */
public class PathNotAuthorizedException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String role;
    private final String path;

    public PathNotAuthorizedException(String role, String path) {
        super("role " + role + " is not authorized for path: " + path);
        this.role = role;
        this.path = path;
    }

    public String role() {
        return role;
    }

    public String path() {
        return path;
    }
}
