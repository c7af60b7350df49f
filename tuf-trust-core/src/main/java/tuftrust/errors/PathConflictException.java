package tuftrust.errors;

/**
 * A delegation path is not covered by its parent's paths, or a path change
 * would leave a signed target outside its role's scope.
 */
public class PathConflictException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String role;
    private final String path;
    private final String parent;

    public PathConflictException(String role, String path, String parent) {
        super("path " + (path.isEmpty() ? "\"\"" : path) + " of " + role + " conflicts with " + parent);
        this.role = role;
        this.path = path;
        this.parent = parent;
    }

    public String role() {
        return role;
    }

    public String path() {
        return path;
    }

    /** The role whose scope was violated (the parent, or the role itself for orphaned targets). */
    public String parent() {
        return parent;
    }
}
