package tuftrust.errors;

/**
 * A role, delegation, key or target is absent.
 */
public class NotFoundException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String name;

    public NotFoundException(String kind, String name) {
        super(kind + " not found: " + name);
        this.kind = kind;
        this.name = name;
    }

    public String kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
