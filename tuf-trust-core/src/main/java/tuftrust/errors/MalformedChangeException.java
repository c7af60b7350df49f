package tuftrust.errors;

/**
 * A staged change whose type or content cannot be interpreted.
 */
public class MalformedChangeException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String change;

    public MalformedChangeException(String change, Throwable cause) {
        super("malformed change: " + change, cause);
        this.change = change;
    }

    public MalformedChangeException(String change) {
        super("malformed change: " + change);
        this.change = change;
    }

    public String change() {
        return change;
    }
}
