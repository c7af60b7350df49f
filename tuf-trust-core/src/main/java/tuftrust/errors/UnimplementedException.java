package tuftrust.errors;

/**
 * The operation is not available in this backend configuration.
 * Never retryable, so callers can tell it apart from a real failure.
 */
public class UnimplementedException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    public UnimplementedException(String operation) {
        super("operation not available: " + operation);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
