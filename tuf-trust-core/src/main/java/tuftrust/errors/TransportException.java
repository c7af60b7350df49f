package tuftrust.errors;

/**
 * Opaque failure of a remote collaborator, passed through unchanged.
 */
public class TransportException extends TrustException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransportException(Throwable cause) {
        super(String.valueOf(cause.getMessage()), cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
