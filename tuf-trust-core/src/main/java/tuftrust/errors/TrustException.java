package tuftrust.errors;

/**
 * Root of the trust engine's error taxonomy.
 * Every subtype carries the structured detail (role, path, key) needed to
 * report exactly what failed.
 */
public abstract class TrustException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected TrustException(String message) {
        super(message);
    }

    protected TrustException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether retrying the same call could succeed. */
    public boolean isRetryable() {
        return false;
    }
}
