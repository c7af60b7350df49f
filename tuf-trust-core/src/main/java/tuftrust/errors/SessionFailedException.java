package tuftrust.errors;

/**
 * The session hit an unrecoverable publish error and only accepts
 * {@code deleteTrustData} from now on.
 */
public class SessionFailedException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String gun;

    public SessionFailedException(String gun, Throwable cause) {
        super("trust session for " + gun + " has failed", cause);
        this.gun = gun;
    }

    public String gun() {
        return gun;
    }
}
