package tuftrust.errors;

public class NotInitializedException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String gun;

    public NotInitializedException(String gun) {
        super("trust data not initialized for " + gun);
        this.gun = gun;
    }

    public String gun() {
        return gun;
    }
}
