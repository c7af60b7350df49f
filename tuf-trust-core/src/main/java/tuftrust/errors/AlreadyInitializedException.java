package tuftrust.errors;

public class AlreadyInitializedException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String gun;

    public AlreadyInitializedException(String gun) {
        super("trust data already initialized for " + gun);
        this.gun = gun;
    }

    public String gun() {
        return gun;
    }
}
