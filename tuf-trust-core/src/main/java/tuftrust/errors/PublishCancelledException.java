package tuftrust.errors;

public class PublishCancelledException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String step;

    public PublishCancelledException(String step) {
        super("publish cancelled at " + step);
        this.step = step;
    }

    public String step() {
        return step;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
