package tuftrust.errors;

public class ThresholdNotMetException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final String role;
    private final int threshold;
    private final int valid;

    public ThresholdNotMetException(String role, int threshold, int valid) {
        super("role " + role + " needs " + threshold + " valid signatures, got " + valid);
        this.role = role;
        this.threshold = threshold;
        this.valid = valid;
    }

    public String role() {
        return role;
    }

    public int threshold() {
        return threshold;
    }

    public int valid() {
        return valid;
    }
}
