package tuftrust.model;

/**
 * Supported key types. Public and private keys are tagged with one of these
 * so key custody and verification can match on them exhaustively.
 */
public enum KeyAlgorithm {

    ED25519("ed25519", "ed25519"),
    ECDSA("ecdsa", "ecdsa"),
    RSA("rsa", "rsapss");

    private final String tag;
    private final String signatureMethod;

    KeyAlgorithm(String tag, String signatureMethod) {
        this.tag = tag;
        this.signatureMethod = signatureMethod;
    }

    public String tag() {
        return tag;
    }

    /** Method name recorded on signatures made with keys of this type. */
    public String signatureMethod() {
        return signatureMethod;
    }

    public static KeyAlgorithm fromTag(String tag) {
        for (KeyAlgorithm a : values()) {
            if (a.tag.equalsIgnoreCase(tag)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unsupported key algorithm: " + tag);
    }
}
