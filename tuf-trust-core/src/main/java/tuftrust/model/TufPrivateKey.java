package tuftrust.model;

/**
 * Private key handle paired with its public half.
 * Only key custody implementations look inside {@code key}.
 */
public record TufPrivateKey(
        TufPublicKey publicKey,
        java.security.PrivateKey key
) {
    public KeyAlgorithm algorithm() {
        return publicKey.algorithm();
    }

    public String id() {
        return publicKey.id();
    }

    @Override
    public String toString() {
        return "private " + publicKey;
    }
}
