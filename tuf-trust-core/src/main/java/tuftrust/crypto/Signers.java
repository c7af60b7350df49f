package tuftrust.crypto;

import tuftrust.model.KeyAlgorithm;

/**
 * The signer behind each key algorithm.
 */
public final class Signers {

    private Signers() {}

    private static final Signer ED25519 = new Ed25519Signer();
    private static final Signer ECDSA = new EcdsaP256Signer();
    private static final Signer RSA = new RsaSigner(2048);

    public static Signer of(KeyAlgorithm algorithm) {
        switch (algorithm) {
            case ED25519:
                return ED25519;
            case ECDSA:
                return ECDSA;
            case RSA:
                return RSA;
            default:
                throw new IllegalArgumentException("Unsupported key algorithm: " + algorithm);
        }
    }
}
