package tuftrust.crypto;

import tuftrust.model.KeyAlgorithm;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * One signature scheme. Keys travel as X.509 SubjectPublicKeyInfo bytes, so
 * a signer must be able to rebuild the public key it verifies against.
 */
public interface Signer {

    /** The key type this signer issues and accepts. */
    KeyAlgorithm algorithm();

    KeyPair generateKeyPair();

    /**
     * @throws IllegalArgumentException if {@code encoded} is not a key of this type
     */
    PublicKey decodePublicKey(byte[] encoded);

    byte[] sign(byte[] data, PrivateKey privateKey);

    /** False for a bad signature, including one that does not even parse. */
    boolean verify(byte[] data, byte[] signature, PublicKey publicKey);
}
