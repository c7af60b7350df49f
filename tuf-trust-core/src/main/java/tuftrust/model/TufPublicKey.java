package tuftrust.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Public key material tagged with its algorithm.
 * {@code encoded} is the X.509 SubjectPublicKeyInfo encoding.
 */
public record TufPublicKey(
        KeyAlgorithm algorithm,
        byte[] encoded
) {
    public TufPublicKey {
        if (algorithm == null || encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("public key needs an algorithm and key bytes");
        }
        encoded = encoded.clone();
    }

    @Override
    public byte[] encoded() {
        return encoded.clone();
    }

    /** Key ID: hex SHA-256 over the algorithm tag and the encoded key. */
    public String id() {
        return Util.hex(Util.sha256(Util.concat(
                algorithm.tag().getBytes(StandardCharsets.UTF_8), encoded)));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TufPublicKey other
                && algorithm == other.algorithm
                && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return algorithm.tag() + ":" + id();
    }
}
