package tuftrust.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;

/**
 * SHA-2 family hasher.
 * Metadata names the algorithms {@code sha256}, {@code sha384}, {@code sha512}.
 */
public class Sha2Hasher implements Hasher {

    private static final Map<String, String> METADATA_NAMES = Map.of(
            "sha256", "SHA-256",
            "sha384", "SHA-384",
            "sha512", "SHA-512");

    private final String algorithm;

    public Sha2Hasher(String algorithm) {
        this.algorithm = algorithm;
    }

    public static boolean supports(String metadataName) {
        return METADATA_NAMES.containsKey(metadataName.toLowerCase(Locale.ROOT));
    }

    /** Hasher for a metadata algorithm name such as {@code sha256}. */
    public static Sha2Hasher forName(String metadataName) {
        String jca = METADATA_NAMES.get(metadataName.toLowerCase(Locale.ROOT));
        if (jca == null) {
            throw new IllegalArgumentException("Unsupported hash algorithm: " + metadataName);
        }
        return new Sha2Hasher(jca);
    }

    @Override
    public String algorithmName() {
        return algorithm;
    }

    @Override
    public byte[] hash(byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
