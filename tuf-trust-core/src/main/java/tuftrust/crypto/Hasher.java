package tuftrust.crypto;

import tuftrust.model.Util;

/**
 * Content digest used to describe and check targets.
 */
public interface Hasher {

    /** JCA name, e.g. {@code SHA-256}. */
    String algorithmName();

    byte[] hash(byte[] data);

    /** Lowercase hex digest, the form target metadata records. */
    default String hashHex(byte[] data) {
        return Util.hex(hash(data));
    }
}
