package tuftrust.model;

import tuftrust.crypto.Sha2Hasher;

import java.security.MessageDigest;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A named artifact: its byte length and one or more content digests
 * (algorithm name → lowercase hex).
 */
public record Target(
        String name,
        long length,
        Map<String, String> hashes
) {
    public Target {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("target name must not be empty");
        }
        if (!Util.isWellFormed(name)) {
            throw new IllegalArgumentException("target name is not well-formed unicode");
        }
        if (length < 0) {
            throw new IllegalArgumentException("target length must not be negative: " + length);
        }
        if (hashes == null || hashes.isEmpty()) {
            throw new IllegalArgumentException("target " + name + " needs at least one hash");
        }
        for (Map.Entry<String, String> e : hashes.entrySet()) {
            if (!Util.isWellFormed(e.getKey()) || !Util.isWellFormed(e.getValue())) {
                throw new IllegalArgumentException("target " + name + " has a malformed hash entry");
            }
        }
        hashes = Collections.unmodifiableMap(new TreeMap<>(hashes));
    }

    /** Describe {@code content} under {@code name}, hashed with each named algorithm. */
    public static Target fromContent(String name, byte[] content, String... algorithms) {
        Map<String, String> hashes = new TreeMap<>();
        for (String algorithm : algorithms) {
            hashes.put(algorithm, Sha2Hasher.forName(algorithm).hashHex(content));
        }
        return new Target(name, content.length, hashes);
    }

    /**
     * Check that {@code content} is what this target describes: the length
     * matches and every digest we know how to compute matches. Fails when
     * none of the listed algorithms is supported, or a digest is not hex.
     */
    public boolean verify(byte[] content) {
        if (content.length != length) {
            return false;
        }
        int checked = 0;
        for (Map.Entry<String, String> e : hashes.entrySet()) {
            if (!Sha2Hasher.supports(e.getKey())) {
                continue;
            }
            byte[] actual = Sha2Hasher.forName(e.getKey()).hash(content);
            if (!MessageDigest.isEqual(actual, expected(e.getValue()))) {
                return false;
            }
            checked++;
        }
        return checked > 0;
    }

    /** The recorded digest bytes; a digest that is not hex matches nothing. */
    private static byte[] expected(String digest) {
        try {
            return Util.unhex(digest);
        } catch (IllegalArgumentException e) {
            return new byte[0];
        }
    }
}
