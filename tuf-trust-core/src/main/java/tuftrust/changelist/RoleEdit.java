package tuftrust.changelist;

import tuftrust.model.TufPublicKey;

import java.util.List;

/**
 * Content of a top-level role change (key rotation).
 *
 * @param threshold new threshold, or 0 to keep the current one
 */
public record RoleEdit(
        List<TufPublicKey> keys,
        int threshold,
        boolean serverManaged
) {
    public RoleEdit {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must not be negative");
        }
        keys = List.copyOf(keys);
    }
}
