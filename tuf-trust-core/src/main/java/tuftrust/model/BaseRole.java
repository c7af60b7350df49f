package tuftrust.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named authority: the keys allowed to sign for it and how many of them must.
 */
public record BaseRole(
        RoleName name,
        Map<String, TufPublicKey> keys,
        int threshold
) {
    public BaseRole {
        if (name == null) {
            throw new IllegalArgumentException("role name is required");
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold of " + name + " must be at least 1");
        }
        if (keys == null || threshold > keys.size()) {
            throw new IllegalArgumentException("role " + name + " has fewer keys than its threshold " + threshold);
        }
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    public static BaseRole of(RoleName name, Collection<TufPublicKey> keys, int threshold) {
        return new BaseRole(name, keyMap(keys), threshold);
    }

    public static Map<String, TufPublicKey> keyMap(Collection<TufPublicKey> keys) {
        Map<String, TufPublicKey> map = new LinkedHashMap<>();
        for (TufPublicKey k : keys) {
            map.put(k.id(), k);
        }
        return map;
    }

    public boolean hasKey(String keyId) {
        return keys.containsKey(keyId);
    }
}
