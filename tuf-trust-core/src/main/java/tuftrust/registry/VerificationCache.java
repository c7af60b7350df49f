package tuftrust.registry;

import tuftrust.model.RoleName;
import tuftrust.model.Signature;
import tuftrust.model.Util;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Remembers signature verification outcomes per role and payload digest.
 * A stale entry can only come from a key set change; {@link #invalidate}
 * drops a role's entries when its keys rotate, and {@link #retain} drops
 * entries for payloads a role no longer publishes.
 */
public class VerificationCache {

    private final Map<RoleName, Map<String, Map<String, Boolean>>> results = new ConcurrentHashMap<>();

    public Boolean get(RoleName role, Signature signature, byte[] payloadDigest) {
        Map<String, Map<String, Boolean>> forRole = results.get(role);
        if (forRole == null) {
            return null;
        }
        Map<String, Boolean> forPayload = forRole.get(Util.hex(payloadDigest));
        return forPayload == null ? null : forPayload.get(key(signature));
    }

    public void put(RoleName role, Signature signature, byte[] payloadDigest, boolean valid) {
        results.computeIfAbsent(role, r -> new ConcurrentHashMap<>())
               .computeIfAbsent(Util.hex(payloadDigest), d -> new ConcurrentHashMap<>())
               .put(key(signature), valid);
    }

    public void invalidate(RoleName role) {
        results.remove(role);
    }

    public void invalidateAll() {
        results.clear();
    }

    /**
     * Keep only entries for each role's current payload digest; roles without
     * one are dropped entirely.
     */
    public void retain(Function<RoleName, Optional<byte[]>> currentDigest) {
        results.entrySet().removeIf(e -> {
            Optional<byte[]> digest = currentDigest.apply(e.getKey());
            if (digest.isEmpty()) {
                return true;
            }
            e.getValue().keySet().retainAll(Set.of(Util.hex(digest.get())));
            return e.getValue().isEmpty();
        });
    }

    public int size(RoleName role) {
        Map<String, Map<String, Boolean>> forRole = results.get(role);
        if (forRole == null) {
            return 0;
        }
        int n = 0;
        for (Map<String, Boolean> forPayload : forRole.values()) {
            n += forPayload.size();
        }
        return n;
    }

    private static String key(Signature signature) {
        return signature.keyId() + ":" + signature.method() + ":" + Util.hex(Util.sha256(signature.signature()));
    }
}
