package tuftrust.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuftrust.crypto.CryptoService;
import tuftrust.errors.InvalidRoleException;
import tuftrust.errors.InvalidRootKeysException;
import tuftrust.errors.NotFoundException;
import tuftrust.errors.ThresholdNotMetException;
import tuftrust.model.BaseRole;
import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;
import tuftrust.model.Signature;
import tuftrust.model.TufPublicKey;
import tuftrust.model.Util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * The top-level roles of one trust collection: keys and thresholds of
 * {@code root}, {@code targets}, {@code snapshot} and {@code timestamp}, and
 * which of them are managed by the server.
 * <p>
 * Instances are immutable; {@link #withRole} yields the next generation.
 * The verification cache is shared across generations.
 */
public class RoleRegistry {

    private final static Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    /** Only these roles may have their keys held by the server. */
    public static final Set<RoleName> MANAGEABLE = Set.of(RoleName.SNAPSHOT, RoleName.TIMESTAMP);

    private final Map<RoleName, BaseRole> roles;
    private final Set<RoleName> serverManaged;
    private final CryptoService cryptoService;
    private final VerificationCache cache;

    public RoleRegistry(Map<RoleName, BaseRole> roles, Set<RoleName> serverManaged,
                        CryptoService cryptoService, VerificationCache cache) {
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.serverManaged = Set.copyOf(serverManaged);
        this.cryptoService = cryptoService;
        this.cache = cache;
    }

    /**
     * Establish the root of trust.
     *
     * @param rootKeyIds         keys already in custody that will sign root
     * @param serverManagedRoles roles whose key is held remotely
     * @param managedKeys        source of the remote key for a server-managed role
     * @param algorithm          algorithm for locally created role keys
     * @throws InvalidRootKeysException if a root key ID is unknown to custody
     */
    public static RoleRegistry initialize(CryptoService cryptoService, Gun gun,
                                          List<String> rootKeyIds,
                                          Collection<RoleName> serverManagedRoles,
                                          Function<RoleName, TufPublicKey> managedKeys,
                                          KeyAlgorithm algorithm) {
        if (rootKeyIds.isEmpty()) {
            throw new InvalidRootKeysException(rootKeyIds);
        }
        List<String> unknown = new ArrayList<>();
        List<TufPublicKey> rootKeys = new ArrayList<>();
        for (String id : new LinkedHashSet<>(rootKeyIds)) {
            Optional<TufPublicKey> key = cryptoService.getKey(id);
            if (key.isPresent()) {
                rootKeys.add(key.get());
            } else {
                unknown.add(id);
            }
        }
        if (!unknown.isEmpty()) {
            throw new InvalidRootKeysException(unknown);
        }
        Set<RoleName> managed = new HashSet<>(serverManagedRoles);
        for (RoleName role : managed) {
            if (!MANAGEABLE.contains(role)) {
                throw new InvalidRoleException(role.value(), "only snapshot and timestamp keys can be server managed");
            }
        }

        Map<RoleName, BaseRole> roles = new LinkedHashMap<>();
        roles.put(RoleName.ROOT, BaseRole.of(RoleName.ROOT, rootKeys, 1));
        for (RoleName role : List.of(RoleName.TARGETS, RoleName.SNAPSHOT, RoleName.TIMESTAMP)) {
            TufPublicKey key = managed.contains(role)
                    ? managedKeys.apply(role)
                    : cryptoService.create(role, gun, algorithm);
            roles.put(role, BaseRole.of(role, List.of(key), 1));
        }
        log.info("Initialized roles for {} root keys: {} server managed: {}", gun, rootKeys.size(), managed);
        return new RoleRegistry(roles, managed, cryptoService, new VerificationCache());
    }

    /**
     * @throws NotFoundException if no such top-level role exists
     */
    public BaseRole getRole(RoleName name) {
        BaseRole role = roles.get(name);
        if (role == null) {
            throw new NotFoundException("role", name.value());
        }
        return role;
    }

    /** Roles in registration order. */
    public List<BaseRole> roles() {
        return List.copyOf(roles.values());
    }

    public boolean isServerManaged(RoleName name) {
        return serverManaged.contains(name);
    }

    public Set<RoleName> serverManaged() {
        return serverManaged;
    }

    public VerificationCache cache() {
        return cache;
    }

    /** Next generation with {@code role} replaced. */
    public RoleRegistry withRole(BaseRole role, boolean managed) {
        Map<RoleName, BaseRole> next = new LinkedHashMap<>(roles);
        next.put(role.name(), role);
        Set<RoleName> nextManaged = new HashSet<>(serverManaged);
        if (managed) {
            nextManaged.add(role.name());
        } else {
            nextManaged.remove(role.name());
        }
        return new RoleRegistry(next, nextManaged, cryptoService, cache);
    }

    /** Forget cached verification outcomes for a role whose keys changed. */
    public void invalidate(RoleName role) {
        cache.invalidate(role);
        log.debug("Invalidated cached verifications for {}", role);
    }

    /** Forget cached verification outcomes for payloads other than each role's current one. */
    public void retainCurrent(Function<RoleName, Optional<byte[]>> currentPayload) {
        cache.retain(role -> currentPayload.apply(role).map(Util::sha256));
    }

    /**
     * Whether {@code signature} is a valid signature over {@code payload} by
     * one of {@code role}'s keys.
     */
    public boolean isValid(BaseRole role, Signature signature, byte[] payload) {
        TufPublicKey key = role.keys().get(signature.keyId());
        if (key == null) {
            return false;
        }
        byte[] digest = Util.sha256(payload);
        Boolean cached = cache.get(role.name(), signature, digest);
        if (cached != null) {
            return cached;
        }
        boolean valid = cryptoService.verify(key, payload, signature);
        cache.put(role.name(), signature, digest, valid);
        return valid;
    }

    /**
     * Count distinct role keys with a valid signature over {@code payload}.
     * Signatures by foreign keys and repeated key IDs do not count.
     */
    public int countValid(BaseRole role, List<Signature> signatures, byte[] payload) {
        Set<String> counted = new HashSet<>();
        for (Signature s : signatures) {
            if (!counted.contains(s.keyId()) && isValid(role, s, payload)) {
                counted.add(s.keyId());
            }
        }
        return counted.size();
    }

    public boolean verifyThreshold(BaseRole role, List<Signature> signatures, byte[] payload) {
        return countValid(role, signatures, payload) >= role.threshold();
    }

    /**
     * @throws ThresholdNotMetException naming the role, its threshold and the valid count
     */
    public void requireThreshold(BaseRole role, List<Signature> signatures, byte[] payload) {
        int valid = countValid(role, signatures, payload);
        if (valid < role.threshold()) {
            throw new ThresholdNotMetException(role.name().value(), role.threshold(), valid);
        }
    }

    /** The signatures with {@code isValid} recomputed against {@code role}'s current keys. */
    public List<Signature> withValidity(BaseRole role, List<Signature> signatures, byte[] payload) {
        List<Signature> checked = new ArrayList<>(signatures.size());
        for (Signature s : signatures) {
            checked.add(s.withValidity(isValid(role, s, payload)));
        }
        return checked;
    }
}
