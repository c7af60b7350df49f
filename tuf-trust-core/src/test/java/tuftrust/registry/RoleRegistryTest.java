package tuftrust.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import tuftrust.crypto.MemoryCryptoService;
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

public class RoleRegistryTest {

    private static final Gun    GUN     = new Gun("example.com/app");
    private static final byte[] PAYLOAD = "targets v1".getBytes(StandardCharsets.UTF_8);

    private MemoryCryptoService custody;
    private TufPublicKey        rootKey;
    private RoleRegistry        registry;

    @BeforeEach
    public void before() {
        custody = new MemoryCryptoService();
        rootKey = custody.create(RoleName.ROOT, GUN, KeyAlgorithm.ED25519);
        registry = RoleRegistry.initialize(custody, GUN, List.of(rootKey.id()), List.of(), role -> {
            throw new AssertionError("no server managed roles");
        }, KeyAlgorithm.ED25519);
    }

    @Test
    public void initializeCreatesOneKeyPerRole() {
        assertEquals(4, registry.roles().size());
        assertEquals(Set.of(rootKey.id()), registry.getRole(RoleName.ROOT).keys().keySet());
        for (RoleName role : List.of(RoleName.TARGETS, RoleName.SNAPSHOT, RoleName.TIMESTAMP)) {
            BaseRole base = registry.getRole(role);
            assertEquals(1, base.threshold());
            assertEquals(base.keys().keySet(), custody.listKeys(role));
        }
        assertTrue(registry.serverManaged().isEmpty());
        assertThrows(NotFoundException.class, () -> registry.getRole(RoleName.of("targets/x")));
    }

    @Test
    public void unknownRootKeysAreReported() {
        InvalidRootKeysException e = assertThrows(InvalidRootKeysException.class,
                () -> RoleRegistry.initialize(custody, GUN, List.of(rootKey.id(), "missing"), List.of(), null,
                        KeyAlgorithm.ED25519));
        assertEquals(List.of("missing"), e.keyIds());
        assertThrows(InvalidRootKeysException.class,
                () -> RoleRegistry.initialize(custody, GUN, List.of(), List.of(), null, KeyAlgorithm.ED25519));
    }

    @Test
    public void onlySnapshotAndTimestampCanBeServerManaged() {
        assertThrows(InvalidRoleException.class,
                () -> RoleRegistry.initialize(custody, GUN, List.of(rootKey.id()), List.of(RoleName.TARGETS),
                        role -> rootKey, KeyAlgorithm.ED25519));

        MemoryCryptoService server = new MemoryCryptoService();
        TufPublicKey remote = server.create(RoleName.TIMESTAMP, GUN, KeyAlgorithm.ED25519);
        RoleRegistry managed = RoleRegistry.initialize(custody, GUN, List.of(rootKey.id()),
                List.of(RoleName.TIMESTAMP), role -> remote, KeyAlgorithm.ED25519);
        assertTrue(managed.isServerManaged(RoleName.TIMESTAMP));
        assertTrue(managed.getRole(RoleName.TIMESTAMP).hasKey(remote.id()));
    }

    @Test
    public void thresholdCountsDistinctValidKeys() {
        TufPublicKey a = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        TufPublicKey b = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        TufPublicKey c = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        BaseRole role = BaseRole.of(RoleName.TARGETS, List.of(a, b, c), 2);

        Signature byA = custody.sign(a.id(), PAYLOAD);
        Signature byB = custody.sign(b.id(), PAYLOAD);

        assertFalse(registry.verifyThreshold(role, List.of(byA), PAYLOAD));
        assertFalse(registry.verifyThreshold(role, List.of(byA, byA), PAYLOAD));
        assertTrue(registry.verifyThreshold(role, List.of(byA, byB), PAYLOAD));
        assertEquals(2, registry.countValid(role, List.of(byA, byB, byA), PAYLOAD));
    }

    @Test
    public void foreignAndBrokenSignaturesDoNotCount() {
        TufPublicKey a = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        TufPublicKey b = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        TufPublicKey outsider = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        BaseRole role = BaseRole.of(RoleName.TARGETS, List.of(a, b), 2);

        Signature byA = custody.sign(a.id(), PAYLOAD);
        Signature byOutsider = custody.sign(outsider.id(), PAYLOAD);
        Signature forged = new Signature(b.id(), byA.method(), byA.signature(), true);

        assertEquals(1, registry.countValid(role, List.of(byA, byOutsider, forged), PAYLOAD));
        ThresholdNotMetException e = assertThrows(ThresholdNotMetException.class,
                () -> registry.requireThreshold(role, List.of(byA, byOutsider, forged), PAYLOAD));
        assertEquals("targets", e.role());
        assertEquals(2, e.threshold());
        assertEquals(1, e.valid());

        List<Signature> checked = registry.withValidity(role, List.of(byA, forged), PAYLOAD);
        assertTrue(checked.get(0).isValid());
        assertFalse(checked.get(1).isValid());
    }

    @Test
    public void rotationInvalidatesCachedResults() {
        BaseRole targets = registry.getRole(RoleName.TARGETS);
        String keyId = targets.keys().keySet().iterator().next();
        Signature sig = custody.sign(keyId, PAYLOAD);
        assertTrue(registry.isValid(targets, sig, PAYLOAD));
        assertEquals(1, registry.cache().size(RoleName.TARGETS));

        TufPublicKey next = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        RoleRegistry rotated = registry.withRole(BaseRole.of(RoleName.TARGETS, List.of(next), 1), false);
        rotated.invalidate(RoleName.TARGETS);
        assertEquals(0, registry.cache().size(RoleName.TARGETS));
        assertFalse(rotated.isValid(rotated.getRole(RoleName.TARGETS), sig, PAYLOAD));
        assertTrue(registry.getRole(RoleName.TARGETS).hasKey(keyId));
    }

    @Test
    public void supersededPayloadsAreEvicted() {
        BaseRole targets = registry.getRole(RoleName.TARGETS);
        String keyId = targets.keys().keySet().iterator().next();
        byte[] v2 = "targets v2".getBytes(StandardCharsets.UTF_8);
        assertTrue(registry.isValid(targets, custody.sign(keyId, PAYLOAD), PAYLOAD));
        Signature current = custody.sign(keyId, v2);
        assertTrue(registry.isValid(targets, current, v2));
        assertTrue(registry.isValid(registry.getRole(RoleName.ROOT), custody.sign(rootKey.id(), PAYLOAD), PAYLOAD));
        assertEquals(2, registry.cache().size(RoleName.TARGETS));

        registry.retainCurrent(role -> RoleName.TARGETS.equals(role) ? Optional.of(v2) : Optional.empty());
        assertEquals(1, registry.cache().size(RoleName.TARGETS));
        assertEquals(0, registry.cache().size(RoleName.ROOT));
        assertTrue(registry.isValid(targets, current, v2));
        assertEquals(1, registry.cache().size(RoleName.TARGETS));
    }
}
