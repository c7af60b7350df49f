package tuftrust.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

import org.junit.jupiter.api.Test;

import tuftrust.errors.NotFoundException;
import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;
import tuftrust.model.Signature;
import tuftrust.model.TufPublicKey;

public class MemoryCryptoServiceTest {

    private static final Gun    GUN     = new Gun("example.com/app");
    private static final byte[] PAYLOAD = "metadata".getBytes(StandardCharsets.UTF_8);

    @Test
    public void signAndVerifyWithEveryAlgorithm() {
        MemoryCryptoService custody = new MemoryCryptoService();
        for (KeyAlgorithm algorithm : KeyAlgorithm.values()) {
            TufPublicKey key = custody.create(RoleName.TARGETS, GUN, algorithm);
            assertEquals(algorithm, key.algorithm());
            Signature sig = custody.sign(key.id(), PAYLOAD);
            assertEquals(key.id(), sig.keyId());
            assertEquals(algorithm.signatureMethod(), sig.method());
            assertTrue(custody.verify(key, PAYLOAD, sig), algorithm.name());
            assertFalse(custody.verify(key, "tampered".getBytes(StandardCharsets.UTF_8), sig), algorithm.name());
        }
    }

    @Test
    public void signatureFromAnotherKeyDoesNotVerify() {
        MemoryCryptoService custody = new MemoryCryptoService();
        TufPublicKey a = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        TufPublicKey b = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ED25519);
        Signature byA = custody.sign(a.id(), PAYLOAD);
        assertFalse(custody.verify(b, PAYLOAD, byA));
        Signature relabelled = new Signature(b.id(), byA.method(), byA.signature(), true);
        assertFalse(custody.verify(b, PAYLOAD, relabelled));
    }

    @Test
    public void removeKeyIsIdempotent() {
        MemoryCryptoService custody = new MemoryCryptoService();
        TufPublicKey key = custody.create(RoleName.ROOT, GUN, KeyAlgorithm.ED25519);
        custody.removeKey(key.id());
        custody.removeKey(key.id());
        assertTrue(custody.getKey(key.id()).isEmpty());
        assertThrows(NotFoundException.class, () -> custody.getPrivateKey(key.id()));
        assertThrows(NotFoundException.class, () -> custody.sign(key.id(), PAYLOAD));
    }

    @Test
    public void listKeysOnEmptyCustodyTerminates() {
        MemoryCryptoService custody = new MemoryCryptoService();
        Set<String> keys = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> custody.listKeys(RoleName.TARGETS));
        assertTrue(keys.isEmpty());
        assertTrue(custody.listAllKeys().isEmpty());
    }

    @Test
    public void keysAreListedPerRole() {
        MemoryCryptoService custody = new MemoryCryptoService();
        TufPublicKey root = custody.create(RoleName.ROOT, GUN, KeyAlgorithm.ED25519);
        TufPublicKey targets = custody.create(RoleName.TARGETS, GUN, KeyAlgorithm.ECDSA);

        assertEquals(Set.of(root.id()), custody.listKeys(RoleName.ROOT));
        assertEquals(Set.of(targets.id()), custody.listKeys(RoleName.TARGETS));
        assertEquals(RoleName.TARGETS, custody.listAllKeys().get(targets.id()));
        assertEquals(RoleName.ROOT, custody.getPrivateKey(root.id()).role());
        assertEquals(root, custody.getPrivateKey(root.id()).key().publicKey());
    }
}
