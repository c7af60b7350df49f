package tuftrust.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuftrust.errors.NotFoundException;
import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;
import tuftrust.model.Signature;
import tuftrust.model.TufPrivateKey;
import tuftrust.model.TufPublicKey;

import java.security.KeyPair;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process key custody backed by a concurrent map.
 */
public class MemoryCryptoService implements CryptoService {

    private final static Logger log = LoggerFactory.getLogger(MemoryCryptoService.class);

    private final Map<String, Held> keys = new ConcurrentHashMap<>();

    @Override
    public TufPublicKey create(RoleName role, Gun gun, KeyAlgorithm algorithm) {
        Signer signer = Signers.of(algorithm);
        KeyPair pair = signer.generateKeyPair();
        TufPublicKey publicKey = new TufPublicKey(signer.algorithm(), pair.getPublic().getEncoded());
        addKey(role, gun, new TufPrivateKey(publicKey, pair.getPrivate()));
        return publicKey;
    }

    @Override
    public void addKey(RoleName role, Gun gun, TufPrivateKey key) {
        keys.put(key.id(), new Held(key, role, gun));
        log.debug("Stored {} key {} for {} on {}", key.algorithm().tag(), key.id(), role, gun);
    }

    @Override
    public Optional<TufPublicKey> getKey(String keyId) {
        Held held = keys.get(keyId);
        return held == null ? Optional.empty() : Optional.of(held.key().publicKey());
    }

    @Override
    public PrivateKeyEntry getPrivateKey(String keyId) {
        Held held = keys.get(keyId);
        if (held == null) {
            throw new NotFoundException("key", keyId);
        }
        return new PrivateKeyEntry(held.key(), held.role());
    }

    @Override
    public void removeKey(String keyId) {
        if (keys.remove(keyId) != null) {
            log.debug("Removed key {}", keyId);
        }
    }

    @Override
    public Set<String> listKeys(RoleName role) {
        Set<String> ids = new TreeSet<>();
        keys.forEach((id, held) -> {
            if (held.role().equals(role)) {
                ids.add(id);
            }
        });
        return Collections.unmodifiableSet(ids);
    }

    @Override
    public Map<String, RoleName> listAllKeys() {
        Map<String, RoleName> all = new LinkedHashMap<>();
        keys.forEach((id, held) -> all.put(id, held.role()));
        return Collections.unmodifiableMap(all);
    }

    @Override
    public Signature sign(String keyId, byte[] payload) {
        Held held = keys.get(keyId);
        if (held == null) {
            throw new NotFoundException("key", keyId);
        }
        KeyAlgorithm algorithm = held.key().algorithm();
        byte[] sig = Signers.of(algorithm).sign(payload, held.key().key());
        return new Signature(keyId, algorithm.signatureMethod(), sig, true);
    }

    private record Held(TufPrivateKey key, RoleName role, Gun gun) {}
}
