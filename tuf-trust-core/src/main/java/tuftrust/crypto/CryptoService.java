package tuftrust.crypto;

import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;
import tuftrust.model.Signature;
import tuftrust.model.TufPrivateKey;
import tuftrust.model.TufPublicKey;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key custody: creates, stores, lists and removes keys, and signs with them.
 * The trust engine never reads private key material itself; every signature
 * is produced here so the backing store (memory, file, token, remote signer)
 * can be swapped.
 */
public interface CryptoService {

    /**
     * Issue a new key pair and keep the private half in custody.
     *
     * @return the public half
     */
    TufPublicKey create(RoleName role, Gun gun, KeyAlgorithm algorithm);

    /** Add an existing private key under the given role and GUN. */
    void addKey(RoleName role, Gun gun, TufPrivateKey key);

    /** The public key for {@code keyId}, if held. */
    Optional<TufPublicKey> getKey(String keyId);

    /**
     * @throws tuftrust.errors.NotFoundException if the key is not held
     */
    PrivateKeyEntry getPrivateKey(String keyId);

    /** Remove a key. Removing an absent key is not an error. */
    void removeKey(String keyId);

    /** IDs of the keys stored for {@code role}; empty when there are none. */
    Set<String> listKeys(RoleName role);

    /** Every held key ID mapped to its role. */
    Map<String, RoleName> listAllKeys();

    /**
     * Sign {@code payload} with the held key.
     *
     * @throws tuftrust.errors.NotFoundException if the key is not held
     */
    Signature sign(String keyId, byte[] payload);

    /** Check {@code signature} over {@code payload} against {@code key}. */
    default boolean verify(TufPublicKey key, byte[] payload, Signature signature) {
        if (!key.id().equals(signature.keyId())
                || !key.algorithm().signatureMethod().equals(signature.method())) {
            return false;
        }
        Signer signer = Signers.of(key.algorithm());
        try {
            return signer.verify(payload, signature.signature(), signer.decodePublicKey(key.encoded()));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
