package tuftrust.crypto;

import tuftrust.model.RoleName;
import tuftrust.model.TufPrivateKey;

/**
 * A private key and the role it was stored under.
 */
public record PrivateKeyEntry(
        TufPrivateKey key,
        RoleName role
) {}
