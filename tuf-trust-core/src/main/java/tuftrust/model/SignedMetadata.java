package tuftrust.model;

import java.time.Instant;
import java.util.List;

/**
 * One signed generation of a role's metadata.
 * Signatures are over {@code payload}, the canonical bytes of the role's content.
 */
public record SignedMetadata(
        RoleName role,
        int version,
        Instant expires,
        byte[] payload,
        List<Signature> signatures
) {
    public SignedMetadata {
        payload = payload.clone();
        signatures = List.copyOf(signatures);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
