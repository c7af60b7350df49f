package tuftrust.model;

import java.util.List;

public record RoleWithSignatures(
        Role role,
        List<Signature> signatures
) {
    public RoleWithSignatures {
        signatures = List.copyOf(signatures);
    }
}
