package tuftrust.model;

import java.util.List;

/**
 * One role's signed statement about a target.
 */
public record TargetSignedStruct(
        DelegationRole role,
        Target target,
        List<Signature> signatures
) {
    public TargetSignedStruct {
        signatures = List.copyOf(signatures);
    }
}
