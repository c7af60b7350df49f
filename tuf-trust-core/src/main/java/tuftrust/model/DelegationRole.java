package tuftrust.model;

import java.util.List;

/**
 * A role scoped beneath a parent, allowed to sign only for names under {@code paths}.
 * Paths are prefixes; the empty path covers every name.
 */
public record DelegationRole(
        BaseRole base,
        List<String> paths
) {
    public DelegationRole {
        paths = List.copyOf(paths);
    }

    public RoleName name() {
        return base.name();
    }

    public int threshold() {
        return base.threshold();
    }

    public boolean matches(String targetName) {
        return Paths.matchesAny(paths, targetName);
    }

    public Role toRole() {
        return Role.of(base, paths);
    }
}
