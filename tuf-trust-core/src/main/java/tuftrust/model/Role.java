package tuftrust.model;

import java.util.List;

/**
 * A role as reported to callers: its key IDs, threshold and signable paths.
 */
public record Role(
        RoleName name,
        RootRole rootRole,
        List<String> paths
) {
    public Role {
        paths = List.copyOf(paths);
    }

    public static Role of(BaseRole base, List<String> paths) {
        return new Role(base.name(), new RootRole(List.copyOf(base.keys().keySet()), base.threshold()), paths);
    }
}
