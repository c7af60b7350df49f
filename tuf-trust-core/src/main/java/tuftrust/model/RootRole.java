package tuftrust.model;

import java.util.List;

/**
 * Key ID view of a role, as recorded in root metadata.
 */
public record RootRole(
        List<String> keyIds,
        int threshold
) {
    public RootRole {
        keyIds = List.copyOf(keyIds);
    }
}
