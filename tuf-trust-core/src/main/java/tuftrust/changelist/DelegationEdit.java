package tuftrust.changelist;

import tuftrust.model.TufPublicKey;

import java.util.List;

/**
 * Content of a delegation change.
 *
 * @param threshold new threshold, or 0 to keep the current one
 */
public record DelegationEdit(
        int threshold,
        List<TufPublicKey> addKeys,
        List<String> removeKeys,
        List<String> addPaths,
        List<String> removePaths,
        boolean clearAllPaths
) {
    public DelegationEdit {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must not be negative");
        }
        addKeys = List.copyOf(addKeys);
        removeKeys = List.copyOf(removeKeys);
        addPaths = List.copyOf(addPaths);
        removePaths = List.copyOf(removePaths);
    }

    public static DelegationEdit none() {
        return new DelegationEdit(0, List.of(), List.of(), List.of(), List.of(), false);
    }

    public static DelegationEdit keysAndPaths(int threshold, List<TufPublicKey> keys, List<String> paths) {
        return new DelegationEdit(threshold, keys, List.of(), paths, List.of(), false);
    }

    public static DelegationEdit addPaths(List<String> paths) {
        return new DelegationEdit(0, List.of(), List.of(), paths, List.of(), false);
    }

    public static DelegationEdit removeKeysAndPaths(List<String> keyIds, List<String> paths) {
        return new DelegationEdit(0, List.of(), keyIds, List.of(), paths, false);
    }

    public static DelegationEdit clearPaths() {
        return new DelegationEdit(0, List.of(), List.of(), List.of(), List.of(), true);
    }
}
