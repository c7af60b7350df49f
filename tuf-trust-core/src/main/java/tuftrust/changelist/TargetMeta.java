package tuftrust.changelist;

import tuftrust.model.Target;

import java.util.Map;
import java.util.TreeMap;

/**
 * Content of a target change: everything about a target except its name,
 * which travels as the change path.
 */
public record TargetMeta(
        long length,
        Map<String, String> hashes
) {
    public TargetMeta {
        hashes = new TreeMap<>(hashes);
    }

    public static TargetMeta of(Target target) {
        return new TargetMeta(target.length(), target.hashes());
    }

    public Target toTarget(String name) {
        return new Target(name, length, hashes);
    }
}
