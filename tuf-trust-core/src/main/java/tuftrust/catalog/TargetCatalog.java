package tuftrust.catalog;

import tuftrust.model.RoleName;
import tuftrust.model.SignedMetadata;
import tuftrust.model.Target;
import tuftrust.model.TargetWithRole;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Committed targets per signing role, and the latest signed metadata of every
 * role. Immutable: each {@code with*} call returns the next catalog.
 */
public final class TargetCatalog {

    private static final TargetCatalog EMPTY = new TargetCatalog(Map.of(), Map.of());

    private final Map<RoleName, Map<String, Target>> targets;
    private final Map<RoleName, SignedMetadata> metadata;

    private TargetCatalog(Map<RoleName, Map<String, Target>> targets, Map<RoleName, SignedMetadata> metadata) {
        this.targets = targets;
        this.metadata = metadata;
    }

    public static TargetCatalog empty() {
        return EMPTY;
    }

    /** Targets signed by {@code role}, in the order they were first added. */
    public List<Target> targetsOf(RoleName role) {
        Map<String, Target> forRole = targets.get(role);
        return forRole == null ? List.of() : List.copyOf(forRole.values());
    }

    public Optional<Target> get(RoleName role, String name) {
        Map<String, Target> forRole = targets.get(role);
        return forRole == null ? Optional.empty() : Optional.ofNullable(forRole.get(name));
    }

    public Optional<SignedMetadata> metadata(RoleName role) {
        return Optional.ofNullable(metadata.get(role));
    }

    /**
     * One entry per target name, taken from the first role in {@code walkOrder}
     * that signs for it.
     */
    public List<TargetWithRole> list(List<RoleName> walkOrder) {
        Map<String, TargetWithRole> winners = new LinkedHashMap<>();
        for (RoleName role : walkOrder) {
            for (Target t : targetsOf(role)) {
                winners.putIfAbsent(t.name(), new TargetWithRole(t, role));
            }
        }
        return List.copyOf(winners.values());
    }

    public Optional<TargetWithRole> find(String name, List<RoleName> walkOrder) {
        for (RoleName role : walkOrder) {
            Optional<Target> t = get(role, name);
            if (t.isPresent()) {
                return Optional.of(new TargetWithRole(t.get(), role));
            }
        }
        return Optional.empty();
    }

    public TargetCatalog withTarget(RoleName role, Target target) {
        Map<RoleName, Map<String, Target>> next = copyTargets();
        Map<String, Target> forRole = new LinkedHashMap<>(next.getOrDefault(role, Map.of()));
        forRole.put(target.name(), target);
        next.put(role, Collections.unmodifiableMap(forRole));
        return new TargetCatalog(Collections.unmodifiableMap(next), metadata);
    }

    public TargetCatalog withoutTarget(RoleName role, String name) {
        Map<String, Target> current = targets.get(role);
        if (current == null || !current.containsKey(name)) {
            return this;
        }
        Map<RoleName, Map<String, Target>> next = copyTargets();
        Map<String, Target> forRole = new LinkedHashMap<>(current);
        forRole.remove(name);
        next.put(role, Collections.unmodifiableMap(forRole));
        return new TargetCatalog(Collections.unmodifiableMap(next), metadata);
    }

    /** Drop the targets and metadata of every listed role. */
    public TargetCatalog withoutRoles(Collection<RoleName> roles) {
        Map<RoleName, Map<String, Target>> nextTargets = copyTargets();
        nextTargets.keySet().removeAll(roles);
        Map<RoleName, SignedMetadata> nextMetadata = new LinkedHashMap<>(metadata);
        nextMetadata.keySet().removeAll(roles);
        return new TargetCatalog(Collections.unmodifiableMap(nextTargets), Collections.unmodifiableMap(nextMetadata));
    }

    public TargetCatalog withMetadata(Collection<SignedMetadata> signed) {
        Map<RoleName, SignedMetadata> next = new LinkedHashMap<>(metadata);
        for (SignedMetadata m : signed) {
            next.put(m.role(), m);
        }
        return new TargetCatalog(targets, Collections.unmodifiableMap(next));
    }

    /** Roles that currently sign at least one target. */
    public Set<RoleName> signingRoles() {
        Set<RoleName> roles = new LinkedHashSet<>();
        targets.forEach((role, forRole) -> {
            if (!forRole.isEmpty()) {
                roles.add(role);
            }
        });
        return roles;
    }

    public int size() {
        int n = 0;
        for (Map<String, Target> forRole : targets.values()) {
            n += forRole.size();
        }
        return n;
    }

    private Map<RoleName, Map<String, Target>> copyTargets() {
        return new LinkedHashMap<>(targets);
    }
}
