package tuftrust.delegation;

import tuftrust.model.DelegationRole;
import tuftrust.model.RoleName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.LinkedHashSet;

/**
 * Immutable set of delegations in registration order.
 * Updating a delegation keeps its position; removing one removes its subtree.
 */
public final class DelegationTree {

    /** Paths of the top-level {@code targets} role: everything. */
    public static final List<String> TARGETS_PATHS = List.of("");

    private static final DelegationTree EMPTY = new DelegationTree(Map.of());

    private final Map<RoleName, DelegationRole> roles;

    private DelegationTree(Map<RoleName, DelegationRole> roles) {
        this.roles = Collections.unmodifiableMap(roles);
    }

    public static DelegationTree empty() {
        return EMPTY;
    }

    public Optional<DelegationRole> get(RoleName name) {
        return Optional.ofNullable(roles.get(name));
    }

    public boolean contains(RoleName name) {
        return roles.containsKey(name);
    }

    /** Delegations in registration order. */
    public List<DelegationRole> all() {
        return List.copyOf(roles.values());
    }

    public List<DelegationRole> children(RoleName parent) {
        List<DelegationRole> children = new ArrayList<>();
        for (DelegationRole d : roles.values()) {
            if (d.name().parent().map(parent::equals).orElse(false)) {
                children.add(d);
            }
        }
        return children;
    }

    /** Paths a role may sign for: {@code [""]} for {@code targets}, empty when unknown. */
    public List<String> pathsOf(RoleName role) {
        if (RoleName.TARGETS.equals(role)) {
            return TARGETS_PATHS;
        }
        DelegationRole d = roles.get(role);
        return d == null ? List.of() : d.paths();
    }

    /** {@code targets} or a delegation in this tree. */
    public boolean knows(RoleName role) {
        return RoleName.TARGETS.equals(role) || roles.containsKey(role);
    }

    /**
     * Priority order for target lookups: parents before children, siblings in
     * registration order. Includes {@code targets} first.
     */
    public List<RoleName> priorityOrder() {
        List<RoleName> order = new ArrayList<>();
        walk(RoleName.TARGETS, order);
        return order;
    }

    private void walk(RoleName role, List<RoleName> order) {
        order.add(role);
        for (DelegationRole child : children(role)) {
            walk(child.name(), order);
        }
    }

    /** {@code root} and every delegation below it, {@code root} first. */
    public Set<RoleName> subtree(RoleName root) {
        Set<RoleName> names = new LinkedHashSet<>();
        List<RoleName> order = new ArrayList<>();
        walk(root, order);
        names.addAll(order);
        return names;
    }

    public DelegationTree with(DelegationRole role) {
        Map<RoleName, DelegationRole> next = new LinkedHashMap<>(roles);
        next.put(role.name(), role);
        return new DelegationTree(next);
    }

    public DelegationTree without(RoleName name) {
        Map<RoleName, DelegationRole> next = new LinkedHashMap<>(roles);
        next.keySet().removeAll(subtree(name));
        return new DelegationTree(next);
    }
}
