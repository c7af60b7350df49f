package tuftrust.session;

import tuftrust.catalog.TargetCatalog;
import tuftrust.catalog.TargetChanges;
import tuftrust.changelist.ChangeCodec;
import tuftrust.changelist.RoleEdit;
import tuftrust.delegation.DelegationResolver;
import tuftrust.delegation.DelegationTree;
import tuftrust.errors.InvalidRoleException;
import tuftrust.errors.MalformedChangeException;
import tuftrust.errors.PathConflictException;
import tuftrust.errors.UnknownDelegationException;
import tuftrust.model.BaseRole;
import tuftrust.model.Change;
import tuftrust.model.Paths;
import tuftrust.model.RoleName;
import tuftrust.model.Target;
import tuftrust.registry.RoleRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The state a publish is building: the committed generation with the staged
 * changes folded in. Never visible outside the publish that owns it.
 */
final class Candidate {

    private RoleRegistry registry;
    private DelegationTree tree;
    private TargetCatalog catalog;
    private BaseRole previousRoot;
    private final int generation;
    private final Set<RoleName> touched = new LinkedHashSet<>();
    private final Set<RoleName> rotated = new LinkedHashSet<>();

    Candidate(TrustState base) {
        this.registry = base.registry();
        this.tree = base.delegations();
        this.catalog = base.catalog();
        this.generation = base.generation();
        if (!base.published()) {
            touched.addAll(RoleName.BASE_ROLES);
        }
    }

    /** Apply every change in order; the first unauthorized one aborts the fold. */
    void applyAll(List<Change> changes) {
        for (Change c : changes) {
            try {
                apply(c);
            } catch (IllegalArgumentException e) {
                throw new MalformedChangeException(c.toString(), e);
            }
        }
    }

    private void apply(Change change) {
        RoleName scope = change.scope();
        switch (change.type()) {
            case Change.TYPE_TARGET:
                catalog = TargetChanges.apply(catalog, change, tree);
                touched.add(scope);
                break;
            case Change.TYPE_DELEGATION:
                Set<RoleName> subtree = tree.subtree(scope);
                tree = DelegationResolver.apply(tree, change);
                if (change.action() == Change.Action.DELETE) {
                    catalog = catalog.withoutRoles(subtree);
                    touched.removeAll(subtree);
                }
                touched.add(scope.parent().orElseThrow());
                break;
            case Change.TYPE_ROLE:
                applyRole(scope, ChangeCodec.decodeRoleEdit(change.content()));
                break;
            case Change.TYPE_WITNESS:
                if (!scope.signsTargets()) {
                    throw new InvalidRoleException(scope.value(), "only targets and delegations can be witnessed");
                }
                if (!tree.knows(scope)) {
                    throw new UnknownDelegationException(scope.value());
                }
                touched.add(scope);
                break;
            default:
                throw new MalformedChangeException(change.toString());
        }
    }

    private void applyRole(RoleName role, RoleEdit edit) {
        if (!RoleName.BASE_ROLES.contains(role)) {
            throw new InvalidRoleException(role.value(), "only top-level roles can be rotated");
        }
        BaseRole current = registry.getRole(role);
        int threshold = edit.threshold() > 0 ? edit.threshold() : current.threshold();
        int distinct = BaseRole.keyMap(edit.keys()).size();
        if (distinct < threshold) {
            throw new InvalidRoleException(role.value(), distinct + " keys for threshold " + threshold);
        }
        if (RoleName.ROOT.equals(role) && previousRoot == null) {
            previousRoot = current;
        }
        registry = registry.withRole(BaseRole.of(role, edit.keys(), threshold), edit.serverManaged());
        rotated.add(role);
        touched.add(RoleName.ROOT);
        touched.add(role);
    }

    /**
     * Tree-wide checks once every change is in: delegation paths nest inside
     * their parents, and every signed target is still inside its role's paths.
     */
    void validate() {
        DelegationResolver.validate(tree);
        for (RoleName role : catalog.signingRoles()) {
            List<String> paths = tree.pathsOf(role);
            for (Target t : catalog.targetsOf(role)) {
                if (!Paths.matchesAny(paths, t.name())) {
                    throw new PathConflictException(role.value(), t.name(), role.value());
                }
            }
        }
    }

    /** Roles to re-sign, in signing order: root, targets roles by priority, snapshot, timestamp. */
    List<RoleName> toSign() {
        Set<RoleName> order = new LinkedHashSet<>();
        if (touched.contains(RoleName.ROOT)) {
            order.add(RoleName.ROOT);
        }
        for (RoleName role : tree.priorityOrder()) {
            if (touched.contains(role)) {
                order.add(role);
            }
        }
        if (!order.isEmpty() || touched.contains(RoleName.SNAPSHOT) || touched.contains(RoleName.TIMESTAMP)) {
            order.add(RoleName.SNAPSHOT);
            order.add(RoleName.TIMESTAMP);
        }
        return List.copyOf(order);
    }

    /** Keys and threshold that must sign {@code role} in this candidate. */
    BaseRole signingRole(RoleName role) {
        if (role.isDelegation()) {
            return tree.get(role).orElseThrow(() -> new UnknownDelegationException(role.value())).base();
        }
        return registry.getRole(role);
    }

    RoleRegistry registry() {
        return registry;
    }

    DelegationTree tree() {
        return tree;
    }

    TargetCatalog catalog() {
        return catalog;
    }

    /** Root as it was before this batch rotated it; null when root keys are unchanged. */
    BaseRole previousRoot() {
        return previousRoot;
    }

    Set<RoleName> rotated() {
        return rotated;
    }

    TrustState commit(TargetCatalog signedCatalog) {
        return new TrustState(registry, tree, signedCatalog, generation + 1);
    }
}
