package tuftrust.catalog;

import tuftrust.changelist.ChangeCodec;
import tuftrust.changelist.TargetMeta;
import tuftrust.delegation.DelegationTree;
import tuftrust.errors.PathNotAuthorizedException;
import tuftrust.errors.UnknownDelegationException;
import tuftrust.model.Change;
import tuftrust.model.Change.Action;
import tuftrust.model.Paths;
import tuftrust.model.RoleName;
import tuftrust.model.Target;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builds and applies target changes.
 * A role may only sign for names under its paths; roles other than
 * {@code targets} and its delegations never sign targets.
 */
public final class TargetChanges {

    private TargetChanges() {}

    /** One create change per role; {@code targets} when no role is given. */
    public static List<Change> add(Target target, List<RoleName> roles,
                                   DelegationTree committed, DelegationTree pending) {
        List<Change> changes = new ArrayList<>();
        byte[] content = ChangeCodec.encode(TargetMeta.of(target));
        for (RoleName role : effective(roles)) {
            authorize(role, target.name(), committed, pending);
            changes.add(new Change(Action.CREATE, role, Change.TYPE_TARGET, target.name(), content));
        }
        return changes;
    }

    /** One delete change per role; {@code targets} when no role is given. */
    public static List<Change> remove(String name, List<RoleName> roles,
                                      DelegationTree committed, DelegationTree pending) {
        List<Change> changes = new ArrayList<>();
        for (RoleName role : effective(roles)) {
            requireTargetsRole(role, name, pending);
            changes.add(new Change(Action.DELETE, role, Change.TYPE_TARGET, name, null));
        }
        return changes;
    }

    /**
     * Fold a target change into {@code catalog}, authorizing it against the
     * candidate delegations.
     */
    public static TargetCatalog apply(TargetCatalog catalog, Change change, DelegationTree tree) {
        RoleName role = change.scope();
        requireTargetsRole(role, change.path(), tree);
        if (change.action() == Action.DELETE) {
            return catalog.withoutTarget(role, change.path());
        }
        if (!Paths.matchesAny(tree.pathsOf(role), change.path())) {
            throw new PathNotAuthorizedException(role.value(), change.path());
        }
        Target target = ChangeCodec.decodeTargetMeta(change.content()).toTarget(change.path());
        return catalog.withTarget(role, target);
    }

    private static List<RoleName> effective(List<RoleName> roles) {
        if (roles == null || roles.isEmpty()) {
            return List.of(RoleName.TARGETS);
        }
        return List.copyOf(new LinkedHashSet<>(roles));
    }

    private static void authorize(RoleName role, String name, DelegationTree committed, DelegationTree pending) {
        requireTargetsRole(role, name, pending);
        if (!committed.knows(role)) {
            // created in this batch; publish checks the path against the candidate
            return;
        }
        if (!Paths.matchesAny(pending.pathsOf(role), name)) {
            throw new PathNotAuthorizedException(role.value(), name);
        }
    }

    private static void requireTargetsRole(RoleName role, String name, DelegationTree tree) {
        if (!role.signsTargets()) {
            throw new PathNotAuthorizedException(role.value(), name);
        }
        if (!tree.knows(role)) {
            throw new UnknownDelegationException(role.value());
        }
    }
}
