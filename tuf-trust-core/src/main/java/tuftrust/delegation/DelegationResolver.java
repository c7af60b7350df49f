package tuftrust.delegation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuftrust.changelist.ChangeCodec;
import tuftrust.changelist.DelegationEdit;
import tuftrust.errors.InvalidRoleException;
import tuftrust.errors.PathConflictException;
import tuftrust.errors.TrustException;
import tuftrust.errors.UnknownDelegationException;
import tuftrust.model.BaseRole;
import tuftrust.model.Change;
import tuftrust.model.Change.Action;
import tuftrust.model.DelegationRole;
import tuftrust.model.Paths;
import tuftrust.model.RoleName;
import tuftrust.model.TufPublicKey;
import tuftrust.model.Util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers "who may sign for this path" over the committed delegations, and
 * turns delegation edits into validated changes.
 * <p>
 * Staging validates against the committed tree with the already staged
 * delegation changes folded in. Path containment is checked at staging only
 * when the parent is already committed; otherwise it waits for publish, which
 * re-checks the whole candidate tree with {@link #validate}.
 */
public class DelegationResolver {

    private final static Logger log = LoggerFactory.getLogger(DelegationResolver.class);

    private final DelegationTree committed;
    private final DelegationTree pending;

    public DelegationResolver(DelegationTree committed, List<Change> staged) {
        this.committed = committed;
        this.pending = preview(committed, staged);
    }

    public DelegationTree committed() {
        return committed;
    }

    public DelegationTree pending() {
        return pending;
    }

    /**
     * Every committed delegation whose paths match {@code path}, deepest first,
     * registration order among equals.
     */
    public List<DelegationRole> resolveForPath(String path) {
        List<DelegationRole> matching = new ArrayList<>();
        for (DelegationRole d : committed.all()) {
            if (d.matches(path)) {
                matching.add(d);
            }
        }
        matching.sort(Comparator.comparingInt((DelegationRole d) -> d.name().depth()).reversed());
        return matching;
    }

    /** Committed delegations, or with staged delegation changes applied when {@code includePending}. */
    public List<DelegationRole> listDelegations(boolean includePending) {
        return includePending ? pending.all() : committed.all();
    }

    public Change addDelegation(RoleName name, List<TufPublicKey> keys, List<String> paths) {
        requireDelegationName(name);
        boolean exists = pending.contains(name);
        if (!exists && keys.isEmpty()) {
            throw new InvalidRoleException(name.value(), "a new delegation needs at least one key");
        }
        requireParent(name);
        checkAddedPaths(name, paths);
        DelegationEdit edit = DelegationEdit.keysAndPaths(exists ? 0 : 1, keys, paths);
        return change(Action.CREATE, name, edit);
    }

    public Change addDelegationRoleAndKeys(RoleName name, List<TufPublicKey> keys) {
        return addDelegation(name, keys, List.of());
    }

    public Change addDelegationPaths(RoleName name, List<String> paths) {
        requireExisting(name);
        checkAddedPaths(name, paths);
        return change(Action.UPDATE, name, DelegationEdit.addPaths(paths));
    }

    public Change removeDelegationKeysAndPaths(RoleName name, List<String> keyIds, List<String> paths) {
        requireExisting(name);
        return change(Action.UPDATE, name, DelegationEdit.removeKeysAndPaths(keyIds, paths));
    }

    public Change removeDelegationKeys(RoleName name, List<String> keyIds) {
        return removeDelegationKeysAndPaths(name, keyIds, List.of());
    }

    public Change removeDelegationPaths(RoleName name, List<String> paths) {
        return removeDelegationKeysAndPaths(name, List.of(), paths);
    }

    public Change clearDelegationPaths(RoleName name) {
        requireExisting(name);
        return change(Action.UPDATE, name, DelegationEdit.clearPaths());
    }

    public Change removeDelegationRole(RoleName name) {
        requireExisting(name);
        return new Change(Action.DELETE, name, Change.TYPE_DELEGATION, "", ChangeCodec.encode(DelegationEdit.none()));
    }

    /**
     * Fold one delegation change into {@code tree}.
     *
     * @throws UnknownDelegationException if the delegation or its parent is missing
     * @throws InvalidRoleException       if the result has fewer keys than its threshold
     * @throws PathConflictException      if an added path is outside the parent's paths
     */
    public static DelegationTree apply(DelegationTree tree, Change change) {
        RoleName name = change.scope();
        requireDelegationName(name);
        DelegationEdit edit = ChangeCodec.decodeDelegationEdit(change.content());
        Optional<DelegationRole> current = tree.get(name);

        if (change.action() == Action.DELETE) {
            if (current.isEmpty()) {
                throw new UnknownDelegationException(name.value());
            }
            return tree.without(name);
        }
        if (current.isEmpty() && change.action() != Action.CREATE) {
            throw new UnknownDelegationException(name.value());
        }
        RoleName parent = name.parent().orElseThrow();
        if (!tree.knows(parent)) {
            throw new UnknownDelegationException(parent.value());
        }

        Map<String, TufPublicKey> keys = new LinkedHashMap<>();
        Set<String> paths = new LinkedHashSet<>();
        int threshold = 1;
        if (current.isPresent()) {
            keys.putAll(current.get().base().keys());
            paths.addAll(current.get().paths());
            threshold = current.get().threshold();
        }
        edit.removeKeys().forEach(keys::remove);
        for (TufPublicKey k : edit.addKeys()) {
            keys.put(k.id(), k);
        }
        if (edit.clearAllPaths()) {
            paths.clear();
        }
        edit.removePaths().forEach(paths::remove);
        List<String> parentPaths = tree.pathsOf(parent);
        for (String p : edit.addPaths()) {
            if (!Paths.isCovered(p, parentPaths)) {
                throw new PathConflictException(name.value(), p, parent.value());
            }
            paths.add(p);
        }
        if (edit.threshold() > 0) {
            threshold = edit.threshold();
        }
        if (keys.size() < threshold) {
            throw new InvalidRoleException(name.value(),
                    keys.size() + " keys left for threshold " + threshold);
        }
        return tree.with(new DelegationRole(new BaseRole(name, keys, threshold), List.copyOf(paths)));
    }

    /**
     * Check tree-wide invariants: every delegation has a parent, and every
     * path is covered by its parent's paths.
     */
    public static void validate(DelegationTree tree) {
        for (DelegationRole d : tree.all()) {
            RoleName parent = d.name().parent().orElseThrow();
            if (!tree.knows(parent)) {
                throw new UnknownDelegationException(parent.value());
            }
            List<String> parentPaths = tree.pathsOf(parent);
            for (String p : d.paths()) {
                if (!Paths.isCovered(p, parentPaths)) {
                    throw new PathConflictException(d.name().value(), p, parent.value());
                }
            }
        }
    }

    /** Committed tree with the staged delegation changes that apply cleanly. */
    public static DelegationTree preview(DelegationTree committed, List<Change> staged) {
        DelegationTree tree = committed;
        for (Change c : staged) {
            if (!Change.TYPE_DELEGATION.equals(c.type())) {
                continue;
            }
            try {
                tree = apply(tree, c);
            } catch (TrustException e) {
                log.debug("Staged change {} does not apply yet: {}", c, e.getMessage());
            }
        }
        return tree;
    }

    private static void requireDelegationName(RoleName name) {
        if (!name.isDelegation()) {
            throw new InvalidRoleException(name.value(), "not a delegation role, expected targets/<name>");
        }
    }

    private void requireExisting(RoleName name) {
        requireDelegationName(name);
        if (!pending.contains(name)) {
            throw new UnknownDelegationException(name.value());
        }
    }

    private void requireParent(RoleName name) {
        RoleName parent = name.parent().orElseThrow();
        if (!pending.knows(parent)) {
            throw new UnknownDelegationException(parent.value());
        }
    }

    private void checkAddedPaths(RoleName name, List<String> paths) {
        for (String p : paths) {
            if (!Util.isWellFormed(p)) {
                throw new InvalidRoleException(name.value(), "path is not well-formed unicode");
            }
        }
        RoleName parent = name.parent().orElseThrow();
        if (!committed.knows(parent)) {
            log.debug("Parent {} of {} is not published yet, path check deferred", parent, name);
            return;
        }
        List<String> parentPaths = pending.pathsOf(parent);
        for (String p : paths) {
            if (!Paths.isCovered(p, parentPaths)) {
                throw new PathConflictException(name.value(), p, parent.value());
            }
        }
    }

    private static Change change(Action action, RoleName name, DelegationEdit edit) {
        return new Change(action, name, Change.TYPE_DELEGATION, "", ChangeCodec.encode(edit));
    }
}
