package tuftrust.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuftrust.catalog.TargetCatalog;
import tuftrust.catalog.TargetChanges;
import tuftrust.changelist.ChangeCodec;
import tuftrust.changelist.Changelist;
import tuftrust.changelist.MemChangelist;
import tuftrust.changelist.RoleEdit;
import tuftrust.crypto.CryptoService;
import tuftrust.delegation.DelegationResolver;
import tuftrust.delegation.DelegationTree;
import tuftrust.errors.AlreadyInitializedException;
import tuftrust.errors.InvalidRoleException;
import tuftrust.errors.NotFoundException;
import tuftrust.errors.NotInitializedException;
import tuftrust.errors.SessionFailedException;
import tuftrust.errors.TrustException;
import tuftrust.model.BaseRole;
import tuftrust.model.Change;
import tuftrust.model.DelegationRole;
import tuftrust.model.Gun;
import tuftrust.model.Role;
import tuftrust.model.RoleName;
import tuftrust.model.RoleWithSignatures;
import tuftrust.model.Signature;
import tuftrust.model.SignedMetadata;
import tuftrust.model.Target;
import tuftrust.model.TargetSignedStruct;
import tuftrust.model.TargetWithRole;
import tuftrust.model.TufPublicKey;
import tuftrust.registry.RoleRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The trust engine for one GUN.
 * <p>
 * Edits are staged into the session's changelist and only reach the
 * committed roles, delegations and targets through {@link #publish()}, which
 * folds the whole changelist into a candidate, signs it through key custody,
 * verifies thresholds, hands it to the remote store and then swaps it in.
 * Any failure on the way leaves the committed state and the changelist as
 * they were.
 * <p>
 * Queries read one committed snapshot and may run alongside staging and
 * publishing. Publishing and deletion are serialized per session. Staging
 * calls from several threads are serialized against each other.
 */
public class TrustSession {

    private final static Logger log = LoggerFactory.getLogger(TrustSession.class);

    private final Gun gun;
    private final CryptoService cryptoService;
    private final RemoteStore remote;
    private final TrustConfig config;
    private final MetadataWriter writer;
    private final Changelist changelist = new MemChangelist();
    private final ReentrantLock publishLock = new ReentrantLock();
    private final Object staging = new Object();

    private volatile TrustState state;
    private volatile SessionState phase = SessionState.UNINITIALIZED;
    private volatile RuntimeException failure;

    public TrustSession(Gun gun, CryptoService cryptoService) {
        this(gun, cryptoService, RemoteStore.offline(), TrustConfig.load());
    }

    public TrustSession(Gun gun, CryptoService cryptoService, RemoteStore remote, TrustConfig config) {
        this.gun = gun;
        this.cryptoService = cryptoService;
        this.remote = remote;
        this.config = config;
        this.writer = new MetadataWriter(cryptoService, config);
    }

    public Gun gun() {
        return gun;
    }

    public CryptoService cryptoService() {
        return cryptoService;
    }

    public SessionState state() {
        return phase;
    }

    // ---------------------------------------------------------------- lifecycle

    public void initialize(List<String> rootKeyIds, RoleName... serverManagedRoles) {
        initialize(rootKeyIds, Arrays.asList(serverManagedRoles));
    }

    /**
     * Establish the root of trust for this GUN. Nothing is signed until the
     * first {@link #publish()}.
     *
     * @throws AlreadyInitializedException       if called twice without {@link #deleteTrustData}
     * @throws tuftrust.errors.InvalidRootKeysException if a root key is unknown to custody
     */
    public void initialize(List<String> rootKeyIds, Collection<RoleName> serverManagedRoles) {
        publishLock.lock();
        try {
            if (phase == SessionState.FAILED) {
                throw new SessionFailedException(gun.value(), failure);
            }
            if (state != null) {
                throw new AlreadyInitializedException(gun.value());
            }
            RoleRegistry registry = RoleRegistry.initialize(cryptoService, gun, rootKeyIds, serverManagedRoles,
                    role -> remote.managedKey(gun, role), config.keyAlgorithm());
            state = new TrustState(registry, DelegationTree.empty(), TargetCatalog.empty(), 0);
            phase = SessionState.INITIALIZED;
            log.info("Initialized trust data for {}", gun);
        } finally {
            publishLock.unlock();
        }
    }

    public void publish() {
        publish(PublishCancellation.none());
    }

    /**
     * Fold every staged change into a new signed generation, all or nothing.
     * <p>
     * On a {@link TrustException} the candidate is discarded, the changelist
     * is left untouched and the session returns to {@code STAGING}. Any other
     * failure moves the session to {@code FAILED}.
     */
    public void publish(PublishCancellation cancellation) {
        publishLock.lock();
        try {
            TrustState base = requireUsable();
            List<Change> batch = changelist.list();
            if (batch.isEmpty() && base.published()) {
                log.debug("Nothing staged for {}", gun);
                return;
            }
            phase = SessionState.PUBLISHING;
            try {
                cancellation.checkpoint("authorize");
                Candidate candidate = new Candidate(base);
                candidate.applyAll(batch);
                candidate.validate();

                cancellation.checkpoint("sign");
                Map<RoleName, SignedMetadata> signed = writer.sign(candidate);
                writer.verify(candidate, signed);

                cancellation.checkpoint("commit");
                remote.publish(gun, List.copyOf(signed.values()));

                TargetCatalog catalog = candidate.catalog().withMetadata(signed.values());
                state = candidate.commit(catalog);
                candidate.rotated().forEach(candidate.registry()::invalidate);
                TargetCatalog committed = state.catalog();
                state.registry().retainCurrent(role -> committed.metadata(role).map(SignedMetadata::payload));
                changelist.clearFirst(batch.size());
                log.info("Published generation {} for {}: {} changes, signed {}",
                        state.generation(), gun, batch.size(), signed.keySet());
            } catch (TrustException e) {
                log.warn("Publish rejected for {}: {}", gun, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                failure = e;
                phase = SessionState.FAILED;
                log.error("Publish failed for {}, session unusable until trust data is deleted", gun, e);
                throw new SessionFailedException(gun.value(), e);
            } finally {
                if (phase == SessionState.PUBLISHING) {
                    settle();
                }
            }
        } finally {
            publishLock.unlock();
        }
    }

    /**
     * Wipe the committed and staged state of this session.
     * <p>
     * With {@code deleteRemote} the remote copy goes first; the local wipe
     * happens only once the remote confirms, so a remote failure leaves local
     * state intact. Keys in custody are kept.
     */
    public void deleteTrustData(boolean deleteRemote) {
        publishLock.lock();
        try {
            if (deleteRemote) {
                remote.delete(gun);
                log.info("Deleted remote trust data for {}", gun);
            }
            TrustState current = state;
            if (current != null) {
                current.registry().cache().invalidateAll();
            }
            synchronized (staging) {
                changelist.clear();
                state = null;
                failure = null;
                phase = SessionState.UNINITIALIZED;
            }
            log.info("Deleted local trust data for {}", gun);
        } finally {
            publishLock.unlock();
        }
    }

    /** Drop every staged change without publishing. */
    public void discardChanges() {
        publishLock.lock();
        try {
            requireUsable();
            synchronized (staging) {
                changelist.clear();
                phase = SessionState.INITIALIZED;
            }
            log.info("Discarded staged changes for {}", gun);
        } finally {
            publishLock.unlock();
        }
    }

    // ---------------------------------------------------------------- targets

    public void addTarget(Target target, RoleName... roles) {
        synchronized (staging) {
            TrustState s = requireUsable();
            DelegationTree pending = DelegationResolver.preview(s.delegations(), changelist.list());
            stage(TargetChanges.add(target, List.of(roles), s.delegations(), pending));
        }
    }

    public void removeTarget(String name, RoleName... roles) {
        synchronized (staging) {
            TrustState s = requireUsable();
            DelegationTree pending = DelegationResolver.preview(s.delegations(), changelist.list());
            stage(TargetChanges.remove(name, List.of(roles), s.delegations(), pending));
        }
    }

    /**
     * Committed targets, one entry per name. With no roles, the entry comes
     * from the highest priority role: {@code targets}, then delegations parent
     * first, siblings in registration order. With roles, only those are
     * consulted, in the order given.
     */
    public List<TargetWithRole> listTargets(RoleName... roles) {
        TrustState s = requireInitialized();
        return s.catalog().list(walkOrder(s, roles));
    }

    public TargetWithRole getTargetByName(String name, RoleName... roles) {
        TrustState s = requireInitialized();
        return s.catalog().find(name, walkOrder(s, roles))
                .orElseThrow(() -> new NotFoundException("target", name));
    }

    /**
     * Every role's signed statement about {@code name}, each with its own
     * signatures checked against the role's current keys.
     */
    public List<TargetSignedStruct> getAllTargetMetadataByName(String name) {
        TrustState s = requireInitialized();
        List<TargetSignedStruct> statements = new ArrayList<>();
        for (RoleName role : s.delegations().priorityOrder()) {
            Optional<Target> target = s.catalog().get(role, name);
            if (target.isEmpty()) {
                continue;
            }
            DelegationRole signer = role.isDelegation()
                    ? s.delegations().get(role).orElseThrow()
                    : new DelegationRole(s.registry().getRole(role), DelegationTree.TARGETS_PATHS);
            statements.add(new TargetSignedStruct(signer, target.get(), signatures(s, signer.base())));
        }
        if (statements.isEmpty()) {
            throw new NotFoundException("target", name);
        }
        return statements;
    }

    /** A copy of the staged changes, in append order. */
    public Changelist getChangelist() {
        requireInitialized();
        return MemChangelist.of(changelist.list());
    }

    // ---------------------------------------------------------------- roles

    /** Top-level roles, then delegations parent first, with their current signatures. */
    public List<RoleWithSignatures> listRoles() {
        TrustState s = requireInitialized();
        List<RoleWithSignatures> roles = new ArrayList<>();
        for (BaseRole base : s.registry().roles()) {
            List<String> paths = RoleName.TARGETS.equals(base.name()) ? DelegationTree.TARGETS_PATHS : List.of();
            roles.add(new RoleWithSignatures(Role.of(base, paths), signatures(s, base)));
        }
        for (RoleName name : s.delegations().priorityOrder()) {
            if (name.isDelegation()) {
                DelegationRole d = s.delegations().get(name).orElseThrow();
                roles.add(new RoleWithSignatures(d.toRole(), signatures(s, d.base())));
            }
        }
        return roles;
    }

    /** Whether the committed metadata of {@code role} still meets its threshold under current keys. */
    public boolean verifyRole(RoleName role) {
        TrustState s = requireInitialized();
        BaseRole base = role.isDelegation()
                ? s.delegations().get(role).orElseThrow(() -> new NotFoundException("role", role.value())).base()
                : s.registry().getRole(role);
        return s.catalog().metadata(role)
                .map(m -> s.registry().verifyThreshold(base, m.signatures(), m.payload()))
                .orElse(false);
    }

    // ---------------------------------------------------------------- delegations

    public List<Role> getDelegationRoles() {
        return getDelegationRoles(false);
    }

    public List<Role> getDelegationRoles(boolean includePending) {
        TrustState s = requireInitialized();
        DelegationResolver resolver = new DelegationResolver(s.delegations(),
                includePending ? changelist.list() : List.of());
        List<Role> roles = new ArrayList<>();
        for (DelegationRole d : resolver.listDelegations(includePending)) {
            roles.add(d.toRole());
        }
        return roles;
    }

    /** Committed delegations allowed to sign {@code path}, most specific first. */
    public List<DelegationRole> resolveForPath(String path) {
        TrustState s = requireInitialized();
        return new DelegationResolver(s.delegations(), List.of()).resolveForPath(path);
    }

    public void addDelegation(RoleName name, List<TufPublicKey> keys, List<String> paths) {
        synchronized (staging) {
            stage(List.of(resolver().addDelegation(name, keys, paths)));
        }
    }

    public void addDelegationRoleAndKeys(RoleName name, List<TufPublicKey> keys) {
        synchronized (staging) {
            stage(List.of(resolver().addDelegationRoleAndKeys(name, keys)));
        }
    }

    public void addDelegationPaths(RoleName name, List<String> paths) {
        synchronized (staging) {
            stage(List.of(resolver().addDelegationPaths(name, paths)));
        }
    }

    public void removeDelegationKeysAndPaths(RoleName name, List<String> keyIds, List<String> paths) {
        synchronized (staging) {
            stage(List.of(resolver().removeDelegationKeysAndPaths(name, keyIds, paths)));
        }
    }

    public void removeDelegationRole(RoleName name) {
        synchronized (staging) {
            stage(List.of(resolver().removeDelegationRole(name)));
        }
    }

    public void removeDelegationPaths(RoleName name, List<String> paths) {
        synchronized (staging) {
            stage(List.of(resolver().removeDelegationPaths(name, paths)));
        }
    }

    public void removeDelegationKeys(RoleName name, List<String> keyIds) {
        synchronized (staging) {
            stage(List.of(resolver().removeDelegationKeys(name, keyIds)));
        }
    }

    public void clearDelegationPaths(RoleName name) {
        synchronized (staging) {
            stage(List.of(resolver().clearDelegationPaths(name)));
        }
    }

    /**
     * Stage a re-signing of each role's current metadata with its current
     * keys. Roles that are not {@code targets} or a known delegation are
     * skipped.
     *
     * @return the roles that were staged
     */
    public List<RoleName> witness(RoleName... roles) {
        synchronized (staging) {
            TrustState s = requireUsable();
            DelegationTree pending = DelegationResolver.preview(s.delegations(), changelist.list());
            List<RoleName> witnessed = new ArrayList<>();
            List<Change> changes = new ArrayList<>();
            for (RoleName role : roles) {
                if (role.signsTargets() && pending.knows(role) && !witnessed.contains(role)) {
                    witnessed.add(role);
                    changes.add(new Change(Change.Action.UPDATE, role, Change.TYPE_WITNESS, "", null));
                } else {
                    log.info("Cannot witness {} on {}", role, gun);
                }
            }
            stage(changes);
            return witnessed;
        }
    }

    public void rotateKey(RoleName role, boolean serverManagesKey, List<String> keyList) {
        rotateKey(role, serverManagesKey, keyList, 0);
    }

    /**
     * Stage a key rotation for a top-level role.
     *
     * @param serverManagesKey the server creates and holds the new key; only for snapshot and timestamp
     * @param keyList          custody key IDs to rotate to; empty creates one new key
     * @param threshold        new threshold, or 0 to keep the current one
     */
    public void rotateKey(RoleName role, boolean serverManagesKey, List<String> keyList, int threshold) {
        synchronized (staging) {
            TrustState s = requireUsable();
            if (!RoleName.BASE_ROLES.contains(role)) {
                throw new InvalidRoleException(role.value(), "only top-level roles can be rotated");
            }
            if (serverManagesKey && !RoleRegistry.MANAGEABLE.contains(role)) {
                throw new InvalidRoleException(role.value(), "only snapshot and timestamp keys can be server managed");
            }
            if (serverManagesKey && !keyList.isEmpty()) {
                throw new InvalidRoleException(role.value(), "a server managed rotation takes no key list");
            }
            List<TufPublicKey> keys = new ArrayList<>();
            if (serverManagesKey) {
                keys.add(remote.rotateManagedKey(gun, role));
            } else if (keyList.isEmpty()) {
                keys.add(cryptoService.create(role, gun, config.keyAlgorithm()));
            } else {
                for (String id : keyList) {
                    keys.add(cryptoService.getKey(id).orElseThrow(() -> new NotFoundException("key", id)));
                }
            }
            keys = new ArrayList<>(BaseRole.keyMap(keys).values());
            int effective = threshold > 0 ? threshold : s.registry().getRole(role).threshold();
            if (keys.size() < effective) {
                throw new InvalidRoleException(role.value(), keys.size() + " keys for threshold " + effective);
            }
            RoleEdit edit = new RoleEdit(keys, threshold, serverManagesKey);
            stage(List.of(new Change(Change.Action.UPDATE, role, Change.TYPE_ROLE, "", ChangeCodec.encode(edit))));
            s.registry().invalidate(role);
        }
    }

    // ---------------------------------------------------------------- internals

    private DelegationResolver resolver() {
        TrustState s = requireUsable();
        return new DelegationResolver(s.delegations(), changelist.list());
    }

    /** Append validated changes together; called with the staging monitor held. */
    private void stage(List<Change> changes) {
        for (Change c : changes) {
            changelist.add(c);
            log.debug("Staged {} on {}", c, gun);
        }
        if (!changes.isEmpty() && phase == SessionState.INITIALIZED) {
            phase = SessionState.STAGING;
        }
    }

    private void settle() {
        synchronized (staging) {
            phase = changelist.isEmpty() ? SessionState.INITIALIZED : SessionState.STAGING;
        }
    }

    private TrustState requireInitialized() {
        TrustState s = state;
        if (s == null) {
            throw new NotInitializedException(gun.value());
        }
        return s;
    }

    private TrustState requireUsable() {
        if (phase == SessionState.FAILED) {
            throw new SessionFailedException(gun.value(), failure);
        }
        return requireInitialized();
    }

    private List<RoleName> walkOrder(TrustState s, RoleName... roles) {
        if (roles.length == 0) {
            return s.delegations().priorityOrder();
        }
        List<RoleName> order = new ArrayList<>();
        for (RoleName r : roles) {
            if (s.delegations().knows(r) && !order.contains(r)) {
                order.add(r);
            }
        }
        return order;
    }

    private List<Signature> signatures(TrustState s, BaseRole role) {
        return s.catalog().metadata(role.name())
                .map(m -> s.registry().withValidity(role, m.signatures(), m.payload()))
                .orElse(List.of());
    }
}
