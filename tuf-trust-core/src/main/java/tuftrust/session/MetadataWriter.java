package tuftrust.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuftrust.crypto.CryptoService;
import tuftrust.model.BaseRole;
import tuftrust.model.DelegationRole;
import tuftrust.model.RoleName;
import tuftrust.model.Signature;
import tuftrust.model.SignedMetadata;
import tuftrust.model.Target;
import tuftrust.model.TufPublicKey;
import tuftrust.model.Util;
import tuftrust.registry.RoleRegistry;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the next signed metadata generation for a candidate.
 * <p>
 * Each role's content is rendered to deterministic canonical bytes and
 * signed through key custody with every role key custody holds. Root
 * rotations are also signed by the outgoing root keys. Server-managed roles
 * are rendered but left unsigned for the remote to sign.
 */
class MetadataWriter {

    private final static Logger log = LoggerFactory.getLogger(MetadataWriter.class);

    private final CryptoService cryptoService;
    private final TrustConfig config;

    MetadataWriter(CryptoService cryptoService, TrustConfig config) {
        this.cryptoService = cryptoService;
        this.config = config;
    }

    /** Render and sign every role the candidate touched, in signing order. */
    Map<RoleName, SignedMetadata> sign(Candidate candidate) {
        Map<RoleName, SignedMetadata> signed = new LinkedHashMap<>();
        Instant now = config.clock().instant();
        for (RoleName role : candidate.toSign()) {
            int version = candidate.catalog().metadata(role).map(m -> m.version() + 1).orElse(1);
            Instant expires = now.plus(config.expiryOf(role));
            byte[] payload = canonicalPayload(candidate, role, version, expires, signed);
            List<Signature> signatures = candidate.registry().isServerManaged(role)
                    ? List.of()
                    : signatures(candidate, role, payload);
            signed.put(role, new SignedMetadata(role, version, expires, payload, signatures));
            log.debug("Signed {} v{} with {} signatures", role, version, signatures.size());
        }
        return signed;
    }

    /**
     * Re-check every fresh signature set against the candidate's keys.
     *
     * @throws tuftrust.errors.ThresholdNotMetException for the first role short of its threshold
     */
    void verify(Candidate candidate, Map<RoleName, SignedMetadata> signed) {
        RoleRegistry registry = candidate.registry();
        for (SignedMetadata m : signed.values()) {
            if (registry.isServerManaged(m.role())) {
                continue;
            }
            registry.requireThreshold(candidate.signingRole(m.role()), m.signatures(), m.payload());
            if (RoleName.ROOT.equals(m.role()) && candidate.previousRoot() != null) {
                registry.requireThreshold(candidate.previousRoot(), m.signatures(), m.payload());
            }
        }
    }

    private List<Signature> signatures(Candidate candidate, RoleName role, byte[] payload) {
        Set<String> keyIds = new LinkedHashSet<>(candidate.signingRole(role).keys().keySet());
        if (RoleName.ROOT.equals(role) && candidate.previousRoot() != null) {
            keyIds.addAll(candidate.previousRoot().keys().keySet());
        }
        List<Signature> signatures = new ArrayList<>();
        for (String keyId : keyIds) {
            if (cryptoService.getKey(keyId).isPresent()) {
                signatures.add(cryptoService.sign(keyId, payload));
            }
        }
        return signatures;
    }

    private byte[] canonicalPayload(Candidate candidate, RoleName role, int version, Instant expires,
                                    Map<RoleName, SignedMetadata> signedSoFar) {
        StringBuilder sb = new StringBuilder();
        field(sb, "type", role.isDelegation() ? "targets" : role.value());
        field(sb, "role", role.value());
        field(sb, "version", Integer.toString(version));
        field(sb, "expires", expires.toString());
        if (RoleName.ROOT.equals(role)) {
            for (BaseRole r : candidate.registry().roles()) {
                roleEntry(sb, "role", r, List.of());
            }
        } else if (role.signsTargets()) {
            for (Target t : candidate.catalog().targetsOf(role)) {
                field(sb, "target", t.name());
                field(sb, "length", Long.toString(t.length()));
                t.hashes().forEach((alg, digest) -> field(sb, "hash", alg + "=" + digest));
            }
            for (DelegationRole d : candidate.tree().children(role)) {
                roleEntry(sb, "delegation", d.base(), d.paths());
            }
        } else if (RoleName.SNAPSHOT.equals(role)) {
            List<RoleName> covered = new ArrayList<>();
            covered.add(RoleName.ROOT);
            covered.addAll(candidate.tree().priorityOrder());
            for (RoleName r : covered) {
                SignedMetadata m = signedSoFar.containsKey(r)
                        ? signedSoFar.get(r)
                        : candidate.catalog().metadata(r).orElse(null);
                if (m != null) {
                    metaEntry(sb, m);
                }
            }
        } else if (RoleName.TIMESTAMP.equals(role)) {
            SignedMetadata snapshot = signedSoFar.get(RoleName.SNAPSHOT);
            if (snapshot != null) {
                metaEntry(sb, snapshot);
            }
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void roleEntry(StringBuilder sb, String kind, BaseRole role, List<String> paths) {
        field(sb, kind, role.name().value());
        field(sb, "threshold", Integer.toString(role.threshold()));
        for (TufPublicKey k : role.keys().values()) {
            field(sb, "key", k.id() + ":" + k.algorithm().tag() + ":" + Util.hex(k.encoded()));
        }
        for (String p : paths) {
            field(sb, "path", p);
        }
    }

    private static void metaEntry(StringBuilder sb, SignedMetadata m) {
        field(sb, "meta", m.role().value());
        field(sb, "version", Integer.toString(m.version()));
        field(sb, "sha256", Util.hex(Util.sha256(m.payload())));
    }

    /** Prefixed with the value's UTF-8 byte length so no value can forge a field boundary. */
    private static void field(StringBuilder sb, String name, String value) {
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        sb.append(name).append(':').append(length).append(':').append(value).append('|');
    }
}
