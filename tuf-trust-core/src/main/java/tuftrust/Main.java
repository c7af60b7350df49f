package tuftrust;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tuftrust.crypto.MemoryCryptoService;
import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;
import tuftrust.model.Target;
import tuftrust.model.TargetWithRole;
import tuftrust.model.TufPublicKey;
import tuftrust.session.RemoteStore;
import tuftrust.session.TrustConfig;
import tuftrust.session.TrustSession;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Smoke run of the trust engine.
 * <p>
 * For each key algorithm: initialize a collection, delegate a path prefix,
 * stage targets for both roles, publish, and check that the published
 * metadata verifies and the listed targets match their content.
 * Optional argument: the GUN to use.
 */
public class Main {

    private final static Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Gun gun = new Gun(args.length > 0 ? args[0] : "example.com/demo/app");
        TrustConfig config = TrustConfig.load();
        int failures = 0;
        for (KeyAlgorithm algorithm : KeyAlgorithm.values()) {
            if (!smokeTest(gun, config.withKeyAlgorithm(algorithm))) {
                failures++;
            }
        }
        if (failures > 0) {
            log.error("{} of {} algorithms failed", failures, KeyAlgorithm.values().length);
            System.exit(1);
        }
    }

    /** Run one full stage/publish/verify cycle with keys of one algorithm. */
    static boolean smokeTest(Gun gun, TrustConfig config) {
        KeyAlgorithm algorithm = config.keyAlgorithm();
        MemoryCryptoService custody = new MemoryCryptoService();
        TufPublicKey rootKey = custody.create(RoleName.ROOT, gun, algorithm);
        RoleName releases = RoleName.of("targets/releases");
        TufPublicKey releaseKey = custody.create(releases, gun, algorithm);

        TrustSession session = new TrustSession(gun, custody, RemoteStore.offline(), config);
        session.initialize(List.of(rootKey.id()));
        session.addDelegation(releases, List.of(releaseKey), List.of("releases/"));
        session.publish();

        byte[] app = "application image v1".getBytes(StandardCharsets.UTF_8);
        byte[] release = "release bundle v1".getBytes(StandardCharsets.UTF_8);
        session.addTarget(Target.fromContent("app:v1", app, "sha256"));
        session.addTarget(Target.fromContent("releases/bundle:v1", release, "sha256", "sha512"), releases);
        session.publish();

        List<TargetWithRole> targets = session.listTargets();
        boolean ok = targets.size() == 2
                && session.getTargetByName("app:v1").target().verify(app)
                && session.getTargetByName("releases/bundle:v1").target().verify(release)
                && session.verifyRole(RoleName.ROOT)
                && session.verifyRole(RoleName.TARGETS)
                && session.verifyRole(releases)
                && session.getChangelist().isEmpty();
        if (ok) {
            log.info("{}: OK ({} targets, {} roles)", algorithm, targets.size(), session.listRoles().size());
        } else {
            log.error("{}: FAILED, targets {}", algorithm, targets);
        }
        return ok;
    }
}
