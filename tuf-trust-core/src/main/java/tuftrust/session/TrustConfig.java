package tuftrust.session;

import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Session settings: algorithm for newly created keys, metadata lifetime per
 * role, and the clock that stamps expiry.
 * <p>
 * {@link #load()} reads {@code tuftrust.properties} from the classpath:
 * <pre>
 * tuftrust.key.algorithm=ecdsa
 * tuftrust.expiry.root.days=3650
 * tuftrust.expiry.targets.days=1095
 * tuftrust.expiry.snapshot.days=1095
 * tuftrust.expiry.timestamp.days=14
 * </pre>
 * Delegations expire like {@code targets}.
 */
public record TrustConfig(
        KeyAlgorithm keyAlgorithm,
        Map<RoleName, Duration> expiry,
        Clock clock
) {
    public static final String RESOURCE = "/tuftrust.properties";

    private static final Map<RoleName, Duration> DEFAULT_EXPIRY = Map.of(
            RoleName.ROOT, Duration.ofDays(3650),
            RoleName.TARGETS, Duration.ofDays(1095),
            RoleName.SNAPSHOT, Duration.ofDays(1095),
            RoleName.TIMESTAMP, Duration.ofDays(14));

    public TrustConfig {
        expiry = Map.copyOf(expiry);
    }

    public static TrustConfig defaults() {
        return new TrustConfig(KeyAlgorithm.ECDSA, DEFAULT_EXPIRY, Clock.systemUTC());
    }

    /** Defaults overridden by {@code tuftrust.properties}, when present. */
    public static TrustConfig load() {
        try (InputStream in = TrustConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public static TrustConfig fromProperties(Properties props) {
        KeyAlgorithm algorithm = KeyAlgorithm.fromTag(
                props.getProperty("tuftrust.key.algorithm", KeyAlgorithm.ECDSA.tag()));
        Map<RoleName, Duration> expiry = new HashMap<>(DEFAULT_EXPIRY);
        for (RoleName role : RoleName.BASE_ROLES) {
            String days = props.getProperty("tuftrust.expiry." + role.value() + ".days");
            if (days != null) {
                expiry.put(role, Duration.ofDays(Long.parseLong(days.trim())));
            }
        }
        return new TrustConfig(algorithm, expiry, Clock.systemUTC());
    }

    public TrustConfig withClock(Clock clock) {
        return new TrustConfig(keyAlgorithm, expiry, clock);
    }

    public TrustConfig withKeyAlgorithm(KeyAlgorithm algorithm) {
        return new TrustConfig(algorithm, expiry, clock);
    }

    public Duration expiryOf(RoleName role) {
        return expiry.getOrDefault(role.isDelegation() ? RoleName.TARGETS : role, DEFAULT_EXPIRY.get(RoleName.TARGETS));
    }
}
