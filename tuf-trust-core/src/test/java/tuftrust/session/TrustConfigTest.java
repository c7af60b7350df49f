package tuftrust.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;

public class TrustConfigTest {

    @Test
    public void loadsBundledProperties() {
        TrustConfig config = TrustConfig.load();
        assertEquals(KeyAlgorithm.ECDSA, config.keyAlgorithm());
        assertEquals(Duration.ofDays(14), config.expiryOf(RoleName.TIMESTAMP));
        assertEquals(Duration.ofDays(3650), config.expiryOf(RoleName.ROOT));
    }

    @Test
    public void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("tuftrust.key.algorithm", "ed25519");
        props.setProperty("tuftrust.expiry.targets.days", " 30 ");
        TrustConfig config = TrustConfig.fromProperties(props);

        assertEquals(KeyAlgorithm.ED25519, config.keyAlgorithm());
        assertEquals(Duration.ofDays(30), config.expiryOf(RoleName.TARGETS));
        assertEquals(Duration.ofDays(30), config.expiryOf(RoleName.of("targets/releases/qa")));
        assertEquals(Duration.ofDays(1095), config.expiryOf(RoleName.SNAPSHOT));
    }

    @Test
    public void unknownAlgorithmIsRejected() {
        Properties props = new Properties();
        props.setProperty("tuftrust.key.algorithm", "dsa");
        assertThrows(IllegalArgumentException.class, () -> TrustConfig.fromProperties(props));
    }
}
