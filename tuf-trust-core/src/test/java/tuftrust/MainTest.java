package tuftrust;

import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.session.TrustConfig;

public class MainTest {

    @Test
    public void smokeRunPassesForEveryAlgorithm() {
        for (KeyAlgorithm algorithm : KeyAlgorithm.values()) {
            assertTrue(Main.smokeTest(new Gun("example.com/smoke"), TrustConfig.defaults().withKeyAlgorithm(algorithm)),
                    algorithm.name());
        }
    }
}
