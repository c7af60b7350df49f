package tuftrust.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class TargetTest {

    private static final byte[] CONTENT = "layer contents".getBytes(StandardCharsets.UTF_8);

    @Test
    public void fromContentRecordsLengthAndDigests() {
        Target t = Target.fromContent("img:v1", CONTENT, "sha256", "sha512");
        assertEquals(CONTENT.length, t.length());
        assertEquals(Util.hex(Util.sha256(CONTENT)), t.hashes().get("sha256"));
        assertEquals(128, t.hashes().get("sha512").length());
        assertTrue(t.verify(CONTENT));
    }

    @Test
    public void verifyRejectsWrongLengthOrDigest() {
        Target t = Target.fromContent("img:v1", CONTENT, "sha256");
        assertFalse(t.verify("layer contentz".getBytes(StandardCharsets.UTF_8)));
        assertFalse(t.verify("short".getBytes(StandardCharsets.UTF_8)));

        Target lying = new Target("img:v1", CONTENT.length, Map.of("sha256", "deadbeef"));
        assertFalse(lying.verify(CONTENT));
    }

    @Test
    public void verifyNeedsAtLeastOneKnownDigest() {
        Target unknownOnly = new Target("img:v1", CONTENT.length, Map.of("blake3", "00"));
        assertFalse(unknownOnly.verify(CONTENT));
    }

    @Test
    public void nonHexDigestNeverMatches() {
        Target t = new Target("x", 3, Map.of("sha256", "not-hex"));
        assertFalse(t.verify(new byte[3]));
    }

    @Test
    public void invalidTargetsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Target("", 1, Map.of("sha256", "00")));
        assertThrows(IllegalArgumentException.class, () -> new Target("a", -1, Map.of("sha256", "00")));
        assertThrows(IllegalArgumentException.class, () -> new Target("a", 1, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new Target("a\uD800", 1, Map.of("sha256", "00")));
        assertThrows(IllegalArgumentException.class, () -> new Target("a\uDC00", 1, Map.of("sha256", "00")));
    }
}
