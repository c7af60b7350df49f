package tuftrust.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class RoleNameTest {

    @Test
    public void delegationsLiveUnderTargets() {
        assertTrue(RoleName.of("targets/releases").isDelegation());
        assertTrue(RoleName.of("targets/releases/qa").isDelegation());
        assertFalse(RoleName.TARGETS.isDelegation());
        assertFalse(RoleName.of("targets/").isDelegation());
        assertFalse(RoleName.of("targets//x").isDelegation());
        assertFalse(RoleName.of("releases").isDelegation());
    }

    @Test
    public void parentAndDepth() {
        RoleName qa = RoleName.of("targets/releases/qa");
        assertEquals(Optional.of(RoleName.of("targets/releases")), qa.parent());
        assertEquals(Optional.of(RoleName.TARGETS), RoleName.of("targets/releases").parent());
        assertEquals(Optional.empty(), RoleName.ROOT.parent());
        assertEquals(2, qa.depth());
        assertEquals(0, RoleName.TARGETS.depth());
    }

    @Test
    public void malformedNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RoleName.of(""));
        assertThrows(IllegalArgumentException.class, () -> RoleName.of("targets/\uDBFF"));
    }

    @Test
    public void onlyTargetsRolesSignTargets() {
        assertTrue(RoleName.TARGETS.signsTargets());
        assertTrue(RoleName.of("targets/a").signsTargets());
        assertFalse(RoleName.SNAPSHOT.signsTargets());
        assertFalse(RoleName.ROOT.signsTargets());
    }
}
