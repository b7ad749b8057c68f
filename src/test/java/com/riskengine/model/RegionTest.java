package com.riskengine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Region.
 */
class RegionTest {

    @Test
    @DisplayName("canAttackFrom() should need at least 2 troops")
    void shouldNeedTwoTroopsToAttack() {
        Region region = new Region("Brazil", "South America");

        region.setGarrison(1);
        assertFalse(region.canAttackFrom());

        region.setGarrison(2);
        assertTrue(region.canAttackFrom());
    }

    @Test
    @DisplayName("isOwnedBy() should compare player identity")
    void shouldCompareOwnerIdentity() {
        PlayerAccount alice = new PlayerAccount("Alice", null);
        PlayerAccount otherAlice = new PlayerAccount("Alice", null);
        Region region = new Region("Peru", "South America");
        region.setOwner(alice);

        assertTrue(region.isOwnedBy(alice));
        assertFalse(region.isOwnedBy(otherAlice));
        assertFalse(region.isOwnedBy(null));
    }

    @Test
    @DisplayName("getNeighbors() should be read-only")
    void shouldExposeReadOnlyNeighbors() {
        Region a = new Region("A", "G");
        Region b = new Region("B", "G");
        a.addNeighbor(b);

        assertTrue(a.isNeighborOf(b));
        assertThrows(UnsupportedOperationException.class, () -> a.getNeighbors().add(a));
    }
}
