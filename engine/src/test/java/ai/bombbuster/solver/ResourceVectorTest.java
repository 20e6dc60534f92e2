package ai.bombbuster.solver;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Arithmetic of per-rank copy vectors.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>plusWithinStopsAtCap</b> - Sums over the deck are rejected instead of clipped</li>
 *   <li><b>minusRefusesNegativeCounts</b> - Differences never go below zero</li>
 *   <li><b>equalityIsByContent</b> - Vectors work as hash keys</li>
 * </ul>
 */
class ResourceVectorTest {

    @Test
    void plusWithinStopsAtCap() {
        ResourceVector cap = ResourceVector.of(2, 1);
        assertEquals(ResourceVector.of(2, 1), ResourceVector.of(1, 0).plusWithin(ResourceVector.of(1, 1), cap));
        assertNull(ResourceVector.of(1, 1).plusWithin(ResourceVector.of(0, 1), cap));
        assertTrue(ResourceVector.of(1, 1).fitsWithin(cap));
        assertFalse(ResourceVector.of(3, 0).fitsWithin(cap));
    }

    @Test
    void minusRefusesNegativeCounts() {
        assertEquals(ResourceVector.of(1, 0), ResourceVector.of(2, 1).minus(ResourceVector.of(1, 1)));
        assertNull(ResourceVector.of(0, 1).minus(ResourceVector.of(1, 0)));
        assertEquals(3, ResourceVector.of(2, 1).total());
    }

    @Test
    void equalityIsByContent() {
        int[] raw = {1, 2, 3};
        ResourceVector vector = ResourceVector.of(raw);
        raw[0] = 9;
        assertEquals(ResourceVector.of(1, 2, 3), vector);
        assertEquals(ResourceVector.of(1, 2, 3).hashCode(), vector.hashCode());
        assertEquals(ResourceVector.zero(3), ResourceVector.of(0, 0, 0));
        assertEquals("[1, 2, 3]", vector.toString());
    }
}
