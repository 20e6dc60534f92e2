package ai.bombbuster.game;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Value domain, candidate sets and game configuration.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>parseOrdersValuesAndCountsDeck</b> - Ranks follow numeric order, fractional values included</li>
 *   <li><b>parseRejectsMalformedInput</b> - Bad entries fail with IllegalArgumentException</li>
 *   <li><b>formatDropsIntegralFraction</b> - 3.0 prints as "3", 6.5 stays "6.5"</li>
 *   <li><b>maskWithCopiesSelectsByCopyCount</b> - Copy-count signals map to the right values</li>
 *   <li><b>candidateSetQueries</b> - min/max/pinned/contains on a mask view</li>
 *   <li><b>pinnedValueOfOpenSetFails</b> - Asking a multi-value set for its value is a bug</li>
 *   <li><b>gameConfigSplitsDeckEvenly</b> - handSize 0 deals the whole deck</li>
 *   <li><b>gameConfigRejectsImpossibleDeals</b> - Uneven splits and oversized hands are refused</li>
 *   <li><b>unknownValueIsRejected</b> - Values outside the domain fail loudly</li>
 * </ul>
 */
class ValueDomainTest {

    @Test
    void parseOrdersValuesAndCountsDeck() {
        ValueDomain domain = ValueDomain.parse("3:2, 1:4, 6.5:1, 2:4");
        assertEquals(List.of(1.0, 2.0, 3.0, 6.5), domain.values());
        assertEquals(11, domain.deckSize());
        assertEquals(3, domain.rankOf(6.5));
        assertEquals(2, domain.copiesOf(3));
        assertEquals(-1, domain.rankOf(4));
        assertEquals(0b1111L, domain.fullMask());
        assertArrayEquals(new int[] {4, 4, 2, 1}, domain.deckVector());
        assertEquals(domain, new ValueDomain(Map.of(1.0, 4, 2.0, 4, 3.0, 2, 6.5, 1)));
    }

    @Test
    void parseRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> ValueDomain.parse("1-2"));
        assertThrows(IllegalArgumentException.class, () -> ValueDomain.parse("1:x"));
        assertThrows(IllegalArgumentException.class, () -> ValueDomain.parse("1:2,1:3"));
        assertThrows(IllegalArgumentException.class, () -> ValueDomain.parse("1:0"));
        assertThrows(IllegalArgumentException.class, () -> ValueDomain.parse(""));
    }

    @Test
    void formatDropsIntegralFraction() {
        assertEquals("3", ValueDomain.format(3.0));
        assertEquals("6.5", ValueDomain.format(6.5));
        assertEquals("99", ValueDomain.format(99));
    }

    @Test
    void maskWithCopiesSelectsByCopyCount() {
        ValueDomain domain = ValueDomain.parse("1:2,2:3,3:2");
        assertEquals(List.of(1.0, 3.0), domain.valuesOf(domain.maskWithCopies(2)));
        assertEquals(List.of(2.0), domain.valuesOf(domain.maskWithCopies(3)));
        assertEquals(0L, domain.maskWithCopies(4));
    }

    @Test
    void candidateSetQueries() {
        ValueDomain domain = ValueDomain.parse("1:1,2:1,3:1,4:1");
        CandidateSet set = CandidateSet.of(domain, 2, 4);
        assertEquals(2, set.size());
        assertFalse(set.isPinned());
        assertEquals(2.0, set.min());
        assertEquals(4.0, set.max());
        assertTrue(set.contains(4));
        assertFalse(set.contains(3));
        assertFalse(set.contains(17));
        assertEquals("{2, 4}", set.toString());

        CandidateSet pinned = CandidateSet.of(domain, 3);
        assertTrue(pinned.isPinned());
        assertEquals(3.0, pinned.pinnedValue());
        assertTrue(new CandidateSet(domain, 0L).isEmpty());
    }

    @Test
    void pinnedValueOfOpenSetFails() {
        ValueDomain domain = ValueDomain.parse("1:1,2:1");
        assertThrows(IllegalStateException.class, () -> CandidateSet.of(domain, 1, 2).pinnedValue());
        assertThrows(IllegalStateException.class, () -> new CandidateSet(domain, 0L).min());
        assertThrows(IllegalArgumentException.class, () -> new CandidateSet(domain, 0b100L));
    }

    @Test
    void gameConfigSplitsDeckEvenly() {
        GameConfig config = new GameConfig(ValueDomain.parse("1:4,2:4,3:4"), 3);
        assertEquals(4, config.getHandSize());
        assertEquals(0, config.undealt());
        assertFalse(config.isInformal());
        assertTrue(config.withInformal(true).isInformal());

        GameConfig partial = new GameConfig(ValueDomain.parse("1:4,2:4,3:4"), 2, 5, false);
        assertEquals(2, partial.undealt());
    }

    @Test
    void gameConfigRejectsImpossibleDeals() {
        ValueDomain domain = ValueDomain.parse("1:2,2:3");
        assertThrows(IllegalArgumentException.class, () -> new GameConfig(domain, 2));
        assertThrows(IllegalArgumentException.class, () -> new GameConfig(domain, 2, 3, false));
        assertThrows(IllegalArgumentException.class, () -> new GameConfig(domain, 1, 2, false));
    }

    @Test
    void unknownValueIsRejected() {
        ValueDomain domain = ValueDomain.parse("1:2,2:3");
        assertThrows(IllegalArgumentException.class, () -> domain.requireRank(2.5));
        assertThrows(IllegalArgumentException.class, () -> CandidateSet.of(domain, 7));
    }
}
