package org.deepsymmetry.tagplaylists.combiner;

import org.junit.Test;

import static org.junit.Assert.*;

public class SelectorTest {

    @Test
    public void classifiesTokens() {
        assertTrue(Selector.parse("Techno") instanceof Selector.Tag);
        assertTrue(Selector.parse("*Techno") instanceof Selector.Wildcard);
        assertTrue(Selector.parse("{All Bass}") instanceof Selector.PlaylistReference);
        assertTrue(Selector.parse("[120-129, 5]") instanceof Selector.NumericRange);
    }

    @Test
    public void wildcardWinsOverBraces() {
        assertTrue(Selector.parse("{*Bass}") instanceof Selector.Wildcard);
    }

    @Test
    public void exposesPayloads() {
        assertEquals("All Bass", ((Selector.PlaylistReference) Selector.parse("{All Bass}")).getPlaylistName());
        assertEquals("4-5", ((Selector.NumericRange) Selector.parse("[4-5]")).getPayload());
    }

    @Test
    public void equalityUsesKindAndText() {
        assertEquals(Selector.parse("House"), Selector.parse("House"));
        assertNotEquals(Selector.parse("House"), Selector.parse("Techno"));
    }

    @Test
    public void operatorsFoundBySymbol() {
        assertEquals(SetOperator.INTERSECTION, SetOperator.forSymbol('&'));
        assertEquals(SetOperator.UNION, SetOperator.forSymbol('|'));
        assertEquals(SetOperator.DIFFERENCE, SetOperator.forSymbol('~'));
        assertNull(SetOperator.forSymbol('('));
    }
}
