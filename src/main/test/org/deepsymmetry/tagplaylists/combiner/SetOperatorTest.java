package org.deepsymmetry.tagplaylists.combiner;

import org.deepsymmetry.tagplaylists.TagIndex;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class SetOperatorTest {

    private Set<String> techno;
    private Set<String> house;
    private ExpressionEvaluator evaluator;

    @Before
    public void setUp() {
        techno = new LinkedHashSet<>(Arrays.asList("T1", "T2"));
        house = new LinkedHashSet<>(Arrays.asList("T2", "T3"));
        final TagIndex tags = new TagIndex();
        tags.add("Techno", "T1");
        tags.add("Techno", "T2");
        tags.add("House", "T2");
        tags.add("House", "T3");
        evaluator = new ExpressionEvaluator(tags);
    }

    private static Set<String> ids(String... ids) {
        return new HashSet<>(Arrays.asList(ids));
    }

    @Test
    public void symbolsMapToOperators() {
        assertEquals(SetOperator.INTERSECTION, SetOperator.forSymbol('&'));
        assertEquals(SetOperator.UNION, SetOperator.forSymbol('|'));
        assertEquals(SetOperator.DIFFERENCE, SetOperator.forSymbol('~'));
        assertNull(SetOperator.forSymbol('^'));
    }

    @Test
    public void selfIntersectionIsIdentity() {
        assertEquals(techno, SetOperator.INTERSECTION.apply(techno, techno));
        assertEquals(ids("T1", "T2"), evaluator.evaluate("Techno & Techno"));
    }

    @Test
    public void selfUnionIsIdentity() {
        assertEquals(techno, SetOperator.UNION.apply(techno, techno));
        assertEquals(ids("T1", "T2"), evaluator.evaluate("Techno | Techno"));
    }

    @Test
    public void selfDifferenceIsEmpty() {
        assertTrue(SetOperator.DIFFERENCE.apply(techno, techno).isEmpty());
        assertTrue(evaluator.evaluate("Techno ~ Techno").isEmpty());
    }

    @Test
    public void intersectionIsWithinBothOperands() {
        final Set<String> applied = SetOperator.INTERSECTION.apply(techno, house);
        assertTrue(techno.containsAll(applied));
        assertTrue(house.containsAll(applied));

        final Set<String> evaluated = evaluator.evaluate("Techno & House");
        assertEquals(ids("T2"), evaluated);
        assertTrue(evaluator.evaluate("Techno").containsAll(evaluated));
        assertTrue(evaluator.evaluate("House").containsAll(evaluated));
    }

    @Test
    public void unionContainsBothOperands() {
        final Set<String> applied = SetOperator.UNION.apply(techno, house);
        assertTrue(applied.containsAll(techno));
        assertTrue(applied.containsAll(house));

        final Set<String> evaluated = evaluator.evaluate("Techno | House");
        assertEquals(ids("T1", "T2", "T3"), evaluated);
        assertTrue(evaluated.containsAll(evaluator.evaluate("Techno")));
        assertTrue(evaluated.containsAll(evaluator.evaluate("House")));
    }

    @Test
    public void differenceExcludesRightOperand() {
        final Set<String> applied = SetOperator.DIFFERENCE.apply(techno, house);
        assertEquals(Collections.singleton("T1"), applied);
        assertTrue(Collections.disjoint(applied, house));
        assertEquals(ids("T3"), evaluator.evaluate("House ~ Techno"));
    }

    @Test
    public void operandsAreLeftUnchanged() {
        for (SetOperator operator : SetOperator.values()) {
            final Set<String> result = operator.apply(techno, house);
            assertNotSame(techno, result);
            assertNotSame(house, result);
            assertEquals(ids("T1", "T2"), techno);
            assertEquals(ids("T2", "T3"), house);
        }
    }

    @Test
    public void evaluatingLeavesIndexUnchanged() {
        evaluator.evaluate("Techno ~ Techno");
        evaluator.evaluate("Techno & House");
        evaluator.evaluate("Techno | House");
        assertEquals(ids("T1", "T2"), evaluator.evaluate("Techno"));
        assertEquals(ids("T2", "T3"), evaluator.evaluate("House"));
    }
}
