package org.deepsymmetry.tagplaylists.combiner;

import org.deepsymmetry.tagplaylists.TagIndex;
import org.deepsymmetry.tagplaylists.Track;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class SelectorPrescannerTest {

    private static Track track(String id, double bpm, int stars, String location) {
        return new Track(id, "", "", bpm, stars * 51, location);
    }

    @Test
    public void findsSelectors() {
        final SelectorPrescanner prescanner = new SelectorPrescanner(Arrays.asList(
                "{My Favorites} & [5]", "[120-129, 140] | {Bangers} | [5]"));
        assertEquals(Arrays.asList("My Favorites", "Bangers"), new ArrayList<>(prescanner.getPlaylistNames()));
        assertEquals(Arrays.asList("[5]", "[120-129, 140]"), new ArrayList<>(prescanner.getNumericSelectors()));
        assertEquals(3, prescanner.getRules().size());
    }

    @Test
    public void fiveIsARatingAndSixIsATempo() {
        final List<SelectorPrescanner.NumericRule> rules =
                new SelectorPrescanner(Arrays.asList("[5] | [6]")).getRules();
        assertEquals(2, rules.size());
        assertTrue(rules.get(0).isRating);
        assertEquals(5, rules.get(0).low);
        assertFalse(rules.get(1).isRating);
        assertEquals(6, rules.get(1).high);
    }

    @Test
    public void rangesMayBeReversed() {
        final SelectorPrescanner.NumericRule rule =
                new SelectorPrescanner(Collections.singletonList("[129-120]")).getRules().get(0);
        assertFalse(rule.isRating);
        assertEquals(120, rule.low);
        assertEquals(129, rule.high);
        assertEquals("[129-120]", rule.selector);
    }

    @Test
    public void badPartsSkipped() {
        final SelectorPrescanner prescanner = new SelectorPrescanner(Arrays.asList(
                "[5-7]", "[abc]", "[1-2-3, 4]", "[]", "[99999999999]"));
        assertEquals(1, prescanner.getRules().size());
        assertEquals("[1-2-3, 4]", prescanner.getRules().get(0).selector);
        assertEquals(5, prescanner.getNumericSelectors().size());
    }

    @Test
    public void recordsMatchingTracks() {
        final SelectorPrescanner prescanner = new SelectorPrescanner(Arrays.asList(
                "[5] | [120-129, 140]", "[6] ~ [5-7]"));
        final TagIndex index = new TagIndex();
        prescanner.addMatchingTracks(Arrays.asList(
                track("A", 127.5, 5, "file://a"),
                track("B", 140.4, 0, "file://b"),
                track("C", 125.0, 5, ""),
                new Track("D", "", "", 6.0, 100, "file://d")), index);
        assertEquals(Collections.singleton("A"), index.getTrackIds("[5]"));
        assertEquals(Arrays.asList("A", "B"), new ArrayList<>(index.getTrackIds("[120-129, 140]")));
        assertEquals(Collections.singleton("D"), index.getTrackIds("[6]"));
        assertTrue(index.contains("[5-7]"));
        assertTrue(index.getTrackIds("[5-7]").isEmpty());
    }

    @Test
    public void tempoRoundsHalfToEvenBeforeMatching() {
        final SelectorPrescanner prescanner = new SelectorPrescanner(Arrays.asList("[120-128]", "[129]"));
        final TagIndex index = new TagIndex();
        prescanner.addMatchingTracks(Collections.singletonList(track("A", 128.5, 0, "file://a")), index);
        assertEquals(Collections.singleton("A"), index.getTrackIds("[120-128]"));
        assertTrue(index.getTrackIds("[129]").isEmpty());
    }
}
