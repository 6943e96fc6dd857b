package org.deepsymmetry.tagplaylists.combiner;

import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTree;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class TagStatisticsTest {

    @Test
    public void scalesToMaximumWithVisibleMinimum() {
        final Map<String, Integer> data = new LinkedHashMap<>();
        data.put("Rare", 1);
        data.put("Common", 50);
        data.put("Middle", 25);
        final Map<String, Integer> scaled = TagStatistics.scale(data, 25);
        assertEquals(Integer.valueOf(1), scaled.get("Rare"));
        assertEquals(Integer.valueOf(25), scaled.get("Common"));
        assertEquals(Integer.valueOf(12), scaled.get("Middle"));  // 12.5 rounds to even
    }

    @Test
    public void rendersSingleBar() {
        final StringBuilder expected = new StringBuilder();
        for (int i = 0; i < TagStatistics.MAX_BAR_HEIGHT; i++) {
            expected.append("| * \n");
        }
        expected.append("----\n  A  ");
        assertEquals(expected.toString(), TagStatistics.histogram(Collections.singletonMap("A", 3)));
    }

    @Test
    public void shorterBarsLeaveGaps() {
        final Map<String, Integer> data = new LinkedHashMap<>();
        data.put("AB", 2);
        data.put("C", 1);
        final String[] lines = TagStatistics.histogram(data).split("\n", -1);
        assertEquals(TagStatistics.MAX_BAR_HEIGHT + 2, lines.length);
        assertEquals("|  *     ", lines[0]);
        assertEquals("|  *   * ", lines[TagStatistics.MAX_BAR_HEIGHT - 1]);
        assertEquals("---------", lines[TagStatistics.MAX_BAR_HEIGHT]);
        assertEquals("  AB   C  ", lines[TagStatistics.MAX_BAR_HEIGHT + 1]);
    }

    @Test
    public void zeroCountsOmitted() {
        assertEquals("", TagStatistics.histogram(Collections.singletonMap("A", 0)));
    }

    @Test
    public void reportSplitsGenreAndOtherTags() {
        final PlaylistTree tree = new PlaylistTree("AUTO_PLAYLISTS");
        final int combiner = tree.addFolder(PlaylistTree.ROOT, "Combiner");
        final int full = tree.addPlaylist(combiner, "House | Dark");
        tree.addPlaylist(combiner, "Empty");
        tree.addTrack(full, "T1");
        tree.addTrack(full, "T2");

        final Map<String, Set<String>> all = new HashMap<>();
        all.put("T1", new LinkedHashSet<>(Arrays.asList("House", "Dark")));
        all.put("T2", new LinkedHashSet<>(Collections.singletonList("House")));
        final Map<String, Set<String>> genres = new HashMap<>();
        genres.put("T1", new LinkedHashSet<>(Collections.singletonList("House")));
        genres.put("T2", new LinkedHashSet<>(Collections.singletonList("House")));

        final String report = TagStatistics.report(tree, combiner, all, genres);
        assertTrue(report.contains("House | Dark tag statistics:"));
        assertFalse(report.contains("Empty"));
        final int genreSection = report.indexOf("Genre:");
        final int otherSection = report.indexOf("Other:");
        assertTrue(genreSection > 0 && otherSection > genreSection);
        assertTrue(report.substring(genreSection, otherSection).contains("House"));
        assertFalse(report.substring(genreSection, otherSection).contains("Dark"));
        assertTrue(report.substring(otherSection).contains("Dark"));
    }
}
