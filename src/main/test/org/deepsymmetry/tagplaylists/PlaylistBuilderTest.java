package org.deepsymmetry.tagplaylists;

import org.deepsymmetry.tagplaylists.combiner.Combiner;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTree;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy.folder;
import static org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy.playlist;
import static org.junit.Assert.*;

public class PlaylistBuilderTest {

    private TrackCollection collection;
    private Map<String, PlaylistTaxonomy> config;
    private PlaylistBuilderSettings settings;

    @Before
    public void setUp() {
        collection = TrackCollection.of(Arrays.asList(
                new Track("T1", "Dark Techno", "Banger /* Peak Time / Dark */", "128.00", "255", "file://1"),
                new Track("T2", "House/Deep House", "", "122.00", "153", "file://2"),
                new Track("T3", "Deep House", "/* Chill */", "118.50", "0", "file://3"),
                new Track("T4", "Techno", "/* Peak Time */", "125.00", "255", "")));
        config = new LinkedHashMap<>();
        config.put("GenreTagParser", folder("Genres",
                folder("House", playlist("House"), playlist("Deep House"), playlist("Pure House")),
                playlist("Dark Techno")));
        config.put("MyTagParser", folder("My Tags", playlist("Peak Time"), playlist("Chill")));
        config.put(Combiner.CONFIG_NAME, folder(Combiner.CONFIG_NAME,
                playlist("*House ~ {Peak Time}"), playlist("[5] | [118-122]")));
        settings = PlaylistBuilderSettings.DEFAULT.withPureGenres(Collections.singletonList("House"))
                .withRemainderType("folder");
    }

    private static List<String> names(PlaylistTree tree, int folder) {
        final List<String> result = new ArrayList<>();
        for (int child : tree.getChildren(folder)) {
            result.add(tree.getName(child));
        }
        return result;
    }

    private static List<String> tracks(PlaylistTree tree, String... path) {
        int node = PlaylistTree.ROOT;
        for (String name : path) {
            node = tree.findChild(node, name);
            assertNotEquals("Missing " + name, PlaylistTree.NO_NODE, node);
        }
        return tree.getTrackIds(node);
    }

    @Test
    public void parsersFollowConfigurationOrder() {
        final List<TagParser> parsers = new PlaylistBuilder(collection, config, settings).getParsers();
        assertEquals(2, parsers.size());
        assertEquals(TagParser.Type.GENRE, parsers.get(0).type);
        assertEquals("Genres", parsers.get(0).taxonomy.getName());
        assertEquals(Collections.singletonList("House"), parsers.get(0).getPureGenres());
        assertEquals(TagParser.Type.MY_TAG, parsers.get(1).type);
        assertEquals("My Tags", parsers.get(1).taxonomy.getName());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void parsersCannotBeChanged() {
        new PlaylistBuilder(collection, config, settings).getParsers().clear();
    }

    @Test
    public void buildsEverySubtree() {
        final PlaylistTree tree = new PlaylistBuilder(collection, config, settings).run();

        assertEquals("AUTO_PLAYLISTS", tree.getName(PlaylistTree.ROOT));
        assertEquals(Arrays.asList("Combiner", "My Tags", "Genres"), names(tree, PlaylistTree.ROOT));
        assertEquals(Arrays.asList("House", "Dark Techno", "Other"),
                names(tree, tree.findChild(PlaylistTree.ROOT, "Genres")));

        assertEquals(Collections.singletonList("T2"), tracks(tree, "Genres", "House", "House"));
        assertEquals(Arrays.asList("T2", "T3"), tracks(tree, "Genres", "House", "Deep House"));
        assertEquals(Arrays.asList("T2", "T3"), tracks(tree, "Genres", "House", "Pure House"));
        assertEquals(Arrays.asList("T2", "T3"), tracks(tree, "Genres", "House", "All House"));
        assertEquals(Collections.singletonList("T1"), tracks(tree, "Genres", "Dark Techno"));

        assertEquals(Collections.singletonList("T1"), tracks(tree, "My Tags", "Peak Time"));
        assertEquals(Collections.singletonList("T3"), tracks(tree, "My Tags", "Chill"));
        assertEquals(Collections.singletonList("T1"), tracks(tree, "My Tags", "Other", "Dark"));

        assertEquals(Arrays.asList("T2", "T3"), tracks(tree, "Combiner", "*House ~ {Peak Time}"));
        assertEquals(Arrays.asList("T1", "T2", "T3"), tracks(tree, "Combiner", "[5] | [118-122]"));
    }

    @Test
    public void recordsTagsForStatistics() {
        final PlaylistBuilder builder = new PlaylistBuilder(collection, config, settings);
        builder.run();
        assertEquals(new HashSet<>(Arrays.asList("Dark Techno", "Peak Time", "Dark")),
                builder.getTrackTags().get("T1"));
        assertEquals(new HashSet<>(Arrays.asList("House", "Deep House", "Pure House")),
                builder.getGenreTags().get("T2"));
        assertFalse(builder.getTrackTags().containsKey("T4"));
    }

    @Test
    public void parsersWithoutCombinerInReverseOrder() {
        config.remove(Combiner.CONFIG_NAME);
        final PlaylistTree tree = new PlaylistBuilder(collection, config).run();
        assertEquals(Arrays.asList("My Tags", "Genres"), names(tree, PlaylistTree.ROOT));
        assertEquals(PlaylistTree.NO_NODE, tree.findByName("Other"));
        assertTrue(tracks(tree, "Genres", "House", "Pure House").isEmpty());
    }

    @Test
    public void runsAreIndependent() {
        final PlaylistBuilder builder = new PlaylistBuilder(collection, config, settings);
        final PlaylistTree first = builder.run();
        final PlaylistTree second = builder.run();
        assertNotSame(first, second);
        assertEquals(first.describe(PlaylistTree.ROOT), second.describe(PlaylistTree.ROOT));
    }

    @Test
    public void malformedExpressionLeavesPlaylistEmpty() {
        config.put(Combiner.CONFIG_NAME, folder(Combiner.CONFIG_NAME, playlist("House &"), playlist("Chill")));
        final PlaylistTree tree = new PlaylistBuilder(collection, config, settings).run();
        assertTrue(tracks(tree, "Combiner", "House &").isEmpty());
        assertEquals(Collections.singletonList("T3"), tracks(tree, "Combiner", "Chill"));
    }

    @Test(expected = NoSuchElementException.class)
    public void missingPlaylistSelectorAborts() {
        config.put(Combiner.CONFIG_NAME, folder(Combiner.CONFIG_NAME, playlist("House & {Warm Up}")));
        new PlaylistBuilder(collection, config, settings).run();
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownParserRejected() {
        config.put("MoodTagParser", folder("Moods", playlist("Happy")));
        new PlaylistBuilder(collection, config, settings);
    }

    @Test
    public void parsesConfigAndNamesCombiner() {
        final Map<String, Object> genres = new LinkedHashMap<>();
        genres.put("name", "Genres");
        genres.put("playlists", Arrays.asList("House", "Techno"));
        final Map<String, Object> combiner = new LinkedHashMap<>();
        combiner.put("playlists", Collections.singletonList("House | Techno"));
        final Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("GenreTagParser", genres);
        raw.put("Combiner", combiner);

        final Map<String, PlaylistTaxonomy> parsed = PlaylistBuilder.parseConfig(raw);
        assertEquals(Arrays.asList("GenreTagParser", "Combiner"), new ArrayList<>(parsed.keySet()));
        assertEquals(folder("Genres", playlist("House"), playlist("Techno")), parsed.get("GenreTagParser"));
        assertEquals(folder("Combiner", playlist("House | Techno")), parsed.get("Combiner"));
    }
}
