package org.deepsymmetry.tagplaylists.taxonomy;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PlaylistTaxonomyTest {

    private static Map<String, Object> folderConfig(String nameKey, String name, String playlistsKey,
                                                    List<?> playlists) {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put(nameKey, name);
        result.put(playlistsKey, playlists);
        return result;
    }

    @Test
    public void convertsNestedConfig() {
        final Object config = folderConfig("name", "Genres", "playlists", Arrays.asList(
                "House",
                folderConfig("Name", "Techno", "PLAYLISTS", Arrays.asList("Dark Techno", "Hard Techno")),
                folderConfig("name", "_ignore", "playlists", Collections.singletonList("Ambient"))));
        final PlaylistTaxonomy expected = PlaylistTaxonomy.folder("Genres",
                PlaylistTaxonomy.playlist("House"),
                PlaylistTaxonomy.folder("Techno", PlaylistTaxonomy.playlist("Dark Techno"),
                        PlaylistTaxonomy.playlist("Hard Techno")),
                PlaylistTaxonomy.folder("_ignore", PlaylistTaxonomy.playlist("Ambient")));
        final PlaylistTaxonomy taxonomy = PlaylistTaxonomy.fromConfig(config);
        assertEquals(expected, taxonomy);
        assertTrue(taxonomy.getChildren().get(2).isIgnoreFolder());
        assertEquals(Collections.singletonList("House"), taxonomy.getPlaylistNames());
    }

    @Test
    public void stringIsPlaylist() {
        final PlaylistTaxonomy taxonomy = PlaylistTaxonomy.fromConfig("Disco");
        assertFalse(taxonomy.isFolder());
        assertEquals("Disco", taxonomy.getName());
        assertTrue(taxonomy.getChildren().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void numberRejected() {
        PlaylistTaxonomy.fromConfig(Arrays.asList("House", 42));
    }

    @Test(expected = IllegalArgumentException.class)
    public void nestedNumberRejected() {
        PlaylistTaxonomy.fromConfig(folderConfig("name", "Genres", "playlists", Arrays.asList("House", 42)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void folderWithoutPlaylistsRejected() {
        PlaylistTaxonomy.fromConfig(Collections.singletonMap("name", "Genres"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void ignoreFolderMayOnlyHoldPlaylists() {
        PlaylistTaxonomy.folder(PlaylistTaxonomy.IGNORE_FOLDER, PlaylistTaxonomy.folder("Nested"));
    }
}
