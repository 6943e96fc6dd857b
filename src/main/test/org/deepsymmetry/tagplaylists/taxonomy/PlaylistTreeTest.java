package org.deepsymmetry.tagplaylists.taxonomy;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class PlaylistTreeTest {

    private PlaylistTree tree;
    private int genres;
    private int techno;
    private int dark;
    private int house;

    @Before
    public void setUp() {
        tree = new PlaylistTree("AUTO_PLAYLISTS");
        genres = tree.addFolder(PlaylistTree.ROOT, "Genres");
        techno = tree.addFolder(genres, "Techno");
        dark = tree.addPlaylist(techno, "Dark");
        house = tree.addPlaylist(genres, "House");
    }

    @Test
    public void structure() {
        assertEquals("AUTO_PLAYLISTS", tree.getName(PlaylistTree.ROOT));
        assertEquals(PlaylistTree.NO_NODE, tree.getParent(PlaylistTree.ROOT));
        assertEquals(Arrays.asList(techno, house), tree.getChildren(genres));
        assertTrue(tree.isFolder(techno));
        assertFalse(tree.isFolder(dark));
        assertEquals(5, tree.size());
    }

    @Test
    public void moveToFrontReordersSiblings() {
        tree.moveToFront(house);
        assertEquals(Arrays.asList(house, techno), tree.getChildren(genres));
    }

    @Test
    public void tracksKeepInsertionOrder() {
        tree.addTrack(house, "2");
        tree.addTrack(house, "1");
        assertEquals(Arrays.asList("2", "1"), tree.getTrackIds(house));
        assertTrue(tree.getTrackIds(genres).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void foldersHoldNoTracks() {
        tree.addTrack(techno, "1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void playlistsHoldNoChildren() {
        tree.addPlaylist(dark, "Darker");
    }

    @Test
    public void findsByNameDepthFirst() {
        final int otherDark = tree.addPlaylist(genres, "Dark");
        assertEquals(dark, tree.findByName("Dark"));
        assertEquals(otherDark, tree.findChild(genres, "Dark"));
        assertEquals(genres, tree.findByName("Genres"));
        assertEquals(PlaylistTree.NO_NODE, tree.findByName(genres, "Genres"));
        assertEquals(PlaylistTree.NO_NODE, tree.findByName("Missing"));
    }

    @Test
    public void playlistsInDisplayOrder() {
        assertEquals(Arrays.asList(dark, house), tree.getPlaylists(PlaylistTree.ROOT));
        assertEquals(Arrays.asList(house), tree.getPlaylists(house));
    }

    @Test
    public void describesStructure() {
        tree.addTrack(dark, "1");
        assertEquals("AUTO_PLAYLISTS/\n  Genres/\n    Techno/\n      Dark (1)\n    House (0)\n",
                tree.describe(PlaylistTree.ROOT));
    }
}
