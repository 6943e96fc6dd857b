package org.deepsymmetry.tagplaylists;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class TrackCollectionTest {

    @Test
    public void iteratesInOrder() {
        final Track first = new Track("1", "House", "", 120.0, 0, "file://1");
        final Track second = new Track("2", "Techno", "", 130.0, 0, "file://2");
        final List<Track> source = new ArrayList<>(Arrays.asList(first, second));
        final TrackCollection collection = TrackCollection.of(source);
        source.clear();
        final Iterator<Track> tracks = collection.getTracks().iterator();
        assertEquals(first, tracks.next());
        assertEquals(second, tracks.next());
        assertFalse(tracks.hasNext());
    }
}
