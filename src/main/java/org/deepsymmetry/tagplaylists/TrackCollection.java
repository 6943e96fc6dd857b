package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The tracks of an already-parsed collection export. Reading and writing the export itself is the job of the
 * caller; this is the boundary through which those tracks reach the playlist builder.
 */
@API(status = API.Status.STABLE)
public interface TrackCollection {

    /**
     * Get every track entry in the collection, in document order, including any entries without a location.
     *
     * @return the track entries
     */
    @API(status = API.Status.STABLE)
    Iterable<Track> getTracks();

    /**
     * Create a collection backed by a fixed list of tracks.
     *
     * @param tracks the tracks to offer, in order
     *
     * @return an immutable collection of those tracks
     */
    @API(status = API.Status.STABLE)
    static TrackCollection of(List<Track> tracks) {
        final List<Track> copy = Collections.unmodifiableList(new ArrayList<>(tracks));
        return new TrackCollection() {
            @Override
            public Iterable<Track> getTracks() {
                return copy;
            }

            @Override
            public String toString() {
                return "TrackCollection[tracks:" + copy.size() + "]";
            }
        };
    }
}
