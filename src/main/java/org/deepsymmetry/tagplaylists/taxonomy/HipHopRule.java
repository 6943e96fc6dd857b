package org.deepsymmetry.tagplaylists.taxonomy;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.Util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <p>Distinguishes between two playlists that share a name but mean different things. The standard taxonomy has a
 * "Hip Hop" playlist directly inside the "Genres" folder, meant for traditional hip hop and rap, and another
 * "Hip Hop" playlist deeper in the tree (under "Bass") for tracks where hip hop is only one element among others,
 * like trap or space bass.</p>
 *
 * <p>A track is accepted by the <em>pure</em> playlist (the one whose folder is {@link #pureParentName}) only if
 * every one of its tags contains at least one of the {@link #markers}. It is accepted by any other playlist with
 * that name only if at least one of its tags contains none of the markers. Marker matching ignores case.
 * Playlists with other names are not affected.</p>
 *
 * <p>A simple immutable value class.</p>
 */
@API(status = API.Status.STABLE)
public class HipHopRule {

    /**
     * The rule as it has always been applied: "Hip Hop" playlists, with the pure one directly in "Genres", and
     * "R&amp;B" or "Hip Hop" as the markers of a pure track.
     */
    @API(status = API.Status.STABLE)
    public static final HipHopRule DEFAULT = new HipHopRule("Hip Hop", "Genres", Arrays.asList("r&b", "hip hop"));

    /**
     * The name of the playlists to which the rule applies.
     */
    @API(status = API.Status.STABLE)
    public final String playlistName;

    /**
     * The name of the folder directly holding the pure variant of the playlist.
     */
    @API(status = API.Status.STABLE)
    public final String pureParentName;

    /**
     * The text fragments that mark a tag as belonging to the pure style.
     */
    @API(status = API.Status.STABLE)
    public final List<String> markers;

    /**
     * Constructor simply sets the immutable value fields.
     *
     * @param playlistName the name of the playlists to which the rule applies
     * @param pureParentName the name of the folder directly holding the pure variant
     * @param markers the text fragments that mark a tag as belonging to the pure style
     */
    @API(status = API.Status.STABLE)
    public HipHopRule(String playlistName, String pureParentName, List<String> markers) {
        if (playlistName == null || pureParentName == null || markers == null) {
            throw new NullPointerException("playlistName, pureParentName, and markers must not be null");
        }
        this.playlistName = playlistName;
        this.pureParentName = pureParentName;
        this.markers = Collections.unmodifiableList(new ArrayList<>(markers));
    }

    /**
     * Decide whether a track may be inserted into a playlist.
     *
     * @param name the name of the playlist
     * @param parentName the name of the folder directly containing the playlist
     * @param trackTags every tag carried by the track
     *
     * @return {@code true} unless the rule applies to this playlist and rejects the track
     */
    @API(status = API.Status.STABLE)
    public boolean accepts(String name, String parentName, List<String> trackTags) {
        if (!playlistName.equals(name)) {
            return true;
        }
        boolean allMarked = true;
        for (String tag : trackTags) {
            if (!isMarked(tag)) {
                allMarked = false;
                break;
            }
        }
        if (pureParentName.equals(parentName)) {
            return allMarked;
        }
        return !allMarked;
    }

    /**
     * Check whether a tag contains any of the markers.
     *
     * @param tag the tag to examine
     *
     * @return {@code true} if at least one marker appears in the tag, ignoring case
     */
    private boolean isMarked(String tag) {
        for (String marker : markers) {
            if (Util.containsIgnoreCase(tag, marker)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "HipHopRule[playlistName:" + playlistName + ", pureParentName:" + pureParentName +
                ", markers:" + markers + "]";
    }

    @Override
    public int hashCode() {
        int result = playlistName.hashCode();
        result = 31 * result + pureParentName.hashCode();
        result = 31 * result + markers.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final HipHopRule other = (HipHopRule) obj;
        return playlistName.equals(other.playlistName) && pureParentName.equals(other.pureParentName) &&
                markers.equals(other.markers);
    }
}
