package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each tag to the tracks that carry it. For every track the full list of tags it was given is remembered
 * too, because some playlists decide membership by looking at all the tags of a track, not just the one that
 * names the playlist. Tags, and the tracks under each tag, keep the order in which they were first added.
 *
 * Selectors that are resolved to sets of tracks (playlist references and tempo or rating ranges) are stored
 * here as well, under their literal text, so that they can be looked up exactly like ordinary tags. Tracks
 * registered that way have an empty tag list.
 *
 * Instances are not thread-safe; a new one is built for each run.
 */
@API(status = API.Status.STABLE)
public class TagIndex {

    /**
     * Holds the entries for each tag, in insertion order.
     */
    private final Map<String, Map<String, List<String>>> entries = new LinkedHashMap<>();

    /**
     * Record that a track carries a tag. If the track was already recorded under this tag, its tag list is
     * replaced but its position is kept.
     *
     * @param tag the tag
     * @param trackId the identifier of the track
     * @param trackTags every tag the track carries
     */
    @API(status = API.Status.STABLE)
    public void add(String tag, String trackId, List<String> trackTags) {
        entries.computeIfAbsent(tag, k -> new LinkedHashMap<>()).put(trackId,
                Collections.unmodifiableList(trackTags));
    }

    /**
     * Record that a track belongs to a selector (or tag) without any tag list of its own.
     *
     * @param tag the tag or selector text
     * @param trackId the identifier of the track
     */
    @API(status = API.Status.STABLE)
    public void add(String tag, String trackId) {
        add(tag, trackId, Collections.<String>emptyList());
    }

    /**
     * Replace whatever is recorded under a tag with a fixed set of tracks, none of which have a tag list.
     *
     * @param tag the tag or selector text
     * @param trackIds the tracks that should be found under it
     */
    @API(status = API.Status.STABLE)
    public void replace(String tag, Iterable<String> trackIds) {
        final Map<String, List<String>> replacement = new LinkedHashMap<>();
        for (String trackId : trackIds) {
            replacement.put(trackId, Collections.<String>emptyList());
        }
        entries.put(tag, replacement);
    }

    /**
     * Make sure a tag is present even if no tracks are ever recorded under it.
     *
     * @param tag the tag or selector text
     */
    @API(status = API.Status.STABLE)
    public void ensure(String tag) {
        entries.computeIfAbsent(tag, k -> new LinkedHashMap<>());
    }

    /**
     * Add everything recorded in another index to this one. When both have entries for the same tag, the
     * tracks are unioned.
     *
     * @param other the index whose entries should be added
     */
    @API(status = API.Status.STABLE)
    public void merge(TagIndex other) {
        for (Map.Entry<String, Map<String, List<String>>> entry : other.entries.entrySet()) {
            entries.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>()).putAll(entry.getValue());
        }
    }

    /**
     * Get the identifiers of the tracks recorded under a tag.
     *
     * @param tag the tag or selector text
     *
     * @return a new, mutable set of the track identifiers, empty if the tag is unknown
     */
    @API(status = API.Status.STABLE)
    public Set<String> getTrackIds(String tag) {
        final Map<String, List<String>> tracks = entries.get(tag);
        if (tracks == null) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(tracks.keySet());
    }

    /**
     * Get the tracks recorded under a tag, each with the full list of tags that track carries.
     *
     * @param tag the tag or selector text
     *
     * @return an unmodifiable map from track identifier to tag list, empty if the tag is unknown
     */
    @API(status = API.Status.STABLE)
    public Map<String, List<String>> getEntries(String tag) {
        final Map<String, List<String>> tracks = entries.get(tag);
        if (tracks == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(tracks);
    }

    /**
     * Check whether anything has been recorded under a tag.
     *
     * @param tag the tag or selector text
     *
     * @return {@code true} if the tag is present
     */
    @API(status = API.Status.STABLE)
    public boolean contains(String tag) {
        return entries.containsKey(tag);
    }

    /**
     * Get every tag in the index.
     *
     * @return an unmodifiable view of the tags, in insertion order
     */
    @API(status = API.Status.STABLE)
    public Set<String> getTags() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * Get the number of tags in the index.
     *
     * @return how many distinct tags or selectors have been recorded
     */
    @API(status = API.Status.STABLE)
    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "TagIndex[tags:" + entries.keySet() + "]";
    }
}
