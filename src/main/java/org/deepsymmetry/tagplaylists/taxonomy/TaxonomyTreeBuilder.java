package org.deepsymmetry.tagplaylists.taxonomy;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.TagIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * <p>Turns a {@link PlaylistTaxonomy} into folders and playlists within a {@link PlaylistTree}, and fills those
 * playlists with the tracks carrying the matching tags.</p>
 *
 * <p>Every folder except the root of a taxonomy gets an extra playlist, placed first, named "All" followed by the
 * folder name. Any track inserted into a playlist is also inserted into the "All" playlist of its folder, and of
 * each enclosing folder in turn, stopping at the first folder that has no such playlist. For example, a track
 * inserted into Bass/DnB/Techstep also lands in "All DnB" and "All Bass".</p>
 *
 * <p>Insertion never duplicates a track: each pair of folder name and playlist name keeps track of the tracks it
 * has received, including any already present in the tree when {@link #addTracks(int, TagIndex)} is called, so
 * running it again with the same tags changes nothing. When several playlists share both their own name and
 * their folder's name, a track goes only into the first of them.</p>
 */
@API(status = API.Status.STABLE)
public class TaxonomyTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TaxonomyTreeBuilder.class);

    /**
     * The text that begins the name of the aggregate playlist in each folder.
     */
    @API(status = API.Status.STABLE)
    public static final String ALL_PREFIX = "All ";

    /**
     * The name of the folder or playlist holding tags the taxonomy does not mention.
     */
    @API(status = API.Status.STABLE)
    public static final String OTHER = "Other";

    /**
     * The tree being populated.
     */
    private final PlaylistTree tree;

    /**
     * Decides which of the identically named "Hip Hop" playlists a track belongs in.
     */
    private final HipHopRule hipHopRule;

    /**
     * Create a builder which adds to an existing tree.
     *
     * @param tree the tree to populate
     * @param hipHopRule the rule used to choose between identically named playlists
     */
    @API(status = API.Status.STABLE)
    public TaxonomyTreeBuilder(PlaylistTree tree, HipHopRule hipHopRule) {
        if (tree == null) {
            throw new NullPointerException("tree must not be null");
        }
        if (hipHopRule == null) {
            throw new NullPointerException("hipHopRule must not be null");
        }
        this.tree = tree;
        this.hipHopRule = hipHopRule;
    }

    /**
     * Get the tree being populated.
     *
     * @return the tree passed to the constructor
     */
    @API(status = API.Status.STABLE)
    public PlaylistTree getTree() {
        return tree;
    }

    /**
     * Create empty folders and playlists for a taxonomy, at the end of an existing folder. The taxonomy root gets
     * no "All" playlist. Every tag named by the taxonomy, including the children of {@value
     * PlaylistTaxonomy#IGNORE_FOLDER} folders, is added to {@code knownTags}.
     *
     * @param parent the folder to hold the new structure
     * @param taxonomy the structure to create
     * @param knownTags collects the tags the taxonomy mentions
     *
     * @return the index of the new top-level node, or {@link PlaylistTree#NO_NODE} if the taxonomy is itself an
     *         {@value PlaylistTaxonomy#IGNORE_FOLDER} folder
     */
    @API(status = API.Status.STABLE)
    public int build(int parent, PlaylistTaxonomy taxonomy, Set<String> knownTags) {
        return build(parent, taxonomy, knownTags, true);
    }

    /**
     * Recursive helper for {@link #build(int, PlaylistTaxonomy, Set)}.
     *
     * @param parent the folder to hold the new node
     * @param content the taxonomy node being created
     * @param knownTags collects the tags the taxonomy mentions
     * @param topLevel whether this is the taxonomy root, which gets no "All" playlist
     *
     * @return the index of the new node, or {@link PlaylistTree#NO_NODE} for ignored folders
     */
    private int build(int parent, PlaylistTaxonomy content, Set<String> knownTags, boolean topLevel) {
        if (!content.isFolder()) {
            knownTags.add(content.getName());
            return tree.addPlaylist(parent, content.getName());
        }
        if (content.isIgnoreFolder()) {
            knownTags.addAll(content.getPlaylistNames());
            return PlaylistTree.NO_NODE;
        }
        final int folder = tree.addFolder(parent, content.getName());
        if (!topLevel) {
            tree.addPlaylist(folder, ALL_PREFIX + content.getName());
        }
        for (PlaylistTaxonomy child : content.getChildren()) {
            build(folder, child, knownTags, false);
        }
        return folder;
    }

    /**
     * Build the key under which the tracks received by a playlist are remembered.
     *
     * @param playlist the index of the playlist
     *
     * @return a key combining the folder name and playlist name
     */
    private List<String> seenKey(int playlist) {
        return Arrays.asList(tree.getName(tree.getParent(playlist)), tree.getName(playlist));
    }

    /**
     * Insert tracks into every playlist below a node, according to the tags whose names match the playlists,
     * aggregating them into the "All" playlists of the enclosing folders.
     *
     * @param subtree the node below which playlists should be filled
     * @param tags the tracks carrying each tag, with their full tag lists
     */
    @API(status = API.Status.STABLE)
    public void addTracks(int subtree, TagIndex tags) {
        final List<Integer> playlists = tree.getPlaylists(subtree);
        final Map<List<String>, Set<String>> seen = new HashMap<>();
        for (int playlist : playlists) {  // Remember what earlier runs inserted.
            seen.computeIfAbsent(seenKey(playlist), k -> new LinkedHashSet<>()).addAll(tree.getTrackIds(playlist));
        }

        for (int playlist : playlists) {
            final String name = tree.getName(playlist);
            final int parent = tree.getParent(playlist);
            final String parentName = tree.getName(parent);
            final Set<String> seenHere = seen.computeIfAbsent(seenKey(playlist), k -> new LinkedHashSet<>());

            for (Map.Entry<String, List<String>> entry : tags.getEntries(name).entrySet()) {
                final String trackId = entry.getKey();
                if (!hipHopRule.accepts(name, parentName, entry.getValue())) {
                    continue;
                }
                if (seenHere.add(trackId)) {
                    tree.addTrack(playlist, trackId);
                }

                // Aggregate into the "All" playlists of the enclosing folders.
                int folder = parent;
                while (folder != PlaylistTree.NO_NODE) {
                    final int all = tree.findChild(folder, ALL_PREFIX + tree.getName(folder));
                    if (all == PlaylistTree.NO_NODE || tree.isFolder(all)) {
                        break;
                    }
                    if (seen.computeIfAbsent(seenKey(all), k -> new LinkedHashSet<>()).add(trackId)) {
                        tree.addTrack(all, trackId);
                    }
                    folder = tree.getParent(folder);
                }
            }
        }
    }

    /**
     * Add an "Other" folder holding a playlist for each tag the taxonomy does not mention, or a single "Other"
     * playlist for the tracks tagged "Other", at the end of the taxonomy root. Must be called before
     * {@link #addTracks(int, TagIndex)} so that the new playlists get filled.
     *
     * @param root the node created for the taxonomy root
     * @param remainderType {@code folder} for an "Other" folder with a playlist per leftover tag, {@code playlist}
     *                      for a single "Other" playlist holding the tracks tagged "Other"; {@code null} or
     *                      empty to do nothing. Any other value is logged as an error and nothing is done
     * @param knownTags the tags the taxonomy mentions
     * @param tags the tracks carrying each tag
     */
    @API(status = API.Status.STABLE)
    public void addOther(int root, String remainderType, Set<String> knownTags, TagIndex tags) {
        if (remainderType == null || remainderType.isEmpty()) {
            return;
        }
        final RemainderType type = RemainderType.forConfigValue(remainderType);
        if (type == null) {
            logger.error("Invalid remainder type \"{}\"", remainderType);
            return;
        }
        addOther(root, type, knownTags, tags);
    }

    /**
     * Add an "Other" folder holding a playlist for each tag the taxonomy does not mention, or a single "Other"
     * playlist for the tracks tagged "Other", at the end of the taxonomy root. Must be called before
     * {@link #addTracks(int, TagIndex)} so that the new playlists get filled.
     *
     * @param root the node created for the taxonomy root
     * @param remainderType how to organize the leftover tags
     * @param knownTags the tags the taxonomy mentions
     * @param tags the tracks carrying each tag
     */
    @API(status = API.Status.STABLE)
    public void addOther(int root, RemainderType remainderType, Set<String> knownTags, TagIndex tags) {
        final Set<String> leftover = new TreeSet<>(tags.getTags());
        leftover.removeAll(knownTags);
        logger.debug("Found {} tags not mentioned by taxonomy {}", leftover.size(), tree.getName(root));

        switch (remainderType) {
            case FOLDER:
                final int folder = tree.addFolder(root, OTHER);
                for (String tag : leftover) {
                    tree.addPlaylist(folder, tag);
                }
                break;

            case PLAYLIST:  // Filled by addTracks, like any playlist named after a tag.
                tree.addPlaylist(root, OTHER);
                break;

            default:
                throw new IllegalArgumentException("Unsupported remainder type: " + remainderType);
        }
    }
}
