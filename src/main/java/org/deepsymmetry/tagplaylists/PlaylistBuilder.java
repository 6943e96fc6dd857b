package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.combiner.Combiner;
import org.deepsymmetry.tagplaylists.combiner.TagStatistics;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTree;
import org.deepsymmetry.tagplaylists.taxonomy.TaxonomyTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * <p>Builds a complete set of tag playlists for a track collection. Each configured tag parser contributes a
 * subtree organized by its taxonomy and filled from the tags it finds, and the Combiner, if configured, contributes
 * a subtree of playlists defined by boolean expressions over those tags and playlists.</p>
 *
 * <p>Everything goes into a single folder, named {@value PlaylistBuilderSettings#DEFAULT_ROOT_NAME} unless the
 * settings say otherwise. Each subtree is moved to the front of that folder as it is completed, so the Combiner
 * subtree ends up first, followed by the tag parser subtrees in the reverse of their configured order.</p>
 *
 * <p>A builder can be run more than once; every run starts from an empty tree.</p>
 */
@API(status = API.Status.STABLE)
public class PlaylistBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PlaylistBuilder.class);

    /**
     * The tracks to organize.
     */
    private final TrackCollection collection;

    /**
     * The options for the run.
     */
    private final PlaylistBuilderSettings settings;

    /**
     * The tag parsers, in configuration order.
     */
    private final List<TagParser> parsers = new ArrayList<>();

    /**
     * The Combiner configuration, or {@code null} if there is none.
     */
    private final PlaylistTaxonomy combinerTaxonomy;

    /**
     * Every tag found for each track by the most recent run, keyed by track identifier.
     */
    private final Map<String, Set<String>> trackTags = new LinkedHashMap<>();

    /**
     * The genre tags found for each track by the most recent run, keyed by track identifier.
     */
    private final Map<String, Set<String>> genreTags = new LinkedHashMap<>();

    /**
     * Set up a builder.
     *
     * @param collection the tracks to organize
     * @param config maps {@code GenreTagParser}, {@code MyTagParser} and {@code Combiner} to their taxonomies;
     *               iteration order determines processing order
     * @param settings the options for the run
     *
     * @throws IllegalArgumentException if the configuration names something that is neither a tag parser nor the
     *                                  Combiner
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilder(TrackCollection collection, Map<String, PlaylistTaxonomy> config,
                           PlaylistBuilderSettings settings) {
        if (collection == null) {
            throw new NullPointerException("collection must not be null");
        }
        if (config == null) {
            throw new NullPointerException("config must not be null");
        }
        if (settings == null) {
            throw new NullPointerException("settings must not be null");
        }
        this.collection = collection;
        this.settings = settings;
        PlaylistTaxonomy combiner = null;
        for (Map.Entry<String, PlaylistTaxonomy> entry : config.entrySet()) {
            if (Combiner.CONFIG_NAME.equals(entry.getKey())) {
                combiner = entry.getValue();
            } else {
                parsers.add(TagParser.create(TagParser.Type.forConfigName(entry.getKey()), entry.getValue(),
                        settings));
            }
        }
        combinerTaxonomy = combiner;
    }

    /**
     * Set up a builder with the default settings.
     *
     * @param collection the tracks to organize
     * @param config maps {@code GenreTagParser}, {@code MyTagParser} and {@code Combiner} to their taxonomies
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilder(TrackCollection collection, Map<String, PlaylistTaxonomy> config) {
        this(collection, config, PlaylistBuilderSettings.DEFAULT);
    }

    /**
     * Convert a parsed playlist configuration, as read from a YAML or JSON document, into taxonomies. The value for
     * each tag parser must be a folder map; the Combiner value may leave out its name, in which case it is called
     * {@value Combiner#CONFIG_NAME}.
     *
     * @param config maps parser names and {@code Combiner} to their parsed configuration values
     *
     * @return the same keys, in the same order, mapped to taxonomies
     *
     * @throws IllegalArgumentException if any value is not a valid taxonomy
     */
    @API(status = API.Status.STABLE)
    public static Map<String, PlaylistTaxonomy> parseConfig(Map<String, ?> config) {
        final Map<String, PlaylistTaxonomy> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : config.entrySet()) {
            Object value = entry.getValue();
            if (Combiner.CONFIG_NAME.equals(entry.getKey()) && value instanceof Map &&
                    !hasNameKey((Map<?, ?>) value)) {
                final Map<Object, Object> named = new LinkedHashMap<>();
                named.put("name", Combiner.CONFIG_NAME);
                named.putAll((Map<?, ?>) value);
                value = named;
            }
            result.put(entry.getKey(), PlaylistTaxonomy.fromConfig(value));
        }
        return result;
    }

    private static boolean hasNameKey(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if ("name".equalsIgnoreCase(String.valueOf(key))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get the tag parsers that will be run.
     *
     * @return an unmodifiable list of the parsers, in configuration order
     */
    @API(status = API.Status.STABLE)
    public List<TagParser> getParsers() {
        return Collections.unmodifiableList(parsers);
    }

    /**
     * Get every tag found for each track by the most recent run, across all parsers.
     *
     * @return an unmodifiable view of the tags, keyed by track identifier
     */
    @API(status = API.Status.STABLE)
    public Map<String, Set<String>> getTrackTags() {
        return Collections.unmodifiableMap(trackTags);
    }

    /**
     * Get the genre tags found for each track by the most recent run.
     *
     * @return an unmodifiable view of the genre tags, keyed by track identifier
     */
    @API(status = API.Status.STABLE)
    public Map<String, Set<String>> getGenreTags() {
        return Collections.unmodifiableMap(genreTags);
    }

    /**
     * Build the playlists.
     *
     * @return a new tree whose root folder holds the Combiner subtree, if any, followed by a subtree for each tag
     *         parser
     *
     * @throws NoSuchElementException if a Combiner expression names a playlist that does not exist
     */
    @API(status = API.Status.STABLE)
    public PlaylistTree run() {
        final PlaylistTree tree = new PlaylistTree(settings.rootName);
        final TaxonomyTreeBuilder builder = new TaxonomyTreeBuilder(tree, settings.hipHopRule);
        final Map<TagParser, TagIndex> indexes = indexTags();

        for (Map.Entry<TagParser, TagIndex> entry : indexes.entrySet()) {
            final TagParser parser = entry.getKey();
            final TagIndex index = entry.getValue();
            final Set<String> knownTags = new HashSet<>();
            final int subtree = builder.build(PlaylistTree.ROOT, parser.taxonomy, knownTags);
            if (subtree == PlaylistTree.NO_NODE) {
                logger.warn("Taxonomy for {} is an ignored folder, no playlists built", parser.type.configName);
                continue;
            }
            builder.addOther(subtree, settings.remainderType, knownTags, index);
            builder.addTracks(subtree, index);
            tree.moveToFront(subtree);
            logger.info("Built {} playlists from {} tags", parser.type.configName, index.size());
        }

        if (combinerTaxonomy != null) {
            runCombiner(tree, builder, indexes);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Built playlists:\n{}", tree.describe(PlaylistTree.ROOT));
        }
        return tree;
    }

    /**
     * Run every tag parser over every track that has a file location.
     *
     * @return each parser mapped to the index of the tags it found
     */
    private Map<TagParser, TagIndex> indexTags() {
        trackTags.clear();
        genreTags.clear();
        final Map<TagParser, TagIndex> indexes = new LinkedHashMap<>();
        for (TagParser parser : parsers) {
            indexes.put(parser, new TagIndex());
        }
        int count = 0;
        for (Track track : collection.getTracks()) {
            if (!track.hasLocation()) {
                logger.debug("Skipping track {}, which has no location", track.id);
                continue;
            }
            count++;
            for (Map.Entry<TagParser, TagIndex> entry : indexes.entrySet()) {
                final List<String> tags = entry.getKey().tagsFor(track);
                for (String tag : tags) {
                    entry.getValue().add(tag, track.id, tags);
                }
                trackTags.computeIfAbsent(track.id, k -> new LinkedHashSet<>()).addAll(tags);
                if (entry.getKey().type == TagParser.Type.GENRE) {
                    genreTags.computeIfAbsent(track.id, k -> new LinkedHashSet<>()).addAll(tags);
                }
            }
        }
        logger.info("Parsed tags for {} tracks", count);
        return indexes;
    }

    /**
     * Evaluate the Combiner expressions and add their playlists at the front of the tree.
     *
     * @param tree the tree holding the tag parser subtrees
     * @param builder populates the tree
     * @param indexes the tags found by each parser
     */
    private void runCombiner(PlaylistTree tree, TaxonomyTreeBuilder builder, Map<TagParser, TagIndex> indexes) {
        final Combiner combiner = new Combiner(combinerTaxonomy, collection);
        final TagIndex merged = new TagIndex();
        for (TagIndex index : indexes.values()) {
            merged.merge(index);
        }

        // Playlist selectors see only the tag parser playlists, so resolve them before adding the Combiner's own.
        combiner.addPlaylistSelectors(tree, PlaylistTree.ROOT);
        final Map<String, Set<String>> results = combiner.evaluate(merged);

        final TagIndex selected = new TagIndex();
        for (Map.Entry<String, Set<String>> entry : results.entrySet()) {
            selected.replace(entry.getKey(), entry.getValue());
            if (entry.getValue().isEmpty()) {
                logger.warn("There are no tracks for the Combiner playlist: {}", entry.getKey());
            }
        }
        final int subtree = builder.build(PlaylistTree.ROOT, combinerTaxonomy, new HashSet<String>());
        if (subtree == PlaylistTree.NO_NODE) {
            logger.warn("Combiner taxonomy is an ignored folder, no playlists built");
            return;
        }
        builder.addTracks(subtree, selected);
        tree.moveToFront(subtree);
        logger.info("Built {} Combiner playlists", results.size());
        TagStatistics.log(tree, subtree, trackTags, genreTags);
    }

    @Override
    public String toString() {
        return "PlaylistBuilder[parsers:" + parsers + ", combiner:" + (combinerTaxonomy != null) +
                ", settings:" + settings + "]";
    }
}
