package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.TagIndex;
import org.deepsymmetry.tagplaylists.TrackCollection;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * <p>Builds playlists by evaluating boolean expressions over tags, existing playlists, tempos and ratings. The
 * Combiner configuration is a folder whose playlists are the expressions themselves; each expression becomes the
 * name of a playlist holding the tracks it selects.</p>
 *
 * <p>Operands can be:</p>
 * <ul>
 *     <li>tags produced by the tag parsers, such as {@code Techno} or {@code Dark};</li>
 *     <li>wildcards, where {@code *} matches any run of characters, such as {@code *Techno};</li>
 *     <li>playlist names in curly braces, such as {@code {All Bass}};</li>
 *     <li>ratings (0 to 5) and tempos (above 5) in square brackets, as comma-separated numbers and dash-separated
 *     ranges, such as {@code [120-129, 140]} or {@code [4-5]}.</li>
 * </ul>
 *
 * <p>Operators are {@code &} (tracks in both), {@code |} (tracks in either) and {@code ~} (tracks in the left but
 * not the right), applied left to right without precedence; parentheses group. For example
 * {@code (([120-129] & *Techno) | [130-160]) ~ [5]} takes the techno tracks from 120 to 129 BPM, adds every
 * track from 130 to 160 BPM, then removes the five star tracks.</p>
 *
 * <p>A Combiner is used for a single run: construct it (which scans the expressions and records the tracks
 * matching each tempo and rating selector), call {@link #addPlaylistSelectors(PlaylistTree, int)} once the tag
 * playlists exist, then {@link #evaluate(TagIndex)}.</p>
 */
@API(status = API.Status.STABLE)
public class Combiner {

    private static final Logger logger = LoggerFactory.getLogger(Combiner.class);

    /**
     * The name under which the Combiner is configured, alongside the tag parsers.
     */
    @API(status = API.Status.STABLE)
    public static final String CONFIG_NAME = "Combiner";

    /**
     * The configuration, whose playlists are the expressions.
     */
    private final PlaylistTaxonomy taxonomy;

    /**
     * The expressions to evaluate, in configuration order.
     */
    private final List<String> expressions;

    /**
     * Holds the selectors found in the expressions.
     */
    private final SelectorPrescanner prescanner;

    /**
     * Every tag and resolved selector available to the expressions.
     */
    private final TagIndex tracks = new TagIndex();

    /**
     * Set up a Combiner run, scanning the expressions for selectors and recording the tracks that satisfy each
     * tempo and rating selector.
     *
     * @param taxonomy the Combiner configuration, a folder listing the expressions as its playlists
     * @param collection the tracks of the collection
     */
    @API(status = API.Status.STABLE)
    public Combiner(PlaylistTaxonomy taxonomy, TrackCollection collection) {
        if (taxonomy == null) {
            throw new NullPointerException("taxonomy must not be null");
        }
        if (collection == null) {
            throw new NullPointerException("collection must not be null");
        }
        this.taxonomy = taxonomy;
        expressions = Collections.unmodifiableList(taxonomy.getPlaylistNames());
        prescanner = new SelectorPrescanner(expressions);
        prescanner.addMatchingTracks(collection.getTracks(), tracks);
        logger.debug("Combiner found {} expressions using playlist selectors {} and numeric selectors {}",
                expressions.size(), prescanner.getPlaylistNames(), prescanner.getNumericSelectors());
    }

    /**
     * Get the Combiner configuration.
     *
     * @return the folder listing the expressions
     */
    @API(status = API.Status.STABLE)
    public PlaylistTaxonomy getTaxonomy() {
        return taxonomy;
    }

    /**
     * Get the expressions that will be evaluated.
     *
     * @return an unmodifiable list of the expressions, in configuration order
     */
    @API(status = API.Status.STABLE)
    public List<String> getExpressions() {
        return expressions;
    }

    /**
     * Get the names of the playlists that the expressions refer to.
     *
     * @return an unmodifiable set of playlist names, without braces
     */
    @API(status = API.Status.STABLE)
    public Set<String> getPlaylistSelectors() {
        return prescanner.getPlaylistNames();
    }

    /**
     * Resolve every playlist selector against the playlists built so far. For each name, the first node with
     * exactly that name below {@code searchRoot} is found and the tracks directly in it are recorded under the
     * selector text (the name in curly braces).
     *
     * @param tree the tree holding the playlists built from tags
     * @param searchRoot the node below which playlists are sought
     *
     * @return the index of tags and selectors, now including the playlist selectors
     *
     * @throws NoSuchElementException if an expression names a playlist that does not exist
     */
    @API(status = API.Status.STABLE)
    public TagIndex addPlaylistSelectors(PlaylistTree tree, int searchRoot) {
        for (String name : prescanner.getPlaylistNames()) {
            final int playlist = tree.findByName(searchRoot, name);
            if (playlist == PlaylistTree.NO_NODE) {
                throw new NoSuchElementException(name + " not found");
            }
            tracks.replace("{" + name + "}", tree.getTrackIds(playlist));
        }
        return tracks;
    }

    /**
     * Get every tag and selector available to the expressions, with the tracks recorded under it.
     *
     * @return the index accumulated by this Combiner
     */
    @API(status = API.Status.STABLE)
    public TagIndex getCombinerTracks() {
        return tracks;
    }

    /**
     * Evaluate a single expression against the tags and selectors gathered so far.
     *
     * @param expression the expression
     *
     * @return the identifiers of the selected tracks
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    @API(status = API.Status.STABLE)
    public Set<String> evaluate(String expression) {
        return new ExpressionEvaluator(tracks).evaluate(expression);
    }

    /**
     * Add the tags produced by the tag parsers, then evaluate every expression. When a tag parser produced a tag
     * that is also a selector or another parser's tag, the tracks are combined. An expression that turns out to
     * be malformed is logged and selects no tracks; the others are unaffected.
     *
     * @param tags the tags produced by the tag parsers, merged
     *
     * @return each expression mapped to the identifiers of the tracks it selects, in configuration order
     */
    @API(status = API.Status.STABLE)
    public Map<String, Set<String>> evaluate(TagIndex tags) {
        tracks.merge(tags);
        final Map<String, Set<String>> result = new LinkedHashMap<>();
        for (String expression : expressions) {
            try {
                result.put(expression, evaluate(expression));
            } catch (IllegalArgumentException e) {
                logger.error("Unable to evaluate Combiner expression \"{}\"", expression, e);
                result.put(expression, new LinkedHashSet<String>());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Combiner[expressions:" + expressions + "]";
    }
}
