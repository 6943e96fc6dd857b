package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.TagIndex;
import org.deepsymmetry.tagplaylists.Track;
import org.deepsymmetry.tagplaylists.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <p>Looks through every Combiner expression before any are evaluated, to find the playlist selectors and the
 * tempo and rating selectors they use. This is a pattern search rather than a full parse.</p>
 *
 * <p>The contents of each pair of square brackets are split on commas. Each part is either a single whole number
 * or two whole numbers separated by a dash, giving an inclusive range in either order. Numbers from 0 to 5 are
 * ratings; larger numbers are tempos. A range must lie entirely on one side of that boundary. Parts that break
 * these rules are logged and skipped, and the remaining parts of the selector still apply.</p>
 *
 * <p>Once the selectors are known, {@link #addMatchingTracks(Iterable, TagIndex)} visits each track once and records
 * it under the literal text of every tempo or rating selector it satisfies, so that those selectors can be looked
 * up exactly like tags during evaluation.</p>
 */
@API(status = API.Status.STABLE)
public class SelectorPrescanner {

    private static final Logger logger = LoggerFactory.getLogger(SelectorPrescanner.class);

    /**
     * Finds the names inside playlist selectors.
     */
    private static final Pattern PLAYLIST_SELECTOR = Pattern.compile("(?<=\\{)[^{}]*(?=})");

    /**
     * Finds the lists inside tempo and rating selectors.
     */
    private static final Pattern NUMERIC_SELECTOR = Pattern.compile("(?<=\\[)[^\\[\\]]*(?=])");

    /**
     * One valid part of a tempo or rating selector: an inclusive range of either ratings or tempos, and the
     * literal selector text it came from. A single number is a range whose ends are equal.
     */
    @API(status = API.Status.STABLE)
    public static class NumericRule {

        /**
         * The full selector text, brackets included, under which matching tracks are recorded.
         */
        @API(status = API.Status.STABLE)
        public final String selector;

        /**
         * Whether the numbers are ratings rather than tempos.
         */
        @API(status = API.Status.STABLE)
        public final boolean isRating;

        /**
         * The smallest number in the range.
         */
        @API(status = API.Status.STABLE)
        public final int low;

        /**
         * The largest number in the range.
         */
        @API(status = API.Status.STABLE)
        public final int high;

        NumericRule(String selector, boolean isRating, int low, int high) {
            this.selector = selector;
            this.isRating = isRating;
            this.low = low;
            this.high = high;
        }

        /**
         * Check whether a track satisfies this rule.
         *
         * @param track the track to examine
         *
         * @return {@code true} if its rating or rounded tempo, as appropriate, lies within the range
         */
        @API(status = API.Status.STABLE)
        public boolean matches(Track track) {
            final int value = isRating ? track.getRating() : track.getRoundedBpm();
            return value >= low && value <= high;
        }

        @Override
        public String toString() {
            return "NumericRule[selector:" + selector + ", " + (isRating ? "ratings " : "tempos ") + low + "-" +
                    high + "]";
        }
    }

    /**
     * The names found inside playlist selectors, in the order first found.
     */
    private final Set<String> playlistNames = new LinkedHashSet<>();

    /**
     * The literal text of every tempo or rating selector found, in the order first found.
     */
    private final Set<String> numericSelectors = new LinkedHashSet<>();

    /**
     * The valid parts of every tempo and rating selector.
     */
    private final List<NumericRule> rules = new ArrayList<>();

    /**
     * Scan a list of expressions for selectors.
     *
     * @param expressions the Combiner expressions that will later be evaluated
     */
    @API(status = API.Status.STABLE)
    public SelectorPrescanner(List<String> expressions) {
        for (String expression : expressions) {
            final Matcher playlistMatcher = PLAYLIST_SELECTOR.matcher(expression);
            while (playlistMatcher.find()) {
                playlistNames.add(playlistMatcher.group());
            }
            final Matcher numericMatcher = NUMERIC_SELECTOR.matcher(expression);
            while (numericMatcher.find()) {
                final String payload = numericMatcher.group();
                if (numericSelectors.add("[" + payload + "]")) {
                    parseNumericSelector(payload);
                }
            }
        }
    }

    /**
     * Interpret the contents of one pair of square brackets, adding a rule for each valid part.
     *
     * @param payload the text between the brackets
     */
    private void parseNumericSelector(String payload) {
        final String selector = "[" + payload + "]";
        for (String rawPart : payload.split(",", -1)) {
            final String part = rawPart.trim();
            final String[] bounds = part.split("-", -1);
            try {
                if (Util.isDigits(part)) {
                    final int number = Integer.parseInt(part);
                    rules.add(new NumericRule(selector, number <= Util.MAX_RATING, number, number));
                } else if (bounds.length == 2 && Util.isDigits(bounds[0]) && Util.isDigits(bounds[1])) {
                    final int first = Integer.parseInt(bounds[0]);
                    final int second = Integer.parseInt(bounds[1]);
                    final int low = Math.min(first, second);
                    final int high = Math.max(first, second);
                    if (high <= Util.MAX_RATING) {
                        rules.add(new NumericRule(selector, true, low, high));
                    } else if (low > Util.MAX_RATING) {
                        rules.add(new NumericRule(selector, false, low, high));
                    } else {
                        logger.error("Bad BPM or rating number range: {}", part);
                    }
                } else {
                    logger.error("Malformed BPM or rating filter part: {}", part);
                }
            } catch (NumberFormatException e) {
                logger.error("Malformed BPM or rating filter part: {}", part, e);
            }
        }
    }

    /**
     * Get the names of the playlists referenced by playlist selectors.
     *
     * @return an unmodifiable view of the names, without braces, in the order first found
     */
    @API(status = API.Status.STABLE)
    public Set<String> getPlaylistNames() {
        return Collections.unmodifiableSet(playlistNames);
    }

    /**
     * Get the literal text of every tempo and rating selector.
     *
     * @return an unmodifiable view of the selectors, brackets included, in the order first found
     */
    @API(status = API.Status.STABLE)
    public Set<String> getNumericSelectors() {
        return Collections.unmodifiableSet(numericSelectors);
    }

    /**
     * Get the valid parts of every tempo and rating selector.
     *
     * @return an unmodifiable view of the rules
     */
    @API(status = API.Status.STABLE)
    public List<NumericRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Record each track under the text of every tempo or rating selector that it satisfies. Every selector is
     * recorded in the index even if no track matches it. Tracks without a location are skipped, and tracks with
     * an unrecognized rating byte can only match tempo selectors.
     *
     * @param tracks the tracks of the collection
     * @param index where matching tracks are recorded
     */
    @API(status = API.Status.STABLE)
    public void addMatchingTracks(Iterable<Track> tracks, TagIndex index) {
        for (String selector : numericSelectors) {
            index.ensure(selector);
        }
        if (rules.isEmpty()) {
            return;
        }
        for (Track track : tracks) {
            if (!track.hasLocation()) {
                continue;
            }
            if (track.getRating() == Util.UNKNOWN_RATING) {
                logger.warn("Track {} has unrecognized rating value {}", track.id, track.ratingByte);
            }
            for (NumericRule rule : rules) {
                if (rule.matches(track)) {
                    index.add(rule.selector, track.id);
                }
            }
        }
    }
}
