package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Summarizes which tags the tracks of each Combiner playlist carry, as ASCII histograms with one bar per tag.
 * Genre tags and other tags are charted separately. Useful for checking that an expression selects what was
 * intended.
 */
@API(status = API.Status.STABLE)
public class TagStatistics {

    private static final Logger logger = LoggerFactory.getLogger(TagStatistics.class);

    /**
     * The height, in rows, of the tallest bar in a histogram.
     */
    @API(status = API.Status.STABLE)
    public static final int MAX_BAR_HEIGHT = 25;

    /**
     * Prevent instantiation.
     */
    private TagStatistics() {
        // Nothing to do.
    }

    /**
     * Scale tag counts so the largest becomes {@code maximum}. Every non-zero count stays visible with a height
     * of at least one.
     *
     * @param data tag names mapped to counts, none of which may be zero
     * @param maximum the height of the tallest bar
     *
     * @return tag names mapped to bar heights, in the same order
     */
    @API(status = API.Status.STABLE)
    public static Map<String, Integer> scale(Map<String, Integer> data, int maximum) {
        int largest = 0;
        for (int value : data.values()) {
            largest = Math.max(largest, value);
        }
        final Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : data.entrySet()) {
            final int scaled = (int) Math.rint(((double) entry.getValue() / largest) * maximum);
            result.put(entry.getKey(), Math.max(scaled, 1));
        }
        return result;
    }

    /**
     * Draw a histogram of tag counts, with a column for each tag, labelled along the bottom. Tags with a count of
     * zero are left out.
     *
     * @param data tag names mapped to counts, in the order the columns should appear
     *
     * @return the rendered histogram, or an empty string if every count is zero
     */
    @API(status = API.Status.STABLE)
    public static String histogram(Map<String, Integer> data) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : data.entrySet()) {
            if (entry.getValue() > 0) {
                counts.put(entry.getKey(), entry.getValue());
            }
        }
        if (counts.isEmpty()) {
            return "";
        }
        final Map<String, Integer> heights = scale(counts, MAX_BAR_HEIGHT);
        final int widthPad = 1;
        int row = Collections.max(heights.values());
        int rowWidth = 0;
        final StringBuilder output = new StringBuilder();
        while (row > 0) {
            final int rowStart = output.length();
            output.append('|');
            for (String tag : counts.keySet()) {
                final int center = (int) Math.rint(tag.length() / 2.0);
                appendSpaces(output, widthPad + center);
                output.append(row <= heights.get(tag) ? '*' : ' ');
                appendSpaces(output, widthPad + center);
            }
            if (rowWidth == 0) {
                rowWidth = output.length() - rowStart;
            }
            output.append('\n');
            row--;
        }
        for (int i = 0; i < rowWidth; i++) {
            output.append('-');
        }
        output.append("\n ");
        for (String tag : counts.keySet()) {
            appendSpaces(output, widthPad);
            output.append(tag);
            appendSpaces(output, widthPad + 1);
        }
        return output.toString();
    }

    private static void appendSpaces(StringBuilder sb, int count) {
        for (int i = 0; i < count; i++) {
            sb.append(' ');
        }
    }

    /**
     * Build the statistics report for every non-empty playlist below a folder.
     *
     * @param tree the tree holding the Combiner playlists
     * @param folder the folder holding the Combiner playlists
     * @param trackTags every tag carried by each track, keyed by track identifier
     * @param genreTags the genre tags carried by each track, keyed by track identifier
     *
     * @return the report, with a heading and histograms for each playlist
     */
    @API(status = API.Status.STABLE)
    public static String report(PlaylistTree tree, int folder, Map<String, ? extends Set<String>> trackTags,
                                Map<String, ? extends Set<String>> genreTags) {
        final StringBuilder report = new StringBuilder();
        for (int playlist : tree.getPlaylists(folder)) {
            final List<String> tracks = tree.getTrackIds(playlist);
            if (tracks.isEmpty()) {
                continue;
            }
            report.append('\n').append(tree.getName(playlist)).append(" tag statistics:\n");
            final Map<String, Integer> counts = new HashMap<>();
            final Set<String> genres = new TreeSet<>();
            final Set<String> others = new TreeSet<>();
            for (String trackId : tracks) {
                final Set<String> all = trackTags.containsKey(trackId) ?
                        trackTags.get(trackId) : Collections.<String>emptySet();
                final Set<String> trackGenres = genreTags.containsKey(trackId) ?
                        genreTags.get(trackId) : Collections.<String>emptySet();
                for (String tag : all) {
                    counts.merge(tag, 1, Integer::sum);
                    if (trackGenres.contains(tag)) {
                        genres.add(tag);
                    } else {
                        others.add(tag);
                    }
                }
            }
            appendSection(report, "Genre", genres, counts);
            appendSection(report, "Other", others, counts);
        }
        return report.toString();
    }

    /**
     * Add the histogram for one group of tags to a report, if there is anything to show.
     *
     * @param report the report being built
     * @param title the name of the group
     * @param tags the tags in the group, in display order
     * @param counts how many tracks carry each tag
     */
    private static void appendSection(StringBuilder report, String title, Set<String> tags,
                                      Map<String, Integer> counts) {
        final Map<String, Integer> data = new LinkedHashMap<>();
        for (String tag : tags) {
            data.put(tag, counts.get(tag));
        }
        final String histogram = histogram(data);
        if (!histogram.isEmpty()) {
            report.append('\n').append(title).append(":\n").append(histogram).append('\n');
        }
    }

    /**
     * Log the statistics report for every non-empty playlist below a folder, at info level.
     *
     * @param tree the tree holding the Combiner playlists
     * @param folder the folder holding the Combiner playlists
     * @param trackTags every tag carried by each track, keyed by track identifier
     * @param genreTags the genre tags carried by each track, keyed by track identifier
     */
    @API(status = API.Status.STABLE)
    public static void log(PlaylistTree tree, int folder, Map<String, ? extends Set<String>> trackTags,
                           Map<String, ? extends Set<String>> genreTags) {
        if (logger.isInfoEnabled()) {
            logger.info("Combiner playlist tag statistics:{}", report(tree, folder, trackTags, genreTags));
        }
    }
}
