package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.taxonomy.HipHopRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The options that shape a {@link PlaylistBuilder} run, apart from the taxonomies themselves. Instances are
 * immutable; each {@code with} method returns a copy with one option changed.
 */
@API(status = API.Status.STABLE)
public class PlaylistBuilderSettings {

    /**
     * The name of the folder that holds everything a run builds.
     */
    @API(status = API.Status.STABLE)
    public static final String DEFAULT_ROOT_NAME = "AUTO_PLAYLISTS";

    /**
     * Settings with no pure genres, the standard genre delimiter, no remainder grouping, and the standard
     * "Hip Hop" rule.
     */
    @API(status = API.Status.STABLE)
    public static final PlaylistBuilderSettings DEFAULT = new PlaylistBuilderSettings(DEFAULT_ROOT_NAME,
            Collections.<String>emptyList(), TagParser.DEFAULT_GENRE_DELIMITER, "", HipHopRule.DEFAULT);

    /**
     * The name of the folder that holds everything a run builds.
     */
    @API(status = API.Status.STABLE)
    public final String rootName;

    /**
     * Genre names for which the genre parser adds "Pure" tags.
     */
    @API(status = API.Status.STABLE)
    public final List<String> pureGenres;

    /**
     * The text separating genres in the genre field.
     */
    @API(status = API.Status.STABLE)
    public final String genreDelimiter;

    /**
     * How tags that no taxonomy mentions are grouped: {@code folder}, {@code playlist}, or empty for not at all.
     */
    @API(status = API.Status.STABLE)
    public final String remainderType;

    /**
     * Decides which of the identically named "Hip Hop" playlists a track belongs in.
     */
    @API(status = API.Status.STABLE)
    public final HipHopRule hipHopRule;

    private PlaylistBuilderSettings(String rootName, List<String> pureGenres, String genreDelimiter,
                                    String remainderType, HipHopRule hipHopRule) {
        if (rootName == null) {
            throw new NullPointerException("rootName must not be null");
        }
        if (pureGenres == null) {
            throw new NullPointerException("pureGenres must not be null");
        }
        if (genreDelimiter == null || genreDelimiter.isEmpty()) {
            throw new IllegalArgumentException("genreDelimiter must not be empty");
        }
        if (hipHopRule == null) {
            throw new NullPointerException("hipHopRule must not be null");
        }
        this.rootName = rootName;
        this.pureGenres = Collections.unmodifiableList(new ArrayList<>(pureGenres));
        this.genreDelimiter = genreDelimiter;
        this.remainderType = (remainderType == null) ? "" : remainderType;
        this.hipHopRule = hipHopRule;
    }

    /**
     * Change the name of the folder holding everything a run builds.
     *
     * @param rootName the new folder name
     *
     * @return a copy of these settings with the new name
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilderSettings withRootName(String rootName) {
        return new PlaylistBuilderSettings(rootName, pureGenres, genreDelimiter, remainderType, hipHopRule);
    }

    /**
     * Change the genres for which "Pure" tags are added.
     *
     * @param pureGenres the genre names
     *
     * @return a copy of these settings with the new genres
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilderSettings withPureGenres(List<String> pureGenres) {
        return new PlaylistBuilderSettings(rootName, pureGenres, genreDelimiter, remainderType, hipHopRule);
    }

    /**
     * Change the text separating genres in the genre field.
     *
     * @param genreDelimiter the new delimiter, which must not be empty
     *
     * @return a copy of these settings with the new delimiter
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilderSettings withGenreDelimiter(String genreDelimiter) {
        return new PlaylistBuilderSettings(rootName, pureGenres, genreDelimiter, remainderType, hipHopRule);
    }

    /**
     * Change how tags that no taxonomy mentions are grouped. The value is checked when the run uses it, so an
     * unrecognized value is logged there rather than rejected here.
     *
     * @param remainderType {@code folder}, {@code playlist}, or {@code null} or empty to leave such tags out
     *
     * @return a copy of these settings with the new grouping
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilderSettings withRemainderType(String remainderType) {
        return new PlaylistBuilderSettings(rootName, pureGenres, genreDelimiter, remainderType, hipHopRule);
    }

    /**
     * Change the rule used to choose between identically named "Hip Hop" playlists.
     *
     * @param hipHopRule the new rule
     *
     * @return a copy of these settings with the new rule
     */
    @API(status = API.Status.STABLE)
    public PlaylistBuilderSettings withHipHopRule(HipHopRule hipHopRule) {
        return new PlaylistBuilderSettings(rootName, pureGenres, genreDelimiter, remainderType, hipHopRule);
    }

    @Override
    public String toString() {
        return "PlaylistBuilderSettings[rootName:" + rootName + ", pureGenres:" + pureGenres +
                ", genreDelimiter:" + genreDelimiter + ", remainderType:" + remainderType +
                ", hipHopRule:" + hipHopRule + "]";
    }
}
