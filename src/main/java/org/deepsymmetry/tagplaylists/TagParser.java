package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.taxonomy.PlaylistTaxonomy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces the list of tags carried by a track, from which tag playlists are built. Each parser is paired with
 * the taxonomy describing the folders and playlists its tags should be organized into.
 *
 * The set of parsers is fixed: {@link Type#GENRE} reads the genre field, and {@link Type#MY_TAG} reads the
 * "My Tag" list that rekordbox can be configured to add to the comments field (enable 'Add "My Tag" to the
 * "Comments"' under Preferences &gt; Advanced &gt; Browse). Parsers hold no mutable state.
 */
@API(status = API.Status.STABLE)
public final class TagParser {

    /**
     * The kinds of tag parser that can be configured.
     */
    @API(status = API.Status.STABLE)
    public enum Type {
        /**
         * Splits the genre field into separate genres, adding synthetic "Pure" tags when every genre of a track
         * contains one of the configured pure genre names.
         */
        GENRE("GenreTagParser"),

        /**
         * Extracts the slash-separated list embedded in the comments field between comment markers.
         */
        MY_TAG("MyTagParser");

        /**
         * The name by which this parser is identified in a playlist configuration.
         */
        @API(status = API.Status.STABLE)
        public final String configName;

        Type(String configName) {
            this.configName = configName;
        }

        /**
         * Look up a parser type by the name used in playlist configurations.
         *
         * @param configName the configuration key, such as {@code GenreTagParser}
         *
         * @return the matching type
         *
         * @throws IllegalArgumentException if no parser has that name
         */
        @API(status = API.Status.STABLE)
        public static Type forConfigName(String configName) {
            for (Type type : values()) {
                if (type.configName.equals(configName)) {
                    return type;
                }
            }
            throw new IllegalArgumentException(configName + " is not a valid TagParser!");
        }
    }

    /**
     * The delimiter used between genres when none is configured.
     */
    @API(status = API.Status.STABLE)
    public static final String DEFAULT_GENRE_DELIMITER = "/";

    /**
     * Finds the My Tag list: everything between the first opening comment marker and the last closing one.
     */
    private static final Pattern MY_TAG_PATTERN = Pattern.compile("(?<=/\\*).*(?=\\*/)");

    /**
     * The kind of parsing performed.
     */
    @API(status = API.Status.STABLE)
    public final Type type;

    /**
     * The folder and playlist structure that the tags found by this parser are organized into.
     */
    @API(status = API.Status.STABLE)
    public final PlaylistTaxonomy taxonomy;

    /**
     * Genre names for which "Pure" tags are synthesized. Always empty for {@link Type#MY_TAG}.
     */
    private final List<String> pureGenres;

    /**
     * The text separating genres in the genre field.
     */
    private final String genreDelimiter;

    private TagParser(Type type, PlaylistTaxonomy taxonomy, List<String> pureGenres, String genreDelimiter) {
        if (type == null) {
            throw new NullPointerException("type must not be null");
        }
        if (taxonomy == null) {
            throw new NullPointerException("taxonomy must not be null");
        }
        this.type = type;
        this.taxonomy = taxonomy;
        this.pureGenres = Collections.unmodifiableList(new ArrayList<>(pureGenres));
        this.genreDelimiter = genreDelimiter;
    }

    /**
     * Create a parser which reads the genre field.
     *
     * @param taxonomy the structure into which genre playlists are organized
     * @param pureGenres genres for which a "Pure" tag is added to tracks whose genres all contain that name
     * @param genreDelimiter the text separating genres in the genre field
     *
     * @return the configured parser
     */
    @API(status = API.Status.STABLE)
    public static TagParser genre(PlaylistTaxonomy taxonomy, List<String> pureGenres, String genreDelimiter) {
        if (genreDelimiter == null || genreDelimiter.isEmpty()) {
            throw new IllegalArgumentException("genreDelimiter must not be empty");
        }
        return new TagParser(Type.GENRE, taxonomy, pureGenres, genreDelimiter);
    }

    /**
     * Create a parser which reads the genre field, using the standard delimiter.
     *
     * @param taxonomy the structure into which genre playlists are organized
     * @param pureGenres genres for which a "Pure" tag is added to tracks whose genres all contain that name
     *
     * @return the configured parser
     */
    @API(status = API.Status.STABLE)
    public static TagParser genre(PlaylistTaxonomy taxonomy, List<String> pureGenres) {
        return genre(taxonomy, pureGenres, DEFAULT_GENRE_DELIMITER);
    }

    /**
     * Create a parser which reads the My Tag list from the comments field.
     *
     * @param taxonomy the structure into which My Tag playlists are organized
     *
     * @return the configured parser
     */
    @API(status = API.Status.STABLE)
    public static TagParser myTag(PlaylistTaxonomy taxonomy) {
        return new TagParser(Type.MY_TAG, taxonomy, Collections.<String>emptyList(), DEFAULT_GENRE_DELIMITER);
    }

    /**
     * Create a parser of the given type with the settings that apply to it.
     *
     * @param type the kind of parser
     * @param taxonomy the structure into which its playlists are organized
     * @param settings supplies the pure genres and genre delimiter for {@link Type#GENRE}
     *
     * @return the configured parser
     */
    @API(status = API.Status.STABLE)
    public static TagParser create(Type type, PlaylistTaxonomy taxonomy, PlaylistBuilderSettings settings) {
        switch (type) {
            case GENRE:
                return genre(taxonomy, settings.pureGenres, settings.genreDelimiter);

            case MY_TAG:
                return myTag(taxonomy);

            default:
                throw new IllegalArgumentException("Unsupported TagParser type: " + type);
        }
    }

    /**
     * Get the genre names for which "Pure" tags are synthesized.
     *
     * @return an unmodifiable list of the pure genre names
     */
    @API(status = API.Status.STABLE)
    public List<String> getPureGenres() {
        return pureGenres;
    }

    /**
     * Produce the tags carried by a track.
     *
     * @param track the track to examine
     *
     * @return the tags, in the order they were found; a new, mutable list
     */
    @API(status = API.Status.STABLE)
    public List<String> tagsFor(Track track) {
        switch (type) {
            case GENRE:
                return genreTags(track);

            case MY_TAG:
                return myTags(track);

            default:
                throw new IllegalStateException("Unsupported TagParser type: " + type);
        }
    }

    /**
     * Split the genre field and add any "Pure" tags that apply. An empty genre field results in a single empty
     * tag.
     *
     * @param track the track whose genres are wanted
     *
     * @return the genre tags
     */
    private List<String> genreTags(Track track) {
        final List<String> tags = splitAndTrim(track.genre, genreDelimiter);
        for (String pure : pureGenres) {
            boolean allMatch = true;
            for (String tag : tags) {  // Includes any "Pure" tags already added.
                if (!Util.containsIgnoreCase(tag, pure)) {
                    allMatch = false;
                    break;
                }
            }
            if (allMatch) {
                tags.add("Pure " + pure);
            }
        }
        return tags;
    }

    /**
     * Find the My Tag list in the comments field.
     *
     * @param track the track whose My Tags are wanted
     *
     * @return the tags, or an empty list if the comments hold no My Tag list
     */
    private List<String> myTags(Track track) {
        final Matcher matcher = MY_TAG_PATTERN.matcher(track.comments);
        if (!matcher.find()) {
            return new ArrayList<>();
        }
        return splitAndTrim(matcher.group(), "/");
    }

    /**
     * Split text on a literal delimiter, trimming each piece. Empty pieces are kept, including trailing ones.
     *
     * @param text the text to split
     * @param delimiter the literal delimiter
     *
     * @return the trimmed pieces
     */
    private static List<String> splitAndTrim(String text, String delimiter) {
        final List<String> result = new ArrayList<>();
        for (String piece : text.split(Pattern.quote(delimiter), -1)) {
            result.add(piece.trim());
        }
        return result;
    }

    @Override
    public String toString() {
        return "TagParser[type:" + type + ", pureGenres:" + pureGenres + ", taxonomy:" + taxonomy.getName() + "]";
    }
}
