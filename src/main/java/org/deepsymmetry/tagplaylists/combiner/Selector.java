package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.TagIndex;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <p>An operand of a Combiner expression, which resolves to a set of track identifiers. The kind of selector is
 * decided once, from the shape of its text, when the expression is scanned:</p>
 *
 * <ul>
 *     <li>text containing {@code *} is a {@link Wildcard} which matches every tag fitting the pattern;</li>
 *     <li>text in curly braces, like {@code {All DnB}}, is a {@link PlaylistReference} to an existing playlist;</li>
 *     <li>text in square brackets, like {@code [120-129, 5]}, is a {@link NumericRange} of tempos and ratings;</li>
 *     <li>anything else is a plain {@link Tag}.</li>
 * </ul>
 *
 * <p>Playlist references and numeric ranges must already have been resolved into the {@link TagIndex} under their
 * literal text before expressions are evaluated. The set of selector kinds is closed.</p>
 */
@API(status = API.Status.STABLE)
public abstract class Selector {

    /**
     * The selector text as it appeared in the expression, trimmed.
     */
    @API(status = API.Status.STABLE)
    public final String text;

    private Selector(String text) {
        this.text = text;
    }

    /**
     * Find the tracks chosen by this selector.
     *
     * @param tags the tracks carrying each tag, along with any pre-resolved selectors
     *
     * @return a new set of track identifiers, empty if nothing matches
     */
    @API(status = API.Status.STABLE)
    public abstract Set<String> resolve(TagIndex tags);

    /**
     * Interpret a trimmed, non-empty token from an expression.
     *
     * @param token the operand text
     *
     * @return the corresponding selector
     */
    @API(status = API.Status.STABLE)
    public static Selector parse(String token) {
        if (token.contains("*")) {
            return new Wildcard(token);
        }
        if (token.length() >= 2 && token.startsWith("{") && token.endsWith("}")) {
            return new PlaylistReference(token);
        }
        if (token.length() >= 2 && token.startsWith("[") && token.endsWith("]")) {
            return new NumericRange(token);
        }
        return new Tag(token);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + text.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return text.equals(((Selector) obj).text);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + text + "]";
    }

    /**
     * Selects the tracks carrying a single tag.
     */
    @API(status = API.Status.STABLE)
    public static final class Tag extends Selector {

        private Tag(String text) {
            super(text);
        }

        @Override
        public Set<String> resolve(TagIndex tags) {
            return tags.getTrackIds(text);
        }
    }

    /**
     * Selects the tracks carrying any tag that matches a pattern, where each {@code *} stands for any run of
     * characters. The pattern may match anywhere within a tag, so {@code *House} matches "Acid House" and
     * "Bass House", and {@code Deep *} matches both "Deep House" and "Deep Dubstep".
     */
    @API(status = API.Status.STABLE)
    public static final class Wildcard extends Selector {

        /**
         * The compiled form of the wildcard.
         */
        @API(status = API.Status.STABLE)
        public final Pattern pattern;

        private Wildcard(String text) {
            super(text);
            final StringBuilder regex = new StringBuilder();
            final String[] parts = text.split("\\*", -1);
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    regex.append(".*");
                }
                if (!parts[i].isEmpty()) {
                    regex.append(Pattern.quote(parts[i]));
                }
            }
            pattern = Pattern.compile(regex.toString());
        }

        @Override
        public Set<String> resolve(TagIndex tags) {
            final Set<String> result = new LinkedHashSet<>();
            for (String tag : tags.getTags()) {
                if (pattern.matcher(tag).find()) {
                    result.addAll(tags.getTrackIds(tag));
                }
            }
            return result;
        }
    }

    /**
     * Selects the tracks of an existing playlist, named between curly braces.
     */
    @API(status = API.Status.STABLE)
    public static final class PlaylistReference extends Selector {

        private PlaylistReference(String text) {
            super(text);
        }

        /**
         * Get the name of the playlist being referenced.
         *
         * @return the text between the braces
         */
        @API(status = API.Status.STABLE)
        public String getPlaylistName() {
            return text.substring(1, text.length() - 1);
        }

        @Override
        public Set<String> resolve(TagIndex tags) {
            return tags.getTrackIds(text);
        }
    }

    /**
     * Selects the tracks whose tempo or rating falls within a comma-separated list of numbers and ranges, given
     * between square brackets. Numbers from 0 to 5 are ratings, larger numbers are tempos.
     */
    @API(status = API.Status.STABLE)
    public static final class NumericRange extends Selector {

        private NumericRange(String text) {
            super(text);
        }

        /**
         * Get the list of numbers and ranges.
         *
         * @return the text between the brackets
         */
        @API(status = API.Status.STABLE)
        public String getPayload() {
            return text.substring(1, text.length() - 1);
        }

        @Override
        public Set<String> resolve(TagIndex tags) {
            return tags.getTrackIds(text);
        }
    }
}
