package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Provides utility functions.
 */
@API(status = API.Status.STABLE)
public class Util {

    /**
     * Prevent instantiation.
     */
    private Util() {
        // Nothing to do.
    }

    /**
     * Value returned by {@link #ratingForByte(int)} when the byte is not one of the values rekordbox writes.
     */
    @API(status = API.Status.STABLE)
    public static final int UNKNOWN_RATING = -1;

    /**
     * The highest star rating rekordbox can assign to a track. Numeric selectors at or below this value are
     * treated as ratings, anything above it as a tempo.
     */
    @API(status = API.Status.STABLE)
    public static final int MAX_RATING = 5;

    /**
     * Maps the byte values rekordbox stores in the Rating attribute of a collection export to the number of
     * stars they represent.
     */
    private static final Map<Integer, Integer> RATING_BYTES;

    static {
        final Map<Integer, Integer> scratch = new HashMap<>();
        for (int stars = 0; stars <= MAX_RATING; stars++) {
            scratch.put(stars * 51, stars);
        }
        RATING_BYTES = Collections.unmodifiableMap(scratch);
    }

    /**
     * Convert the rating byte found in a collection export to a number of stars.
     *
     * @param ratingByte one of 0, 51, 102, 153, 204, or 255
     *
     * @return the corresponding star rating, from 0 to 5, or {@link #UNKNOWN_RATING} if the byte is not one of
     *         the canonical values
     */
    @API(status = API.Status.STABLE)
    public static int ratingForByte(int ratingByte) {
        final Integer stars = RATING_BYTES.get(ratingByte);
        return (stars == null) ? UNKNOWN_RATING : stars;
    }

    /**
     * Convert a star rating to the byte rekordbox uses to store it.
     *
     * @param stars the rating, from 0 to 5
     *
     * @return the byte value written to the Rating attribute
     *
     * @throws IllegalArgumentException if {@code stars} is out of range
     */
    @API(status = API.Status.STABLE)
    public static int byteForRating(int stars) {
        if (stars < 0 || stars > MAX_RATING) {
            throw new IllegalArgumentException("Rating must be between 0 and " + MAX_RATING + ", got " + stars);
        }
        return stars * 51;
    }

    /**
     * Round an average tempo to the whole number used when matching tempo selectors. Halfway values round to the
     * even neighbor, so 127.5 becomes 128 but 126.5 becomes 126.
     *
     * @param averageBpm the tempo found in the collection export
     *
     * @return the rounded tempo
     */
    @API(status = API.Status.STABLE)
    public static int roundTempo(double averageBpm) {
        return (int) Math.rint(averageBpm);
    }

    /**
     * Checks whether a string is made up entirely of ASCII digits, which is how the parts of a numeric selector
     * are recognized.
     *
     * @param text the text to examine
     *
     * @return {@code true} if {@code text} is non-empty and contains nothing but digits
     */
    @API(status = API.Status.STABLE)
    public static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether some text contains another string, ignoring case.
     *
     * @param text the text to be searched
     * @param fragment the string sought
     *
     * @return {@code true} if {@code fragment} appears anywhere within {@code text}, regardless of case
     */
    @API(status = API.Status.STABLE)
    public static boolean containsIgnoreCase(String text, String fragment) {
        return text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }
}
