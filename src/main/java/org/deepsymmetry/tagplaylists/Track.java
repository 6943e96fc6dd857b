package org.deepsymmetry.tagplaylists;

import org.apiguardian.api.API;

/**
 * Represents the attributes of a track in a rekordbox collection export that are needed to build tag playlists.
 * Tracks are owned by the collection; this library refers to them only by {@link #id}.
 *
 * A simple immutable value class.
 */
@API(status = API.Status.STABLE)
public class Track {

    /**
     * The stable identifier of the track within the collection (the TrackID attribute).
     */
    @API(status = API.Status.STABLE)
    public final String id;

    /**
     * The genre field, which may hold several genres separated by a delimiter.
     */
    @API(status = API.Status.STABLE)
    public final String genre;

    /**
     * The comments field, which may hold a list of My Tags that rekordbox wraps in comment markers.
     */
    @API(status = API.Status.STABLE)
    public final String comments;

    /**
     * The average tempo of the track.
     */
    @API(status = API.Status.STABLE)
    public final double averageBpm;

    /**
     * The raw rating byte, which rekordbox stores as one of 0, 51, 102, 153, 204, or 255.
     */
    @API(status = API.Status.STABLE)
    public final int ratingByte;

    /**
     * Where the audio file lives. Entries without a location are playlist references rather than real tracks.
     */
    @API(status = API.Status.STABLE)
    public final String location;

    /**
     * Constructor simply sets the immutable value fields. Missing text fields are replaced by empty strings.
     *
     * @param id the identifier of the track within the collection
     * @param genre the genre field
     * @param comments the comments field
     * @param averageBpm the average tempo
     * @param ratingByte the raw rating byte
     * @param location the location of the audio file, may be empty or {@code null} for playlist references
     *
     * @throws NullPointerException if {@code id} is {@code null}
     */
    @API(status = API.Status.STABLE)
    public Track(String id, String genre, String comments, double averageBpm, int ratingByte, String location) {
        if (id == null) {
            throw new NullPointerException("id must not be null");
        }
        this.id = id;
        this.genre = (genre == null) ? "" : genre;
        this.comments = (comments == null) ? "" : comments;
        this.averageBpm = averageBpm;
        this.ratingByte = ratingByte;
        this.location = (location == null) ? "" : location;
    }

    /**
     * Constructor for attributes as they are serialized in a collection export, where the tempo and rating are
     * strings.
     *
     * @param id the identifier of the track within the collection
     * @param genre the genre field
     * @param comments the comments field
     * @param averageBpm the average tempo, as text
     * @param ratingByte the raw rating byte, as text
     * @param location the location of the audio file
     *
     * @throws NumberFormatException if the tempo or rating cannot be parsed
     */
    @API(status = API.Status.STABLE)
    public Track(String id, String genre, String comments, String averageBpm, String ratingByte, String location) {
        this(id, genre, comments, Double.parseDouble(averageBpm.trim()), Integer.parseInt(ratingByte.trim()),
                location);
    }

    /**
     * Check whether this entry refers to an actual audio file, rather than being a playlist membership artifact.
     *
     * @return {@code true} if the track has a non-empty location
     */
    @API(status = API.Status.STABLE)
    public boolean hasLocation() {
        return !location.isEmpty();
    }

    /**
     * Get the tempo used for matching tempo selectors.
     *
     * @return the average tempo rounded to a whole number of beats per minute
     */
    @API(status = API.Status.STABLE)
    public int getRoundedBpm() {
        return Util.roundTempo(averageBpm);
    }

    /**
     * Get the star rating of the track.
     *
     * @return the rating from 0 to 5, or {@link Util#UNKNOWN_RATING} if the rating byte is not a canonical value
     */
    @API(status = API.Status.STABLE)
    public int getRating() {
        return Util.ratingForByte(ratingByte);
    }

    @Override
    public String toString() {
        return "Track[id:" + id + ", genre:" + genre + ", comments:" + comments + ", averageBpm:" + averageBpm +
                ", ratingByte:" + ratingByte + ", location:" + location + "]";
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Track other = (Track) obj;
        return id.equals(other.id) && genre.equals(other.genre) && comments.equals(other.comments) &&
                Double.compare(averageBpm, other.averageBpm) == 0 && ratingByte == other.ratingByte &&
                location.equals(other.location);
    }
}
