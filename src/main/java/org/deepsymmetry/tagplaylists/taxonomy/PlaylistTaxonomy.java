package org.deepsymmetry.tagplaylists.taxonomy;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * <p>Describes a folder and playlist structure that tag playlists are organized into. A node is either a
 * playlist, named by the tag whose tracks it holds, or a folder with a name and an ordered list of children.</p>
 *
 * <p>A folder named {@value #IGNORE_FOLDER} is a marker rather than a real folder: its children must all be
 * playlists, no playlists are created for them, but their tags count as known so that their tracks are left out
 * of the "Other" remainder playlists.</p>
 *
 * <p>Taxonomies usually arrive as the nested maps and lists produced by a YAML or JSON parser, and can be
 * converted with {@link #fromConfig(Object)}. A simple immutable value class.</p>
 */
@API(status = API.Status.STABLE)
public class PlaylistTaxonomy {

    /**
     * The name of the folder whose children are known tags for which no playlists are created.
     */
    @API(status = API.Status.STABLE)
    public static final String IGNORE_FOLDER = "_ignore";

    /**
     * The configuration key holding a folder's name.
     */
    private static final String NAME_KEY = "name";

    /**
     * The configuration key holding a folder's children.
     */
    private static final String PLAYLISTS_KEY = "playlists";

    /**
     * The name of the folder, or the tag of the playlist.
     */
    private final String name;

    /**
     * The children of a folder; {@code null} for playlists.
     */
    private final List<PlaylistTaxonomy> children;

    private PlaylistTaxonomy(String name, List<PlaylistTaxonomy> children) {
        if (name == null) {
            throw new NullPointerException("name must not be null");
        }
        this.name = name;
        this.children = (children == null) ? null : Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Create a playlist node.
     *
     * @param tag the tag whose tracks the playlist should hold, which is also its name
     *
     * @return the playlist node
     */
    @API(status = API.Status.STABLE)
    public static PlaylistTaxonomy playlist(String tag) {
        return new PlaylistTaxonomy(tag, null);
    }

    /**
     * Create a folder node.
     *
     * @param name the name of the folder
     * @param children the folders and playlists it contains, in display order
     *
     * @return the folder node
     *
     * @throws IllegalArgumentException if this is an {@value #IGNORE_FOLDER} folder with a child that is not a
     *                                  playlist
     */
    @API(status = API.Status.STABLE)
    public static PlaylistTaxonomy folder(String name, List<PlaylistTaxonomy> children) {
        if (IGNORE_FOLDER.equals(name)) {
            for (PlaylistTaxonomy child : children) {
                if (child.isFolder()) {
                    throw new IllegalArgumentException("The " + IGNORE_FOLDER +
                            " folder may only list tags, found folder " + child.name);
                }
            }
        }
        return new PlaylistTaxonomy(name, children);
    }

    /**
     * Convenience method to create a folder node.
     *
     * @param name the name of the folder
     * @param children the folders and playlists it contains, in display order
     *
     * @return the folder node
     */
    @API(status = API.Status.STABLE)
    public static PlaylistTaxonomy folder(String name, PlaylistTaxonomy... children) {
        final List<PlaylistTaxonomy> list = new ArrayList<>();
        Collections.addAll(list, children);
        return folder(name, list);
    }

    /**
     * Convert a parsed configuration value to a taxonomy. Strings become playlists; maps with a {@code name}
     * string and a {@code playlists} list become folders, with keys matched regardless of case.
     *
     * @param content the parsed configuration value
     *
     * @return the corresponding taxonomy node
     *
     * @throws IllegalArgumentException if an entry is neither a string nor a well-formed folder map
     */
    @API(status = API.Status.STABLE)
    public static PlaylistTaxonomy fromConfig(Object content) {
        if (content instanceof String) {
            return playlist((String) content);
        }
        if (content instanceof Map) {
            Object name = null;
            Object playlists = null;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) content).entrySet()) {
                final String key = String.valueOf(entry.getKey()).toLowerCase();
                if (NAME_KEY.equals(key)) {
                    name = entry.getValue();
                } else if (PLAYLISTS_KEY.equals(key)) {
                    playlists = entry.getValue();
                }
            }
            if (!(name instanceof String)) {
                throw new IllegalArgumentException("Folder must have a string \"" + NAME_KEY + "\": " + content);
            }
            if (!(playlists instanceof List)) {
                throw new IllegalArgumentException("Folder " + name + " must have a \"" + PLAYLISTS_KEY +
                        "\" list: " + content);
            }
            final List<PlaylistTaxonomy> children = new ArrayList<>();
            for (Object child : (List<?>) playlists) {
                children.add(fromConfig(child));
            }
            return folder((String) name, children);
        }
        throw new IllegalArgumentException("Encountered invalid input type " +
                ((content == null) ? "null" : content.getClass().getName()) + ": " + content);
    }

    /**
     * Get the name of the folder, or the tag of the playlist.
     *
     * @return the node name
     */
    @API(status = API.Status.STABLE)
    public String getName() {
        return name;
    }

    /**
     * Check whether this node is a folder.
     *
     * @return {@code true} for folders, {@code false} for playlists
     */
    @API(status = API.Status.STABLE)
    public boolean isFolder() {
        return children != null;
    }

    /**
     * Check whether this node is the marker folder whose children are ignored.
     *
     * @return {@code true} if this is a folder named {@value #IGNORE_FOLDER}
     */
    @API(status = API.Status.STABLE)
    public boolean isIgnoreFolder() {
        return isFolder() && IGNORE_FOLDER.equals(name);
    }

    /**
     * Get the children of a folder.
     *
     * @return an unmodifiable list of the children, empty for playlists
     */
    @API(status = API.Status.STABLE)
    public List<PlaylistTaxonomy> getChildren() {
        if (children == null) {
            return Collections.emptyList();
        }
        return children;
    }

    /**
     * Gather the names of the playlists found directly in this folder, which is how the Combiner configuration
     * lists its expressions.
     *
     * @return the names of the child playlists, in order, skipping any child folders
     */
    @API(status = API.Status.STABLE)
    public List<String> getPlaylistNames() {
        final List<String> result = new ArrayList<>();
        for (PlaylistTaxonomy child : getChildren()) {
            if (!child.isFolder()) {
                result.add(child.name);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        if (isFolder()) {
            return "PlaylistTaxonomy[folder:" + name + ", children:" + children + "]";
        }
        return "PlaylistTaxonomy[playlist:" + name + "]";
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + ((children == null) ? 0 : children.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PlaylistTaxonomy other = (PlaylistTaxonomy) obj;
        if (!name.equals(other.name)) {
            return false;
        }
        return (children == null) ? other.children == null : children.equals(other.children);
    }
}
