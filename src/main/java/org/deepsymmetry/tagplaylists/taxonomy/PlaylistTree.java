package org.deepsymmetry.tagplaylists.taxonomy;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>The folders and playlists produced by a run, ready to be written back into a collection export. Nodes are
 * stored in an arena and addressed by their index, which stays valid for the life of the tree; parent and child
 * relationships are recorded as indices as well. Index {@code 0} is always the root folder.</p>
 *
 * <p>Folders have an ordered list of children. Playlists have an ordered list of track identifiers. A new tree
 * is built for each run. Instances are not thread-safe.</p>
 */
@API(status = API.Status.STABLE)
public class PlaylistTree {

    /**
     * The value returned by lookups that find nothing, and by {@link #getParent(int)} for the root.
     */
    @API(status = API.Status.STABLE)
    public static final int NO_NODE = -1;

    /**
     * The index of the root folder.
     */
    @API(status = API.Status.STABLE)
    public static final int ROOT = 0;

    /**
     * One entry of the arena.
     */
    private static class Node {
        final String name;
        final int parent;
        final List<Integer> children;  // null for playlists
        final List<String> trackIds;  // null for folders

        Node(String name, int parent, boolean folder) {
            this.name = name;
            this.parent = parent;
            this.children = folder ? new ArrayList<Integer>() : null;
            this.trackIds = folder ? null : new ArrayList<String>();
        }
    }

    /**
     * Every node in the tree, in creation order.
     */
    private final List<Node> nodes = new ArrayList<>();

    /**
     * Create a tree containing only a root folder.
     *
     * @param rootName the name of the root folder
     */
    @API(status = API.Status.STABLE)
    public PlaylistTree(String rootName) {
        if (rootName == null) {
            throw new NullPointerException("rootName must not be null");
        }
        nodes.add(new Node(rootName, NO_NODE, true));
    }

    /**
     * Look up a node, making sure the index is valid.
     *
     * @param index the node index
     *
     * @return the node
     *
     * @throws IndexOutOfBoundsException if there is no such node
     */
    private Node node(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node with index " + index + " in tree of size " + nodes.size());
        }
        return nodes.get(index);
    }

    /**
     * Look up a node that must be a folder.
     *
     * @param index the node index
     *
     * @return the folder node
     *
     * @throws IllegalArgumentException if the node is a playlist
     */
    private Node folder(int index) {
        final Node result = node(index);
        if (result.children == null) {
            throw new IllegalArgumentException("Node " + index + " (" + result.name + ") is not a folder");
        }
        return result;
    }

    /**
     * Create a node at the end of a folder.
     *
     * @param parent the index of the containing folder
     * @param name the node name
     * @param isFolder whether to create a folder rather than a playlist
     *
     * @return the index of the new node
     */
    private int add(int parent, String name, boolean isFolder) {
        if (name == null) {
            throw new NullPointerException("name must not be null");
        }
        final Node container = folder(parent);
        final int index = nodes.size();
        nodes.add(new Node(name, parent, isFolder));
        container.children.add(index);
        return index;
    }

    /**
     * Create a folder at the end of an existing folder.
     *
     * @param parent the index of the containing folder
     * @param name the name of the new folder
     *
     * @return the index of the new folder
     */
    @API(status = API.Status.STABLE)
    public int addFolder(int parent, String name) {
        return add(parent, name, true);
    }

    /**
     * Create an empty playlist at the end of an existing folder.
     *
     * @param parent the index of the containing folder
     * @param name the name of the new playlist
     *
     * @return the index of the new playlist
     */
    @API(status = API.Status.STABLE)
    public int addPlaylist(int parent, String name) {
        return add(parent, name, false);
    }

    /**
     * Move a node so that it becomes the first child of its folder.
     *
     * @param index the node to move
     *
     * @throws IllegalArgumentException if the node is the root
     */
    @API(status = API.Status.STABLE)
    public void moveToFront(int index) {
        final Node target = node(index);
        if (target.parent == NO_NODE) {
            throw new IllegalArgumentException("The root folder has no siblings to move in front of");
        }
        final List<Integer> siblings = nodes.get(target.parent).children;
        siblings.remove(Integer.valueOf(index));
        siblings.add(0, index);
    }

    /**
     * Append a track to a playlist. No check is made for duplicates; the caller decides whether a track belongs.
     *
     * @param playlist the index of the playlist
     * @param trackId the identifier of the track
     *
     * @throws IllegalArgumentException if the node is a folder
     */
    @API(status = API.Status.STABLE)
    public void addTrack(int playlist, String trackId) {
        final Node target = node(playlist);
        if (target.trackIds == null) {
            throw new IllegalArgumentException("Node " + playlist + " (" + target.name + ") is not a playlist");
        }
        target.trackIds.add(trackId);
    }

    /**
     * Get the name of a node.
     *
     * @param index the node index
     *
     * @return its name
     */
    @API(status = API.Status.STABLE)
    public String getName(int index) {
        return node(index).name;
    }

    /**
     * Check whether a node is a folder.
     *
     * @param index the node index
     *
     * @return {@code true} for folders, {@code false} for playlists
     */
    @API(status = API.Status.STABLE)
    public boolean isFolder(int index) {
        return node(index).children != null;
    }

    /**
     * Get the folder containing a node.
     *
     * @param index the node index
     *
     * @return the index of its folder, or {@link #NO_NODE} for the root
     */
    @API(status = API.Status.STABLE)
    public int getParent(int index) {
        return node(index).parent;
    }

    /**
     * Get the children of a folder.
     *
     * @param index the node index
     *
     * @return an unmodifiable view of the child indices, in display order; empty for playlists
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getChildren(int index) {
        final Node target = node(index);
        if (target.children == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(target.children);
    }

    /**
     * Get the tracks of a playlist.
     *
     * @param index the node index
     *
     * @return an unmodifiable view of the track identifiers, in insertion order; empty for folders
     */
    @API(status = API.Status.STABLE)
    public List<String> getTrackIds(int index) {
        final Node target = node(index);
        if (target.trackIds == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(target.trackIds);
    }

    /**
     * Find a direct child of a folder by name.
     *
     * @param folder the index of the folder to search
     * @param name the name sought
     *
     * @return the index of the first child with that name, or {@link #NO_NODE}
     */
    @API(status = API.Status.STABLE)
    public int findChild(int folder, String name) {
        for (int child : getChildren(folder)) {
            if (nodes.get(child).name.equals(name)) {
                return child;
            }
        }
        return NO_NODE;
    }

    /**
     * Find a node anywhere below a starting point by exact name, searching in display order with folders
     * visited before their contents. The starting node itself is not considered.
     *
     * @param start the index of the folder to search within
     * @param name the name sought
     *
     * @return the index of the first matching node, or {@link #NO_NODE}
     */
    @API(status = API.Status.STABLE)
    public int findByName(int start, String name) {
        for (int child : getChildren(start)) {
            if (nodes.get(child).name.equals(name)) {
                return child;
            }
            final int found = findByName(child, name);
            if (found != NO_NODE) {
                return found;
            }
        }
        return NO_NODE;
    }

    /**
     * Find a node anywhere in the tree by exact name.
     *
     * @param name the name sought
     *
     * @return the index of the first matching node in display order, or {@link #NO_NODE}
     */
    @API(status = API.Status.STABLE)
    public int findByName(String name) {
        return findByName(ROOT, name);
    }

    /**
     * Gather every playlist below a starting point, in display order.
     *
     * @param start the index of the node to search within; if it is itself a playlist it is the only result
     *
     * @return the indices of the playlists found
     */
    @API(status = API.Status.STABLE)
    public List<Integer> getPlaylists(int start) {
        final List<Integer> result = new ArrayList<>();
        collectPlaylists(start, result);
        return result;
    }

    /**
     * Recursive helper for {@link #getPlaylists(int)}.
     *
     * @param index the node being visited
     * @param result accumulates the playlists found
     */
    private void collectPlaylists(int index, List<Integer> result) {
        final Node target = node(index);
        if (target.children == null) {
            result.add(index);
            return;
        }
        for (int child : target.children) {
            collectPlaylists(child, result);
        }
    }

    /**
     * Get the number of nodes in the tree, including the root.
     *
     * @return the node count
     */
    @API(status = API.Status.STABLE)
    public int size() {
        return nodes.size();
    }

    /**
     * Render the structure below a node as indented text, one node per line, with the track count of each
     * playlist. Useful for logging and diagnostics.
     *
     * @param start the node to describe
     *
     * @return the description
     */
    @API(status = API.Status.STABLE)
    public String describe(int start) {
        final StringBuilder sb = new StringBuilder();
        describe(start, 0, sb);
        return sb.toString();
    }

    /**
     * Recursive helper for {@link #describe(int)}.
     *
     * @param index the node being described
     * @param depth how far to indent it
     * @param sb accumulates the description
     */
    private void describe(int index, int depth, StringBuilder sb) {
        final Node target = node(index);
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        if (target.children != null) {
            sb.append(target.name).append("/\n");
            for (int child : target.children) {
                describe(child, depth + 1, sb);
            }
        } else {
            sb.append(target.name).append(" (").append(target.trackIds.size()).append(")\n");
        }
    }

    @Override
    public String toString() {
        return "PlaylistTree[root:" + nodes.get(ROOT).name + ", nodes:" + nodes.size() + "]";
    }
}
