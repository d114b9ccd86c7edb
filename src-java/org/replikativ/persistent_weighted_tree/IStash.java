package org.replikativ.persistent_weighted_tree;

/**
 * Reference-counted store owning the nodes of one or more trees.
 *
 * Nodes are addressed only through {@link Location} handles handed out by
 * the same stash. Passing a location to a stash that did not allocate it,
 * or one whose node was already freed, is a programming error and fails
 * with {@link IllegalStateException}.
 */
public interface IStash<Key> {
    /**
     * Store a new node with reference count 1 and return its handle.
     *
     * The node takes over one reference to each non-null child: the caller
     * must not release {@code left} or {@code right} on its own afterwards.
     * A stash that interns nodes may return an existing location (retained)
     * for a structurally identical node.
     */
    Location allocate(Key key, int level, Location left, Location right, Object[] measure);

    /**
     * Read-only dereference.
     */
    Node<Key> get(Location location);

    void retain(Location location);

    /**
     * Drop one reference. When the count reaches zero the slot is freed and
     * the node's references to its children are released in turn.
     */
    void release(Location location);

    /**
     * Current reference count of a live location.
     */
    int refCount(Location location);

    /**
     * Number of live nodes.
     */
    int live();

    /**
     * Number of nodes ever stored, not counting allocations answered by interning.
     */
    long allocations();
}
