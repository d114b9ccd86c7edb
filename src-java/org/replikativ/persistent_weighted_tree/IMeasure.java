package org.replikativ.persistent_weighted_tree;

/**
 * Interface for computing and maintaining measures over tree nodes.
 * Measures form a monoid with identity and associative merge operation.
 *
 * Every node caches the measure of its whole subtree:
 * {@code merge(merge(left, extract(pivot)), right)}. The tree recomputes it
 * for every node it allocates, so only the path touched by a change is
 * recomputed and shared subtrees keep their cached value.
 *
 * @param <Key> the type of elements in the tree
 * @param <M> the type of measure object
 */
public interface IMeasure<Key, M> {

    /**
     * Returns the identity (empty) measure.
     * This is the monoid identity element, the measure of an empty subtree.
     */
    M identity();

    /**
     * Extract measure from a single element.
     * For a node with no children, this gives the measure for that node.
     */
    M extract(Key key);

    /**
     * Merge two measure objects, {@code m1} covering elements that come
     * before the ones covered by {@code m2} in traversal order.
     * This operation must be associative: merge(a, merge(b, c)) == merge(merge(a, b), c)
     * It need not be commutative.
     */
    M merge(M m1, M m2);
}
