package org.replikativ.persistent_weighted_tree;

import java.util.*;

/**
 * IMeasure maintaining an order-sensitive {@link Digest} of whole elements.
 *
 * Two trees of the same configuration hold the same sequence of elements
 * iff their digests are equal, up to hash collisions. Since the tree shape is
 * a function of content alone, comparing root digests is an O(1) equality test.
 *
 * @param <Key> the element type
 */
public class CheckSumOps<Key> implements IMeasure<Key, Digest> {

    public final IHasher<Object> _hasher;

    public CheckSumOps(IHasher<Object> hasher) {
        _hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public Digest identity() {
        return Digest.IDENTITY;
    }

    @Override
    public Digest extract(Key key) {
        return Digest.of(_hasher.hash(key));
    }

    @Override
    public Digest merge(Digest d1, Digest d2) {
        return d1.merge(d2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return _hasher.equals(((CheckSumOps<?>) o)._hasher);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), _hasher);
    }
}
