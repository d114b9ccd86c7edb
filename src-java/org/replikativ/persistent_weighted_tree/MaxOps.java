package org.replikativ.persistent_weighted_tree;

import java.util.*;

/**
 * IMeasure tracking the greatest element of a subtree under a comparator.
 *
 * Identity is {@code null}; an empty subtree has no maximum.
 */
public class MaxOps<Key> implements IMeasure<Key, Key> {

    public final Comparator<? super Key> _cmp;

    public MaxOps(Comparator<? super Key> cmp) {
        _cmp = Objects.requireNonNull(cmp, "cmp");
    }

    @Override
    public Key identity() {
        return null;
    }

    @Override
    public Key extract(Key key) {
        return key;
    }

    @Override
    public Key merge(Key m1, Key m2) {
        if (m1 == null) return m2;
        if (m2 == null) return m1;
        return _cmp.compare(m1, m2) >= 0 ? m1 : m2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaxOps)) return false;
        return _cmp.equals(((MaxOps<?>) o)._cmp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MaxOps.class, _cmp);
    }
}
