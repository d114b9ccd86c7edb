package org.replikativ.persistent_weighted_tree;

import java.util.*;
import java.util.function.*;

/**
 * IMeasure tracking the greatest key of a subtree of keyed elements
 * (map entries). Same as {@link MaxOps} but compares extracted keys only,
 * so two entries with equal keys and different values are interchangeable.
 */
public class KeyOps<Key> implements IMeasure<Key, Object> {

    public final Function<? super Key, Object> _keyFn;
    public final Comparator<Object> _cmp;

    public KeyOps(Function<? super Key, Object> keyFn, Comparator<Object> cmp) {
        _keyFn = Objects.requireNonNull(keyFn, "keyFn");
        _cmp = Objects.requireNonNull(cmp, "cmp");
    }

    @Override
    public Object identity() {
        return null;
    }

    @Override
    public Object extract(Key key) {
        return _keyFn.apply(key);
    }

    @Override
    public Object merge(Object k1, Object k2) {
        if (k1 == null) return k2;
        if (k2 == null) return k1;
        return _cmp.compare(k1, k2) >= 0 ? k1 : k2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyOps)) return false;
        KeyOps<?> that = (KeyOps<?>) o;
        return _keyFn.equals(that._keyFn) && _cmp.equals(that._cmp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(KeyOps.class, _keyFn, _cmp);
    }
}
