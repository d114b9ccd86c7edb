package org.replikativ.persistent_weighted_tree;

import java.util.*;

/**
 * CheckSum over the keys of map entries alone.
 * Two maps with equal key digests hold the same key set, whatever their values.
 */
public class KeySumOps<Key> extends CheckSumOps<Key> {

    public KeySumOps(IHasher<Object> hasher) {
        super(hasher);
    }

    @Override
    public Digest extract(Key entry) {
        return Digest.of(_hasher.hash(((Map.Entry<?, ?>) entry).getKey()));
    }
}
