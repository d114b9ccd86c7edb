package org.replikativ.persistent_weighted_tree;

import java.util.*;

/**
 * CheckSum over the values of map entries alone, in key order.
 */
public class ValSumOps<Key> extends CheckSumOps<Key> {

    public ValSumOps(IHasher<Object> hasher) {
        super(hasher);
    }

    @Override
    public Digest extract(Key entry) {
        return Digest.of(_hasher.hash(((Map.Entry<?, ?>) entry).getValue()));
    }
}
