package org.replikativ.persistent_weighted_tree;

import clojure.lang.*;

/**
 * Salted {@code hasheq}: Clojure's value hash (equal for {@code Util.equiv}
 * values, e.g. 1 and 1N) re-mixed with a per-collection-kind salt.
 */
public class HasheqHasher implements IHasher<Object> {
  public final int _salt;

  public HasheqHasher(int salt) {
    _salt = salt;
  }

  public int hash(Object key) {
    return Murmur3.hashInt(Util.hasheq(key) ^ _salt);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HasheqHasher && ((HasheqHasher) o)._salt == _salt;
  }

  @Override
  public int hashCode() {
    return _salt;
  }

  @Override
  public String toString() {
    return "HasheqHasher[salt=0x" + Integer.toHexString(_salt) + "]";
  }
}
