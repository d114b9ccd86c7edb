package org.replikativ.persistent_weighted_tree;

import java.util.*;

/**
 * Product of independent measures, fixed when a configuration is built.
 *
 * A node's measure is an {@code Object[]} tuple with one slot per component,
 * merged componentwise. The product is itself an {@link IMeasure}, so it
 * satisfies the same monoid laws as its components.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public final class Measures<Key> implements IMeasure<Key, Object[]> {

  private static final Object[] EMPTY = new Object[0];

  public final IMeasure[] _measures;
  private final Object[] _identity;

  public Measures(IMeasure... measures) {
    for (int i = 0; i < measures.length; ++i) {
      Objects.requireNonNull(measures[i], "measure");
      for (int j = 0; j < i; ++j) {
        if (measures[i].equals(measures[j]))
          throw new IllegalArgumentException("Duplicate measure: " + measures[i].getClass().getSimpleName());
      }
    }
    _measures = measures.clone();
    _identity = new Object[measures.length];
    for (int i = 0; i < measures.length; ++i)
      _identity[i] = measures[i].identity();
  }

  public int size() {
    return _measures.length;
  }

  /**
   * Index of the first component whose class is exactly {@code cls}, -1 if none.
   * Exact, so that looking up CheckSumOps does not find KeySumOps.
   */
  public int indexOf(Class<? extends IMeasure> cls) {
    for (int i = 0; i < _measures.length; ++i) {
      if (_measures[i].getClass() == cls) return i;
    }
    return -1;
  }

  public int indexOf(IMeasure measure) {
    for (int i = 0; i < _measures.length; ++i) {
      if (_measures[i].equals(measure)) return i;
    }
    return -1;
  }

  @Override
  public Object[] identity() {
    return _identity.length == 0 ? EMPTY : _identity.clone();
  }

  @Override
  public Object[] extract(Key key) {
    if (_measures.length == 0) return EMPTY;
    Object[] res = new Object[_measures.length];
    for (int i = 0; i < _measures.length; ++i)
      res[i] = _measures[i].extract(key);
    return res;
  }

  @Override
  public Object[] merge(Object[] m1, Object[] m2) {
    if (_measures.length == 0) return EMPTY;
    Object[] res = new Object[_measures.length];
    for (int i = 0; i < _measures.length; ++i)
      res[i] = _measures[i].merge(m1[i], m2[i]);
    return res;
  }

  /**
   * Measure of a node: {@code merge(merge(left, extract(key)), right)}.
   * Null {@code left} or {@code right} stands for an empty subtree.
   */
  public Object[] node(Object[] left, Key key, Object[] right) {
    if (_measures.length == 0) return EMPTY;
    Object[] res = new Object[_measures.length];
    for (int i = 0; i < _measures.length; ++i) {
      IMeasure m = _measures[i];
      Object acc = m.extract(key);
      if (left != null) acc = m.merge(left[i], acc);
      if (right != null) acc = m.merge(acc, right[i]);
      res[i] = acc;
    }
    return res;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Measures)) return false;
    return Arrays.equals(_measures, ((Measures) o)._measures);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(_measures);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Measures[");
    for (int i = 0; i < _measures.length; ++i) {
      if (i > 0) sb.append(", ");
      sb.append(_measures[i].getClass().getSimpleName());
    }
    return sb.append("]").toString();
  }
}
