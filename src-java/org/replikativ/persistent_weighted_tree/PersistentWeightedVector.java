package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;

/**
 * Positional tree: elements keep insertion position, lookups go by rank.
 * Shape depends on how a vector was built, equality is a digest comparison.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class PersistentWeightedVector<V> implements IPersistentVector, IHashEq, Iterable, AutoCloseable {
  final Tree<V> _tree;
  int _hasheq;

  public PersistentWeightedVector() {
    this(Settings.forVector());
  }

  public PersistentWeightedVector(Settings settings) {
    this(Tree.<V>empty(settings));
  }

  public PersistentWeightedVector(Tree<V> tree) {
    if (!tree.settings().positional())
      throw new IllegalArgumentException("Vector needs positional settings");
    _tree = tree;
  }

  public static <V> PersistentWeightedVector<V> from(Iterable<? extends V> elements) {
    Tree<V> tree = Tree.empty(Settings.forVector());
    try {
      for (V element: elements) {
        Tree<V> next = tree.push(element);
        tree.close();
        tree = next;
      }
    } catch (RuntimeException e) {
      tree.close();
      throw e;
    }
    return new PersistentWeightedVector<V>(tree);
  }

  PersistentWeightedVector<V> wrap(Tree<V> tree) {
    return new PersistentWeightedVector<V>(tree);
  }

  public Tree<V> tree() {
    return _tree;
  }

  int checkIndex(int i, int bound) {
    if (i < 0 || i >= bound)
      throw new IndexOutOfBoundsException("Index " + i + " out of bounds for length " + count());
    return i;
  }

  // Counted
  public int count() {
    return (int) _tree.size();
  }

  public int length() {
    return count();
  }

  // Indexed
  public Object nth(int i) {
    return _tree.nth(checkIndex(i, count()));
  }

  public Object nth(int i, Object notFound) {
    if (i < 0 || i >= count()) return notFound;
    return _tree.nth(i);
  }

  // IPersistentVector
  public PersistentWeightedVector<V> assocN(int i, Object val) {
    if (i == count()) return cons(val);
    return wrap(_tree.assocAt(checkIndex(i, count()), (V) val));
  }

  public PersistentWeightedVector<V> cons(Object val) {
    return wrap(_tree.push((V) val));
  }

  // IPersistentStack
  public Object peek() {
    return count() == 0 ? null : _tree.last();
  }

  public PersistentWeightedVector<V> pop() {
    int count = count();
    if (count == 0) throw new IllegalStateException("Can't pop empty vector");
    return wrap(_tree.removeAt(count - 1));
  }

  // Associative
  public PersistentWeightedVector<V> assoc(Object key, Object val) {
    if (!Util.isInteger(key)) throw new IllegalArgumentException("Key must be integer");
    return assocN(((Number) key).intValue(), val);
  }

  public boolean containsKey(Object key) {
    if (!Util.isInteger(key)) return false;
    int i = ((Number) key).intValue();
    return i >= 0 && i < count();
  }

  public IMapEntry entryAt(Object key) {
    if (!containsKey(key)) return null;
    int i = ((Number) key).intValue();
    return (IMapEntry) MapEntry.create(i, _tree.nth(i));
  }

  // ILookup
  public Object valAt(Object key) {
    return valAt(key, null);
  }

  public Object valAt(Object key, Object notFound) {
    if (!Util.isInteger(key)) return notFound;
    return nth(((Number) key).intValue(), notFound);
  }

  // IPersistentCollection
  public PersistentWeightedVector<V> empty() {
    return wrap(_tree.empty());
  }

  public boolean equiv(Object o) {
    if (this == o) return true;
    if (o instanceof PersistentWeightedVector) {
      Tree other = ((PersistentWeightedVector) o)._tree;
      if (_tree.settings().compatible(other.settings()))
        return _tree.equals(other);
    }
    if (!(o instanceof List) && !(o instanceof Sequential)) return false;
    Iterator a = iterator();
    for (ISeq s = RT.seq(o); s != null; s = s.next()) {
      if (!a.hasNext() || !Util.equiv(a.next(), s.first())) return false;
    }
    return !a.hasNext();
  }

  // Seqable
  public ISeq seq() {
    return _tree.seq();
  }

  // Reversible
  public ISeq rseq() {
    return _tree.rseq();
  }

  // Iterable
  public Iterator iterator() {
    return _tree.iterator();
  }

  // IHashEq
  public int hasheq() {
    if (_hasheq == 0) _hasheq = Murmur3.hashOrdered(this);
    return _hasheq;
  }

  // Positional edits

  public PersistentWeightedVector<V> insertAt(int i, V val) {
    return wrap(_tree.insertAt(checkIndex(i, count() + 1), val));
  }

  public PersistentWeightedVector<V> removeAt(int i) {
    return wrap(_tree.removeAt(checkIndex(i, count())));
  }

  /**
   * First {@code i} elements, and the rest.
   */
  public PersistentWeightedVector<V>[] splitAt(int i) {
    Tree<V>[] parts = _tree.splitAt(checkIndex(i, count() + 1));
    return new PersistentWeightedVector[] { wrap(parts[0]), wrap(parts[1]) };
  }

  public PersistentWeightedVector<V> concat(PersistentWeightedVector<V> other) {
    return wrap(_tree.concat(other._tree));
  }

  /**
   * The elements of {@code other} inserted before index {@code i}.
   */
  public PersistentWeightedVector<V> splice(int i, PersistentWeightedVector<V> other) {
    Tree<V>[] parts = _tree.splitAt(checkIndex(i, count() + 1));
    Tree<V> head = null;
    try {
      head = parts[0].concat(other._tree);
      return wrap(head.concat(parts[1]));
    } finally {
      if (head != null) head.close();
      parts[0].close();
      parts[1].close();
    }
  }

  /**
   * Replaces the element at {@code i} with {@code f} applied to it.
   */
  public PersistentWeightedVector<V> update(int i, IFn f) {
    Object val = nth(i);
    return wrap(_tree.assocAt(i, (V) f.invoke(val)));
  }

  public Digest checksum() {
    return _tree.checksum();
  }

  public PersistentWeightedVector<V> share() {
    return wrap(_tree.clone());
  }

  // AutoCloseable
  public void close() {
    _tree.close();
  }

  @Override
  public boolean equals(Object o) {
    return equiv(o);
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (Object o: this) {
      hash = 31 * hash + (o == null ? 0 : o.hashCode());
    }
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (Object o: this) {
      if (sb.length() > 1) sb.append(" ");
      sb.append(o);
    }
    return sb.append("]").toString();
  }
}
