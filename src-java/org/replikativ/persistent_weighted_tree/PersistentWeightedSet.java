package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;

/**
 * Sorted set over a {@link Tree}. Every update returns a new set holding
 * its own reference to the shared structure; {@link #close()} releases it.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class PersistentWeightedSet<Key> implements IPersistentSet, Reversible, IReduce, IHashEq, Iterable, AutoCloseable {
  final Tree<Key> _tree;
  int _hasheq;

  public PersistentWeightedSet() {
    this(Settings.forSet());
  }

  public PersistentWeightedSet(Comparator cmp) {
    this(Settings.forSet(cmp));
  }

  public PersistentWeightedSet(Settings settings) {
    this(Tree.<Key>empty(settings));
  }

  public PersistentWeightedSet(Tree<Key> tree) {
    if (tree.settings().positional())
      throw new IllegalArgumentException("Set needs sorted settings");
    _tree = tree;
  }

  public static <Key> PersistentWeightedSet<Key> from(Iterable<? extends Key> elements) {
    return from(Settings.forSet(), elements);
  }

  public static <Key> PersistentWeightedSet<Key> from(Settings settings, Iterable<? extends Key> elements) {
    return new PersistentWeightedSet<Key>(Tree.<Key>from(settings, elements));
  }

  PersistentWeightedSet<Key> wrap(Tree<Key> tree) {
    return new PersistentWeightedSet<Key>(tree);
  }

  public Tree<Key> tree() {
    return _tree;
  }

  // Counted
  public int count() {
    return (int) _tree.size();
  }

  // IPersistentCollection
  public PersistentWeightedSet<Key> cons(Object key) {
    return wrap(_tree.insert((Key) key));
  }

  public PersistentWeightedSet<Key> empty() {
    return wrap(_tree.empty());
  }

  public boolean equiv(Object o) {
    if (this == o) return true;
    if (o instanceof PersistentWeightedSet) {
      Tree other = ((PersistentWeightedSet) o)._tree;
      if (_tree.settings().compatible(other.settings()))
        return _tree.equals(other);
    }
    if (!(o instanceof Set)) return false;
    Set set = (Set) o;
    if (set.size() != count()) return false;
    for (Object key: set) {
      if (!contains(key)) return false;
    }
    return true;
  }

  // IPersistentSet
  public PersistentWeightedSet<Key> disjoin(Object key) {
    return wrap(_tree.remove(key));
  }

  public boolean contains(Object key) {
    return _tree.contains(key);
  }

  public Key get(Object key) {
    return _tree.lookup(key);
  }

  // Seqable
  public ISeq seq() {
    return _tree.seq();
  }

  // Reversible
  public ISeq rseq() {
    return _tree.rseq();
  }

  // IReduce
  public Object reduce(IFn f) {
    Seq seq = _tree.seq();
    return seq == null ? f.invoke() : seq.reduce(f);
  }

  public Object reduce(IFn f, Object start) {
    Seq seq = _tree.seq();
    return seq == null ? start : seq.reduce(f, start);
  }

  // Iterable
  public Iterator iterator() {
    return _tree.iterator();
  }

  // IHashEq
  public int hasheq() {
    if (_hasheq == 0) _hasheq = Murmur3.hashUnordered(this);
    return _hasheq;
  }

  // Set algebra

  public PersistentWeightedSet<Key> union(PersistentWeightedSet<Key> other) {
    return wrap(_tree.union(other._tree));
  }

  public PersistentWeightedSet<Key> intersect(PersistentWeightedSet<Key> other) {
    return wrap(_tree.intersect(other._tree));
  }

  public PersistentWeightedSet<Key> difference(PersistentWeightedSet<Key> other) {
    return wrap(_tree.difference(other._tree));
  }

  /**
   * Elements below and above {@code key}; {@code key} itself is in neither.
   */
  public PersistentWeightedSet<Key>[] split(Object key) {
    Tree<Key>[] parts = _tree.split(key);
    return new PersistentWeightedSet[] { wrap(parts[0]), wrap(parts[1]) };
  }

  public Key nth(long index) {
    return _tree.nth(index);
  }

  public Key first() {
    return _tree.first();
  }

  public Key last() {
    return _tree.last();
  }

  public Digest checksum() {
    return _tree.checksum();
  }

  public PersistentWeightedSet<Key> share() {
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
    int hash = 0;
    for (Object key: this) {
      hash += Util.hash(key);
    }
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("#{");
    for (Object o: this) {
      sb.append(o).append(" ");
    }
    if (sb.charAt(sb.length() - 1) == ' ') {
      sb.delete(sb.length() - 1, sb.length());
    }
    sb.append("}");
    return sb.toString();
  }
}
