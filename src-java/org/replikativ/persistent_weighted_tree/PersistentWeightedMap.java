package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;

/**
 * Sorted map over a {@link Tree} of {@link MapEntry}s, ordered and weighted
 * by key. {@link #assoc} follows the settings' {@link OnDuplicate} policy,
 * {@code REPLACE} unless configured otherwise.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class PersistentWeightedMap<K, V> implements IPersistentMap, Reversible, IHashEq, AutoCloseable {
  final Tree<Map.Entry<K, V>> _tree;
  int _hasheq;

  public PersistentWeightedMap() {
    this(Settings.forMap());
  }

  public PersistentWeightedMap(Comparator keyCmp) {
    this(Settings.forMap(keyCmp));
  }

  public PersistentWeightedMap(Settings settings) {
    this(Tree.<Map.Entry<K, V>>empty(settings));
  }

  public PersistentWeightedMap(Tree<Map.Entry<K, V>> tree) {
    if (tree.settings().positional())
      throw new IllegalArgumentException("Map needs sorted settings");
    _tree = tree;
  }

  public static <K, V> PersistentWeightedMap<K, V> from(Map<? extends K, ? extends V> map) {
    List<Map.Entry<K, V>> entries = new ArrayList<>(map.size());
    for (Map.Entry<? extends K, ? extends V> e: map.entrySet()) {
      entries.add(MapEntry.create(e.getKey(), e.getValue()));
    }
    return new PersistentWeightedMap<K, V>(Tree.<Map.Entry<K, V>>from(Settings.forMap(), entries));
  }

  PersistentWeightedMap<K, V> wrap(Tree<Map.Entry<K, V>> tree) {
    return new PersistentWeightedMap<K, V>(tree);
  }

  public Tree<Map.Entry<K, V>> tree() {
    return _tree;
  }

  // Counted
  public int count() {
    return (int) _tree.size();
  }

  // IPersistentMap
  public PersistentWeightedMap<K, V> assoc(Object key, Object val) {
    return wrap(_tree.insert(MapEntry.create(key, val)));
  }

  public PersistentWeightedMap<K, V> assocEx(Object key, Object val) {
    if (containsKey(key)) throw new DuplicateKeyException(key);
    return wrap(_tree.insert(MapEntry.create(key, val), OnDuplicate.THROW));
  }

  public PersistentWeightedMap<K, V> without(Object key) {
    return wrap(_tree.remove(key));
  }

  // IPersistentCollection
  public PersistentWeightedMap<K, V> cons(Object o) {
    if (o instanceof Map.Entry) {
      Map.Entry e = (Map.Entry) o;
      return assoc(e.getKey(), e.getValue());
    }
    if (o instanceof IPersistentVector) {
      IPersistentVector v = (IPersistentVector) o;
      if (v.count() != 2)
        throw new IllegalArgumentException("Vector arg to map conj must be a pair");
      return assoc(v.nth(0), v.nth(1));
    }
    throw new IllegalArgumentException("Can't conj " + (o == null ? "nil" : o.getClass().getName()) + " onto a map");
  }

  public PersistentWeightedMap<K, V> empty() {
    return wrap(_tree.empty());
  }

  public boolean equiv(Object o) {
    if (this == o) return true;
    if (o instanceof PersistentWeightedMap) {
      Tree other = ((PersistentWeightedMap) o)._tree;
      if (_tree.settings().compatible(other.settings()))
        return _tree.equals(other);
    }
    if (!(o instanceof Map)) return false;
    Map map = (Map) o;
    if (map.size() != count()) return false;
    for (Object o2: map.entrySet()) {
      Map.Entry e = (Map.Entry) o2;
      Map.Entry found = _tree.lookup(e.getKey());
      if (found == null || !Util.equiv(found.getValue(), e.getValue())) return false;
    }
    return true;
  }

  // Associative
  public boolean containsKey(Object key) {
    return _tree.contains(key);
  }

  public IMapEntry entryAt(Object key) {
    Map.Entry<K, V> e = _tree.lookup(key);
    if (e == null || e instanceof IMapEntry) return (IMapEntry) e;
    return MapEntry.create(e.getKey(), e.getValue());
  }

  // ILookup
  public Object valAt(Object key) {
    return valAt(key, null);
  }

  public Object valAt(Object key, Object notFound) {
    Map.Entry<K, V> e = _tree.lookup(key);
    return e == null ? notFound : e.getValue();
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
    if (_hasheq == 0) _hasheq = Murmur3.hashUnordered(this);
    return _hasheq;
  }

  /**
   * Entries of both maps, {@code other}'s value winning for keys in both.
   */
  public PersistentWeightedMap<K, V> merge(PersistentWeightedMap<K, V> other) {
    return wrap(_tree.union(other._tree, OnDuplicate.REPLACE));
  }

  /**
   * Replaces the value at {@code key} with {@code f} applied to it. Without
   * that key, returns another handle on the same map.
   */
  public PersistentWeightedMap<K, V> update(Object key, IFn f) {
    Map.Entry<K, V> e = _tree.lookup(key);
    if (e == null) return share();
    return wrap(_tree.insert(MapEntry.create(e.getKey(), f.invoke(e.getValue())), OnDuplicate.REPLACE));
  }

  public PersistentWeightedMap<K, V> selectKeys(PersistentWeightedMap<K, ?> other) {
    return wrap(_tree.intersect((Tree) other._tree, OnDuplicate.KEEP));
  }

  public PersistentWeightedMap<K, V> removeKeys(PersistentWeightedMap<K, ?> other) {
    return wrap(_tree.difference((Tree) other._tree));
  }

  /**
   * Same key set, by digest. Values are not compared.
   */
  public boolean keysEqual(PersistentWeightedMap<K, ?> other) {
    return count() == other.count()
      && Objects.equals(_tree.measure(KeySumOps.class), other._tree.measure(KeySumOps.class));
  }

  /**
   * Same values in the same key order, by digest. Keys are not compared.
   */
  public boolean valuesEqual(PersistentWeightedMap<?, V> other) {
    return count() == other.count()
      && Objects.equals(_tree.measure(ValSumOps.class), other._tree.measure(ValSumOps.class));
  }

  public Digest checksum() {
    return _tree.checksum();
  }

  public Map.Entry<K, V> nth(long index) {
    return _tree.nth(index);
  }

  public PersistentWeightedMap<K, V> share() {
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
    for (Map.Entry<K, V> e: _tree) {
      hash += (e.getKey() == null ? 0 : e.getKey().hashCode())
            ^ (e.getValue() == null ? 0 : e.getValue().hashCode());
    }
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<K, V> e: _tree) {
      if (sb.length() > 1) sb.append(", ");
      sb.append(e.getKey()).append(" ").append(e.getValue());
    }
    return sb.append("}").toString();
  }
}
