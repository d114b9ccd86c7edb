package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;

/**
 * An owning handle on a tree root. Each {@code Tree} holds one reference to
 * its root; every operation returns a new {@code Tree} holding its own
 * reference, and leaves this one untouched. {@link #close()} gives the
 * reference back to the stash.
 *
 * Trees combined by set operations must have compatible settings. When they
 * live in different stashes, the argument is imported first.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class Tree<Key> implements Iterable<Key>, AutoCloseable {
  final Treap<Key> _treap;
  // Nullable, null == empty
  Location _root;
  volatile boolean _closed;

  Tree(Treap<Key> treap, Location root) {
    _treap = treap;
    _root  = root;
  }

  public static <Key> Tree<Key> empty(Settings settings) {
    return new Tree<Key>(new Treap<Key>(settings.<Key>newStash(), settings), null);
  }

  public static <Key> Tree<Key> empty(IStash<Key> stash, Settings settings) {
    return new Tree<Key>(new Treap<Key>(stash, settings), null);
  }

  public static <Key> Tree<Key> from(Settings settings, Iterable<? extends Key> elements) {
    Tree<Key> tree = empty(settings);
    return tree.insertAll(elements);
  }

  // Empty tree sharing this one's stash and settings
  public Tree<Key> empty() {
    ensureOpen();
    return new Tree<Key>(_treap, null);
  }

  public Settings settings() {
    return _treap._settings;
  }

  public IStash<Key> stash() {
    return _treap._stash;
  }

  public Location root() {
    ensureOpen();
    return _root;
  }

  public boolean isClosed() {
    return _closed;
  }

  void ensureOpen() {
    if (_closed) throw new IllegalStateException("Tree is closed");
  }

  void ensureSorted() {
    if (_treap._settings.positional())
      throw new UnsupportedOperationException("Keyed operation on a positional tree");
  }

  Tree<Key> derive(Location root) {
    return new Tree<Key>(_treap, root);
  }

  // Owned location of other's root, valid in this tree's stash
  Location adopt(Tree<Key> other) {
    ensureOpen();
    other.ensureOpen();
    if (!_treap._settings.compatible(other._treap._settings))
      throw new IllegalArgumentException("Incompatible tree settings");
    if (other._treap._stash == _treap._stash)
      return _treap.share(other._root);
    return _treap.copy(other._treap._stash, other._root);
  }

  // Keyed

  public Tree<Key> insert(Key element) {
    return insert(element, _treap._settings._onDuplicate);
  }

  public Tree<Key> insert(Key element, OnDuplicate policy) {
    ensureOpen();
    ensureSorted();
    Objects.requireNonNull(element, "element");
    return derive(_treap.insert(_root, element, policy));
  }

  // Consumes this tree
  Tree<Key> insertAll(Iterable<? extends Key> elements) {
    Tree<Key> tree = this;
    try {
      for (Key element: elements) {
        Tree<Key> next = tree.insert(element);
        tree.close();
        tree = next;
      }
    } catch (RuntimeException e) {
      tree.close();
      throw e;
    }
    return tree;
  }

  public Tree<Key> remove(Object key) {
    ensureOpen();
    ensureSorted();
    return derive(_treap.remove(_root, key));
  }

  public boolean contains(Object key) {
    return lookup(key) != null;
  }

  /**
   * The stored element with the given sort key, or null.
   */
  public Key lookup(Object key) {
    ensureOpen();
    ensureSorted();
    return _treap.lookup(_root, key);
  }

  /**
   * Elements before and after {@code key}. An element with that key
   * goes to neither side.
   */
  public Tree<Key>[] split(Object key) {
    ensureOpen();
    ensureSorted();
    Treap.Split s = _treap.split(_root, key);
    return new Tree[] { derive(s._left), derive(s._right) };
  }

  /**
   * Concatenation. For sorted trees every element of this tree must come
   * before every element of {@code right}.
   */
  public Tree<Key> join(Tree<Key> right) {
    Location other = adopt(right);
    try {
      if (!_treap._settings.positional() && _root != null && other != null
          && _treap._settings.compare(_treap.last(_root), _treap.first(other)) >= 0)
        throw new IllegalArgumentException("Trees overlap, join needs every left element before every right one");
      return derive(_treap.join(_root, other));
    } finally {
      _treap.drop(other);
    }
  }

  public Tree<Key> union(Tree<Key> other) {
    return union(other, _treap._settings._onDuplicate);
  }

  /**
   * Elements of both trees; for keys in both, {@code policy} decides with
   * this tree's element as the existing one.
   */
  public Tree<Key> union(Tree<Key> other, OnDuplicate policy) {
    ensureSorted();
    Location b = adopt(other);
    try {
      return derive(_treap.union(_root, b, policy));
    } finally {
      _treap.drop(b);
    }
  }

  public Tree<Key> intersect(Tree<Key> other) {
    return intersect(other, OnDuplicate.KEEP);
  }

  public Tree<Key> intersect(Tree<Key> other, OnDuplicate policy) {
    ensureSorted();
    Location b = adopt(other);
    try {
      return derive(_treap.intersect(_root, b, policy));
    } finally {
      _treap.drop(b);
    }
  }

  public Tree<Key> difference(Tree<Key> other) {
    ensureSorted();
    Location b = adopt(other);
    try {
      return derive(_treap.difference(_root, b));
    } finally {
      _treap.drop(b);
    }
  }

  // Positional, also valid on sorted trees where it only reads

  public long size() {
    ensureOpen();
    return _treap.size(_root);
  }

  public boolean isEmpty() {
    ensureOpen();
    return _root == null;
  }

  public Key nth(long index) {
    ensureOpen();
    if (index < 0 || index >= size())
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
    return _treap.nth(_root, index);
  }

  public Key first() {
    ensureOpen();
    return _treap.first(_root);
  }

  public Key last() {
    ensureOpen();
    return _treap.last(_root);
  }

  public Tree<Key>[] splitAt(long index) {
    ensureOpen();
    if (index < 0 || index > size())
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
    Treap.Split s = _treap.splitAt(_root, index);
    return new Tree[] { derive(s._left), derive(s._right) };
  }

  public Tree<Key> insertAt(long index, Key element) {
    ensureOpen();
    ensurePositional();
    if (index < 0 || index > size())
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
    return derive(_treap.insertAt(_root, index, element));
  }

  public Tree<Key> removeAt(long index) {
    ensureOpen();
    ensurePositional();
    if (index < 0 || index >= size())
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
    return derive(_treap.removeAt(_root, index));
  }

  public Tree<Key> assocAt(long index, Key element) {
    ensureOpen();
    ensurePositional();
    if (index < 0 || index >= size())
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
    return derive(_treap.assocAt(_root, index, element));
  }

  public Tree<Key> push(Key element) {
    return insertAt(size(), element);
  }

  public Tree<Key> concat(Tree<Key> right) {
    ensurePositional();
    return join(right);
  }

  void ensurePositional() {
    if (!_treap._settings.positional())
      throw new UnsupportedOperationException("Positional update on a sorted tree");
  }

  // Measures

  Object measureAt(int index) {
    ensureOpen();
    if (_root == null) return _treap._settings._measures._measures[index].identity();
    return _treap.node(_root)._measure[index];
  }

  /**
   * Aggregate of {@code measure} over the whole tree, the measure's identity
   * when empty. The measure must be one the settings maintain.
   */
  public <M> M measure(IMeasure<?, M> measure) {
    int index = _treap._settings._measures.indexOf(measure);
    if (index < 0) throw new IllegalArgumentException("Measure not maintained: " + measure);
    return (M) measureAt(index);
  }

  public <M> M measure(Class<? extends IMeasure> cls) {
    int index = _treap._settings._measures.indexOf(cls);
    if (index < 0) throw new IllegalArgumentException("Measure not maintained: " + cls.getSimpleName());
    return (M) measureAt(index);
  }

  public Digest checksum() {
    int index = _treap._settings._checksum;
    if (index < 0) throw new IllegalStateException("Settings maintain no CheckSumOps");
    return (Digest) measureAt(index);
  }

  // Iteration

  public Seq seq() {
    ensureOpen();
    return Seq.create(_treap._stash, _root, true);
  }

  public Seq rseq() {
    ensureOpen();
    return Seq.create(_treap._stash, _root, false);
  }

  public Iterator<Key> iterator() {
    return new JavaIter(seq());
  }

  public boolean verify() {
    ensureOpen();
    if (!_treap.verify(_root)) return false;
    if (_treap._settings.positional()) return true;
    Key prev = null;
    for (Key element: this) {
      if (prev != null && _treap._settings.compare(prev, element) >= 0) return false;
      prev = element;
    }
    return true;
  }

  // Lifecycle

  /**
   * Another handle on the same root, closed independently.
   */
  @Override
  public Tree<Key> clone() {
    ensureOpen();
    return derive(_treap.share(_root));
  }

  @Override
  public void close() {
    Location root;
    synchronized (this) {
      if (_closed) return;
      _closed = true;
      root = _root;
      _root = null;
    }
    _treap.drop(root);
  }

  /**
   * Trees are equal when they hold equal elements. With a checksum measure
   * this compares root digests and does not walk either tree.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Tree)) return false;
    Tree<Key> that = (Tree<Key>) o;
    ensureOpen();
    that.ensureOpen();
    if (!_treap._settings.compatible(that._treap._settings)) return false;
    if (_treap._stash == that._treap._stash && _root == that._root) return true;
    if (size() != that.size()) return false;
    int checksum = _treap._settings._checksum;
    if (checksum >= 0)
      return measureAt(checksum).equals(that.measureAt(checksum));
    Iterator<Key> a = iterator();
    Iterator<Key> b = that.iterator();
    while (a.hasNext()) {
      if (!Util.equiv(a.next(), b.next())) return false;
    }
    return true;
  }

  @Override
  public int hashCode() {
    ensureOpen();
    int checksum = _treap._settings._checksum;
    if (checksum >= 0) return measureAt(checksum).hashCode();
    return Murmur3.hashOrdered(this);
  }

  @Override
  public String toString() {
    if (_closed) return "#tree[closed]";
    StringBuilder sb = new StringBuilder("#tree[");
    for (Object o: this) {
      sb.append(o).append(" ");
    }
    if (sb.charAt(sb.length() - 1) == ' ') {
      sb.delete(sb.length() - 1, sb.length());
    }
    sb.append("]");
    return sb.toString();
  }
}
