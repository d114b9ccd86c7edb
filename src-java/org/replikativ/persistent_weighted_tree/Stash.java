package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Arena of nodes addressed by slot, with a reference count per slot.
 *
 * Not thread-safe: use one stash per tree lineage, or
 * {@link SynchronizedStash} when trees sharing it are cloned and closed
 * from several threads.
 */
@SuppressWarnings("unchecked")
public class Stash<Key> implements IStash<Key> {
  private static final Logger logger = LogManager.getLogger(Stash.class);

  private static final int INITIAL_CAPACITY = 64;

  // Only valid [0 ... _top-1]; null == free slot
  Node<Key>[] _nodes;
  Location[]  _locations;
  int[]       _refs;

  // Freed slots, reused before growing
  int[] _free;
  int   _freeLen;

  // First never-used slot
  int   _top;

  int   _live;
  long  _allocations;

  // Nullable, null == no interning
  final Map<Shape, Location> _interned;

  public Stash() {
    this(false);
  }

  public Stash(boolean intern) {
    _nodes     = (Node<Key>[]) new Node[INITIAL_CAPACITY];
    _locations = new Location[INITIAL_CAPACITY];
    _refs      = new int[INITIAL_CAPACITY];
    _free      = new int[16];
    _interned  = intern ? new HashMap<>() : null;
    logger.debug("Created {} (intern={})", getClass().getSimpleName(), intern);
  }

  public boolean interning() {
    return _interned != null;
  }

  @Override
  public Location allocate(Key key, int level, Location left, Location right, Object[] measure) {
    if (left != null) check(left);
    if (right != null) check(right);

    Shape shape = null;
    if (_interned != null) {
      shape = new Shape(key, level, left, right);
      Location existing = _interned.get(shape);
      if (existing != null) {
        _refs[existing._slot] += 1;
        // the existing node already holds its own references to these children
        if (left != null) release(left);
        if (right != null) release(right);
        return existing;
      }
    }

    int slot;
    if (_freeLen > 0) {
      slot = _free[--_freeLen];
    } else {
      slot = _top++;
      if (slot == _nodes.length) grow();
    }

    Location location = new Location(this, slot);
    _nodes[slot]     = new Node<>(key, level, left, right, measure);
    _locations[slot] = location;
    _refs[slot]      = 1;
    _live           += 1;
    _allocations    += 1;

    if (shape != null) _interned.put(shape, location);
    return location;
  }

  @Override
  public Node<Key> get(Location location) {
    check(location);
    return _nodes[location._slot];
  }

  @Override
  public void retain(Location location) {
    check(location);
    _refs[location._slot] += 1;
  }

  @Override
  public void release(Location location) {
    ArrayDeque<Location> pending = new ArrayDeque<>();
    pending.push(location);
    int freed = 0;

    while (!pending.isEmpty()) {
      Location loc = pending.pop();
      check(loc);
      int slot = loc._slot;
      int refs = _refs[slot] - 1;
      if (refs < 0)
        throw new IllegalStateException("Reference count underflow at " + loc);
      _refs[slot] = refs;
      if (refs > 0) continue;

      Node<Key> node = _nodes[slot];
      if (_interned != null) _interned.remove(new Shape(node._key, node._level, node._left, node._right), loc);
      _nodes[slot]     = null;
      _locations[slot] = null;
      pushFree(slot);
      _live -= 1;
      freed += 1;

      if (node._left != null) pending.push(node._left);
      if (node._right != null) pending.push(node._right);
    }

    if (freed > 0 && logger.isTraceEnabled())
      logger.trace("Freed {} nodes, {} live", freed, _live);
  }

  @Override
  public int refCount(Location location) {
    check(location);
    return _refs[location._slot];
  }

  @Override
  public int live() {
    return _live;
  }

  @Override
  public long allocations() {
    return _allocations;
  }

  void check(Location location) {
    if (location._stash != this)
      throw new IllegalStateException(location + " is not owned by this stash");
    if (location._slot >= _top || _locations[location._slot] != location)
      throw new IllegalStateException(location + " was already freed");
  }

  private void grow() {
    int len = _nodes.length << 1;
    _nodes     = Arrays.copyOf(_nodes, len);
    _locations = Arrays.copyOf(_locations, len);
    _refs      = Arrays.copyOf(_refs, len);
  }

  private void pushFree(int slot) {
    if (_freeLen == _free.length)
      _free = Arrays.copyOf(_free, _freeLen << 1);
    _free[_freeLen++] = slot;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[live=" + _live + ", slots=" + _top + "]";
  }

  /**
   * Interning key: same element (by value), same level, same child locations.
   */
  static final class Shape {
    final Object   _key;
    final int      _level;
    final Location _left;
    final Location _right;
    final int      _hash;

    Shape(Object key, int level, Location left, Location right) {
      _key   = key;
      _level = level;
      _left  = left;
      _right = right;
      int h = Util.hasheq(key);
      h = 31 * h + level;
      h = 31 * h + System.identityHashCode(left);
      h = 31 * h + System.identityHashCode(right);
      _hash = h;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Shape)) return false;
      Shape that = (Shape) o;
      return _hash == that._hash
        && _level == that._level
        && _left == that._left
        && _right == that._right
        && Util.equiv(_key, that._key);
    }

    @Override
    public int hashCode() {
      return _hash;
    }
  }
}
