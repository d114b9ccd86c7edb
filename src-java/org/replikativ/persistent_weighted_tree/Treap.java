package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Split/join algorithms over stash-backed nodes.
 *
 * The tree is a binary search tree on sort keys (or positions) and a
 * max-heap on {@link Weight#level}. Equal levels are broken in favour of the
 * element that comes first. Because these priorities are a function of the
 * elements alone, a given set of elements has exactly one valid shape,
 * whatever order it was built in. Positional trees draw each node's level
 * at random instead (see {@link Weight#randomLevel}); their shape is kept by
 * split and concat but depends on how the sequence was built.
 *
 * Ownership: every {@code Location} argument is borrowed, the caller keeps
 * its reference. Every {@code Location} returned (also inside {@link Split})
 * is owned by the caller, who must hand it to a tree or release it.
 *
 * The comparator must be a total order consistent across calls. A
 * comparator that is not yields valid but non-canonical trees, which breaks
 * checksum equality; this is a caller error and is not detected here.
 */
@SuppressWarnings("unchecked")
public class Treap<Key> {
  private static final Logger logger = LogManager.getLogger(Treap.class);

  public final IStash<Key> _stash;
  public final Settings _settings;

  public Treap(IStash<Key> stash, Settings settings) {
    _stash    = stash;
    _settings = settings;
  }

  /**
   * Elements before / after the split point. {@code _hit} is set when an
   * element with the split key was present; it is then in {@code _found}
   * and in neither side.
   */
  public static final class Split {
    public Location _left;
    public Location _right;
    public Object   _found;
    public boolean  _hit;
  }

  public Node<Key> node(Location location) {
    return _stash.get(location);
  }

  Location share(Location location) {
    if (location != null) _stash.retain(location);
    return location;
  }

  void drop(Location location) {
    if (location != null) _stash.release(location);
  }

  Object[] measure(Location location) {
    return location == null ? null : _stash.get(location)._measure;
  }

  // takes ownership of left and right
  Location make(Key key, int level, Location left, Location right) {
    Object[] measure = _settings._measures.node(measure(left), key, measure(right));
    return _stash.allocate(key, level, left, right, measure);
  }

  // make(), unless key and both children are those of node n at location, then share it
  Location rebuild(Location location, Node<Key> n, Key key, Location left, Location right) {
    if (key == n._key && left == n._left && right == n._right) {
      drop(left);
      drop(right);
      return share(location);
    }
    return make(key, n._level, left, right);
  }

  // higher level wins, ties go to the element that sorts first
  boolean outranks(Node<Key> a, Node<Key> b) {
    if (a._level != b._level) return a._level > b._level;
    return _settings.compare(a._key, b._key) < 0;
  }

  // keyed trees weigh the sort key, positional trees draw a fresh level per node
  int levelOf(Key element) {
    return _settings.positional() ? Weight.randomLevel() : _settings.level(element);
  }

  Key resolve(Key existing, Key incoming, OnDuplicate policy) {
    if (existing == incoming || Util.equiv(existing, incoming)) return existing;
    switch (policy) {
    case KEEP:
      return existing;
    case REPLACE:
      return incoming;
    default:
      throw new DuplicateKeyException(_settings.sortKey(existing));
    }
  }

  // Inspection

  public long size(Location location) {
    if (location == null) return 0;
    Node<Key> n = node(location);
    if (_settings._cardinality >= 0) return (Long) n._measure[_settings._cardinality];
    return 1 + size(n._left) + size(n._right);
  }

  public Key lookup(Location root, Object key) {
    Location location = root;
    while (location != null) {
      Node<Key> n = node(location);
      int c = _settings.compareKey(key, n._key);
      if (c == 0) return n._key;
      location = c < 0 ? n._left : n._right;
    }
    return null;
  }

  // null if index is out of range
  public Key nth(Location root, long index) {
    Location location = root;
    while (location != null) {
      Node<Key> n = node(location);
      long leftSize = size(n._left);
      if (index < leftSize) {
        location = n._left;
      } else if (index == leftSize) {
        return n._key;
      } else {
        index -= leftSize + 1;
        location = n._right;
      }
    }
    return null;
  }

  public Key first(Location root) {
    if (root == null) return null;
    Node<Key> n = node(root);
    while (n._left != null) n = node(n._left);
    return n._key;
  }

  public Key last(Location root) {
    if (root == null) return null;
    Node<Key> n = node(root);
    while (n._right != null) n = node(n._right);
    return n._key;
  }

  // Split & join

  public Split split(Location location, Object key) {
    if (location == null) return new Split();
    Node<Key> n = node(location);
    int c = _settings.compareKey(key, n._key);

    if (c == 0) {
      Split s = new Split();
      s._left  = share(n._left);
      s._right = share(n._right);
      s._found = n._key;
      s._hit   = true;
      return s;
    }

    if (c < 0) {
      Split s = split(n._left, key);
      s._right = rebuild(location, n, n._key, s._right, share(n._right));
      return s;
    }

    Split s = split(n._right, key);
    s._left = rebuild(location, n, n._key, share(n._left), s._left);
    return s;
  }

  // first `index` elements go left
  public Split splitAt(Location location, long index) {
    Split s;
    if (location == null) return new Split();
    if (index <= 0) {
      s = new Split();
      s._right = share(location);
      return s;
    }
    if (index >= size(location)) {
      s = new Split();
      s._left = share(location);
      return s;
    }

    Node<Key> n = node(location);
    long leftSize = size(n._left);
    if (index <= leftSize) {
      s = splitAt(n._left, index);
      s._right = rebuild(location, n, n._key, s._right, share(n._right));
    } else {
      s = splitAt(n._right, index - leftSize - 1);
      s._left = rebuild(location, n, n._key, share(n._left), s._left);
    }
    return s;
  }

  /**
   * Concatenate: every element of {@code a} comes before every element of {@code b}.
   */
  public Location join(Location a, Location b) {
    if (a == null) return share(b);
    if (b == null) return share(a);
    Node<Key> na = node(a);
    Node<Key> nb = node(b);
    // on equal levels a comes first, so it wins
    if (na._level >= nb._level)
      return make(na._key, na._level, share(na._left), join(na._right, b));
    return make(nb._key, nb._level, join(a, nb._left), share(nb._right));
  }

  /**
   * Concatenate {@code left}, a single element, and {@code right}.
   */
  public Location join3(Location left, Key key, int level, Location right) {
    Node<Key> nl = left == null ? null : node(left);
    Node<Key> nr = right == null ? null : node(right);
    boolean overLeft  = nl == null || level > nl._level;
    boolean overRight = nr == null || level >= nr._level;

    if (overLeft && overRight)
      return make(key, level, share(left), share(right));
    if (!overLeft && (nr == null || nl._level >= nr._level))
      return make(nl._key, nl._level, share(nl._left), join3(nl._right, key, level, right));
    return make(nr._key, nr._level, join3(left, key, level, nr._left), share(nr._right));
  }

  Location joinOwned(Location left, Location right) {
    try {
      return join(left, right);
    } finally {
      drop(left);
      drop(right);
    }
  }

  // Updates

  public Location insert(Location root, Key element, OnDuplicate policy) {
    Object key = _settings.sortKey(element);
    Key existing = lookup(root, key);
    if (existing != null && resolve(existing, element, policy) == existing)
      return share(root);

    Split s = split(root, key);
    try {
      return join3(s._left, element, levelOf(element), s._right);
    } finally {
      drop(s._left);
      drop(s._right);
    }
  }

  public Location remove(Location root, Object key) {
    if (lookup(root, key) == null)
      return share(root);

    Split s = split(root, key);
    try {
      return join(s._left, s._right);
    } finally {
      drop(s._left);
      drop(s._right);
    }
  }

  public Location insertAt(Location root, long index, Key element) {
    Split s = splitAt(root, index);
    try {
      return join3(s._left, element, levelOf(element), s._right);
    } finally {
      drop(s._left);
      drop(s._right);
    }
  }

  public Location removeAt(Location root, long index) {
    Split s = splitAt(root, index);
    Split t = null;
    try {
      t = splitAt(s._right, 1);
      return join(s._left, t._right);
    } finally {
      drop(s._left);
      drop(s._right);
      if (t != null) {
        drop(t._left);
        drop(t._right);
      }
    }
  }

  public Location assocAt(Location root, long index, Key element) {
    Split s = splitAt(root, index);
    Split t = null;
    try {
      t = splitAt(s._right, 1);
      return join3(s._left, element, levelOf(element), t._right);
    } finally {
      drop(s._left);
      drop(s._right);
      if (t != null) {
        drop(t._left);
        drop(t._right);
      }
    }
  }

  // Set algebra

  /**
   * Same location, or same checksum and cardinality.
   */
  boolean sameContent(Location a, Location b) {
    if (a == b) return true;
    if (a == null || b == null) return false;
    int checksum = _settings._checksum;
    if (checksum < 0) return false;
    Object[] ma = measure(a);
    Object[] mb = measure(b);
    if (!ma[checksum].equals(mb[checksum])) return false;
    int cardinality = _settings._cardinality;
    return cardinality < 0 || ma[cardinality].equals(mb[cardinality]);
  }

  /**
   * Elements of both. Where both hold the same key, {@code policy} decides,
   * with {@code a} as the existing side and {@code b} as the incoming one.
   */
  public Location union(Location a, Location b, OnDuplicate policy) {
    if (a == null) return share(b);
    if (b == null) return share(a);
    if (sameContent(a, b)) {
      if (logger.isTraceEnabled())
        logger.trace("union: equal subtrees {} and {}", a, b);
      return share(policy == OnDuplicate.REPLACE ? b : a);
    }

    Node<Key> na = node(a);
    Node<Key> nb = node(b);
    boolean fromA = outranks(na, nb);
    Node<Key> top = fromA ? na : nb;
    Split s = split(fromA ? b : a, _settings.sortKey(top._key));
    try {
      Key pivot = top._key;
      if (s._hit)
        pivot = fromA ? resolve(na._key, (Key) s._found, policy) : resolve((Key) s._found, nb._key, policy);

      Location left = fromA ? union(na._left, s._left, policy) : union(s._left, nb._left, policy);
      Location right;
      try {
        right = fromA ? union(na._right, s._right, policy) : union(s._right, nb._right, policy);
      } catch (RuntimeException e) {
        drop(left);
        throw e;
      }
      return rebuild(fromA ? a : b, top, pivot, left, right);
    } finally {
      drop(s._left);
      drop(s._right);
    }
  }

  /**
   * Elements of {@code a} whose key is also in {@code b}; {@code policy} as in union.
   */
  public Location intersect(Location a, Location b, OnDuplicate policy) {
    if (a == null || b == null) return null;
    if (sameContent(a, b)) return share(policy == OnDuplicate.REPLACE ? b : a);

    Node<Key> na = node(a);
    Node<Key> nb = node(b);
    boolean fromA = outranks(na, nb);
    Node<Key> top = fromA ? na : nb;
    Split s = split(fromA ? b : a, _settings.sortKey(top._key));
    try {
      Key pivot = null;
      if (s._hit)
        pivot = fromA ? resolve(na._key, (Key) s._found, policy) : resolve((Key) s._found, nb._key, policy);

      Location left = fromA ? intersect(na._left, s._left, policy) : intersect(s._left, nb._left, policy);
      Location right;
      try {
        right = fromA ? intersect(na._right, s._right, policy) : intersect(s._right, nb._right, policy);
      } catch (RuntimeException e) {
        drop(left);
        throw e;
      }
      if (s._hit) return rebuild(fromA ? a : b, top, pivot, left, right);
      return joinOwned(left, right);
    } finally {
      drop(s._left);
      drop(s._right);
    }
  }

  /**
   * Elements of {@code a} whose key is not in {@code b}.
   */
  public Location difference(Location a, Location b) {
    if (a == null) return null;
    if (b == null) return share(a);
    if (sameContent(a, b)) return null;

    Node<Key> na = node(a);
    Split s = split(b, _settings.sortKey(na._key));
    try {
      Location left = difference(na._left, s._left);
      Location right = difference(na._right, s._right);
      if (s._hit) return joinOwned(left, right);
      return rebuild(a, na, na._key, left, right);
    } finally {
      drop(s._left);
      drop(s._right);
    }
  }

  /**
   * Rebuild a subtree owned by another stash in this one. Shape is kept.
   */
  public Location copy(IStash<Key> from, Location location) {
    if (location == null) return null;
    Node<Key> n = from.get(location);
    Location left = copy(from, n._left);
    Location right = copy(from, n._right);
    return make(n._key, n._level, left, right);
  }

  /**
   * Checks levels, heap order, tie-breaks and cached measures of every node.
   * Element order is checked by {@link Tree#verify()}.
   */
  public boolean verify(Location location) {
    if (location == null) return true;
    Node<Key> n = node(location);
    if (!_settings.positional() && n._level != _settings.level(n._key)) return false;
    // a left child comes first, so it would win a tie
    if (n._left != null && node(n._left)._level >= n._level) return false;
    if (n._right != null && node(n._right)._level > n._level) return false;
    Object[] expected = _settings._measures.node(measure(n._left), n._key, measure(n._right));
    if (!Arrays.equals(expected, n._measure)) return false;
    return verify(n._left) && verify(n._right);
  }
}
