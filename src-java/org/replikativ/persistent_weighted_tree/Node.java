package org.replikativ.persistent_weighted_tree;

/**
 * Immutable tree node: one element, its level, two children and the
 * measure of the whole subtree rooted here.
 */
public final class Node<Key> {
  public final Key _key;

  // Weight.level of _key, >= level of both children
  public final int _level;

  // Nullable, null == empty subtree
  public final Location _left;
  public final Location _right;

  // One slot per Settings._measures component
  public final Object[] _measure;

  public Node(Key key, int level, Location left, Location right, Object[] measure) {
    assert level >= 0 && level <= Weight.MAX_LEVEL;
    _key     = key;
    _level   = level;
    _left    = left;
    _right   = right;
    _measure = measure;
  }

  public boolean leaf() {
    return _left == null && _right == null;
  }

  @Override
  public String toString() {
    return "Node[" + _key + " level=" + _level + " left=" + _left + " right=" + _right + "]";
  }
}
