package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;

/**
 * In-order walk over a tree. {@code _stack} holds the ancestors still to be
 * visited, nearest first. Nodes are read from the stash lazily, so a seq
 * must not outlive the tree it was taken from.
 */
@SuppressWarnings("unchecked")
public class Seq extends ASeq implements IReduce {
  final IStash _stash;
  final Node   _node;
  final ISeq   _stack;
  final boolean _asc;

  Seq(IPersistentMap meta, IStash stash, Node node, ISeq stack, boolean asc) {
    super(meta);
    _stash = stash;
    _node  = node;
    _stack = stack;
    _asc   = asc;
  }

  static Seq create(IStash stash, Location root, boolean asc) {
    if (root == null) return null;
    return descend(null, stash, root, null, asc);
  }

  // walks to the first node of the subtree, pushing the ones passed
  static Seq descend(IPersistentMap meta, IStash stash, Location location, ISeq stack, boolean asc) {
    Node node = stash.get(location);
    while (true) {
      Location child = asc ? node._left : node._right;
      if (child == null) return new Seq(meta, stash, node, stack, asc);
      stack = new Cons(node, stack);
      node  = stash.get(child);
    }
  }

  public boolean asc() {
    return _asc;
  }

  // ISeq
  public Object first() {
    return _node._key;
  }

  public Seq next() {
    Location child = _asc ? _node._right : _node._left;
    if (child != null) return descend(meta(), _stash, child, _stack, _asc);
    if (_stack == null) return null;
    return new Seq(meta(), _stash, (Node) _stack.first(), _stack.next(), _asc);
  }

  // IObj
  public Seq withMeta(IPersistentMap meta) {
    if (meta() == meta) return this;
    return new Seq(meta, _stash, _node, _stack, _asc);
  }

  // IReduce
  public Object reduce(IFn f) {
    Seq next = next();
    return next == null ? first() : next.reduce(f, first());
  }

  public Object reduce(IFn f, Object start) {
    Object ret = start;
    for (Seq seq = this; seq != null; seq = seq.next()) {
      ret = f.invoke(ret, seq.first());
      if (ret instanceof Reduced) return ((Reduced) ret).deref();
    }
    return ret;
  }

  // Iterable
  public Iterator iterator() {
    return new JavaIter(this);
  }
}
