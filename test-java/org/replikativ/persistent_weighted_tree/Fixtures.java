package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;

final class Fixtures {
  private Fixtures() {}

  static List<Long> range(long from, long to) {
    List<Long> res = new ArrayList<>();
    for (long i = from; i < to; ++i) res.add(i);
    return res;
  }

  static List<Long> shuffled(List<Long> xs, long seed) {
    List<Long> res = new ArrayList<>(xs);
    Collections.shuffle(res, new Random(seed));
    return res;
  }

  static List<Long> random(int count, long bound, long seed) {
    Random random = new Random(seed);
    List<Long> res = new ArrayList<>();
    for (int i = 0; i < count; ++i) res.add((long) random.nextInt((int) bound));
    return res;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  static Map.Entry<Object, Object> entry(Object key, Object val) {
    return (Map.Entry) MapEntry.create(key, val);
  }

  static List<Map.Entry<Object, Object>> entries(Object... kvs) {
    List<Map.Entry<Object, Object>> res = new ArrayList<>();
    for (int i = 0; i < kvs.length; i += 2) res.add(entry(kvs[i], kvs[i + 1]));
    return res;
  }

  static <Key> Tree<Key> build(IStash<Key> stash, Settings settings, Iterable<? extends Key> xs) {
    return Tree.<Key>empty(stash, settings).insertAll(xs);
  }

  static <Key> List<Key> toList(Tree<Key> tree) {
    List<Key> res = new ArrayList<>();
    for (Key k: tree) res.add(k);
    return res;
  }

  // keys with levels in pre-order, identifies the shape of a tree
  static List<Object> shape(Tree<?> tree) {
    List<Object> res = new ArrayList<>();
    shape(tree._treap, tree._root, res);
    return res;
  }

  private static void shape(Treap<?> treap, Location location, List<Object> out) {
    if (location == null) {
      out.add("-");
      return;
    }
    Node<?> node = treap.node(location);
    out.add(node._key + "@" + node._level);
    shape(treap, node._left, out);
    shape(treap, node._right, out);
  }

  // longest root to leaf path, 0 for an empty tree
  static int height(Tree<?> tree) {
    return height(tree._treap, tree._root);
  }

  private static int height(Treap<?> treap, Location location) {
    if (location == null) return 0;
    Node<?> node = treap.node(location);
    return 1 + Math.max(height(treap, node._left), height(treap, node._right));
  }

  static void closeAll(AutoCloseable... closeables) throws Exception {
    for (AutoCloseable c: closeables) c.close();
  }
}
