package org.replikativ.persistent_weighted_tree;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Balance weight of an element: the number of leading zero bits of its hash.
 *
 * For a uniform 32-bit hash P(level >= k) = 2^-k, which keeps the expected
 * height of a tree ordered as a max-heap on level logarithmic.
 */
public final class Weight {
  public static final int MAX_LEVEL = Integer.SIZE;

  private Weight() {}

  // 0 ... MAX_LEVEL
  public static int level(int hash) {
    return Integer.numberOfLeadingZeros(hash);
  }

  public static <Key> int level(IHasher<Key> hasher, Key key) {
    return level(hasher.hash(key));
  }

  /**
   * Level for a node of a positional tree. Drawn per node, not per element,
   * so runs of equal elements do not share a level and collapse into a chain.
   */
  public static int randomLevel() {
    return level(ThreadLocalRandom.current().nextInt());
  }
}
