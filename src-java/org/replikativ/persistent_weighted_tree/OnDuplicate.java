package org.replikativ.persistent_weighted_tree;

/**
 * What to do when an element arrives whose sort key is already present
 * with a different (non-{@code equiv}) element. Equal elements are always
 * a no-op.
 */
public enum OnDuplicate {
  // keep the element already in the tree
  KEEP,
  // the incoming element replaces the stored one
  REPLACE,
  // throw DuplicateKeyException
  THROW
}
