package org.replikativ.persistent_weighted_tree;

/**
 * Hash function family shared by the weight function and checksums.
 *
 * Must be a pure, deterministic function of the element's identity.
 * Changing it (or its salt) changes every tree shape built with it, so trees
 * built before and after the change no longer share structure.
 */
public interface IHasher<Key> {
  int hash(Key key);
}
