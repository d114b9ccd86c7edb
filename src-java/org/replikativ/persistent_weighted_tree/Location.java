package org.replikativ.persistent_weighted_tree;

/**
 * Opaque handle of a node inside the stash that allocated it.
 *
 * Only a stash creates locations, and a stash creates a fresh one for every
 * slot it fills, so a location is compared by identity and stays invalid
 * after its node is freed, even if the slot gets reused.
 */
public final class Location {
  final IStash<?> _stash;
  final int _slot;

  Location(IStash<?> stash, int slot) {
    _stash = stash;
    _slot  = slot;
  }

  public boolean ownedBy(IStash<?> stash) {
    return _stash == stash;
  }

  @Override
  public String toString() {
    return "#loc " + _slot;
  }
}
