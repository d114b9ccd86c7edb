package org.replikativ.persistent_weighted_tree;

public class DuplicateKeyException extends IllegalArgumentException {
  private final transient Object _key;

  public DuplicateKeyException(Object key) {
    super("Key already present: " + key);
    _key = key;
  }

  public Object key() {
    return _key;
  }
}
