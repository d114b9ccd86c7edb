package org.replikativ.persistent_weighted_tree;

import java.util.*;
import java.util.function.*;
import clojure.lang.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Everything a concrete collection kind plugs into the tree: ordering,
 * sort key extraction, hashing, the measures to maintain, and policies.
 * Validated once, when built.
 *
 * A configuration without comparator is positional: elements keep the
 * order they were inserted at (vectors), which requires {@link CardinalityOps}.
 * Their node levels are drawn per node, {@link #level} only weighs keyed elements.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class Settings {
  private static final Logger logger = LogManager.getLogger(Settings.class);

  public static final int SET_SALT    = 0x243F6A88;
  public static final int MAP_SALT    = 0x85A308D3;
  public static final int VECTOR_SALT = 0x13198A2E;

  public static final Function<Object, Object> IDENTITY = new Function<Object, Object>() {
    public Object apply(Object element) { return element; }
    public String toString() { return "identity"; }
  };

  public static final Function<Object, Object> ENTRY_KEY = new Function<Object, Object>() {
    public Object apply(Object entry) { return ((Map.Entry) entry).getKey(); }
    public String toString() { return "entry-key"; }
  };

  // Nullable, null == positional
  public final Comparator _cmp;
  public final Function<Object, Object> _keyFn;
  public final IHasher<Object> _hasher;
  public final Measures _measures;
  public final OnDuplicate _onDuplicate;
  public final boolean _intern;
  public final boolean _concurrent;

  // Indices into node measure tuples, -1 == not configured
  public final int _cardinality;
  public final int _checksum;

  public Settings(Comparator cmp, Function<Object, Object> keyFn, IHasher<Object> hasher, Measures measures,
                  OnDuplicate onDuplicate, boolean intern, boolean concurrent) {
    if (hasher == null) {
      throw new IllegalArgumentException("hasher is required");
    }
    if (measures == null) {
      measures = new Measures();
    }
    if (keyFn == null) {
      keyFn = IDENTITY;
    }
    if (onDuplicate == null) {
      onDuplicate = OnDuplicate.KEEP;
    }
    _cmp         = cmp;
    _keyFn       = keyFn;
    _hasher      = hasher;
    _measures    = measures;
    _onDuplicate = onDuplicate;
    _intern      = intern;
    _concurrent  = concurrent;
    _cardinality = measures.indexOf(CardinalityOps.class);
    _checksum    = measures.indexOf(CheckSumOps.class);

    if (cmp == null && _cardinality < 0) {
      throw new IllegalArgumentException("Positional settings require CardinalityOps");
    }
    logger.debug("Configured {} tree, {}, hasher {}, onDuplicate {}",
                 cmp == null ? "positional" : "sorted", measures, hasher, onDuplicate);
  }

  public Settings(Comparator cmp, IHasher<Object> hasher, Measures measures) {
    this(cmp, IDENTITY, hasher, measures, OnDuplicate.KEEP, false, false);
  }

  public static Settings forSet() {
    return forSet(RT.DEFAULT_COMPARATOR);
  }

  public static Settings forSet(Comparator cmp) {
    IHasher<Object> hasher = new HasheqHasher(SET_SALT);
    Measures measures = new Measures(new MaxOps(cmp), CardinalityOps.instance(), new CheckSumOps(hasher));
    return new Settings(cmp, IDENTITY, hasher, measures, OnDuplicate.KEEP, false, false);
  }

  public static Settings forMap() {
    return forMap(RT.DEFAULT_COMPARATOR);
  }

  /**
   * Elements are {@link Map.Entry}s ordered and weighted by key.
   * Duplicate keys overwrite by default.
   */
  public static Settings forMap(Comparator keyCmp) {
    IHasher<Object> hasher = new HasheqHasher(MAP_SALT);
    Measures measures = new Measures(new KeyOps(ENTRY_KEY, keyCmp), CardinalityOps.instance(),
                                     new KeySumOps(hasher), new ValSumOps(hasher), new CheckSumOps(hasher));
    return new Settings(keyCmp, ENTRY_KEY, hasher, measures, OnDuplicate.REPLACE, false, false);
  }

  public static Settings forVector() {
    IHasher<Object> hasher = new HasheqHasher(VECTOR_SALT);
    Measures measures = new Measures(CardinalityOps.instance(), new CheckSumOps(hasher));
    return new Settings(null, IDENTITY, hasher, measures, OnDuplicate.KEEP, false, false);
  }

  public Settings withIntern(boolean intern) {
    if (intern == _intern) return this;
    return new Settings(_cmp, _keyFn, _hasher, _measures, _onDuplicate, intern, _concurrent);
  }

  public Settings withConcurrent(boolean concurrent) {
    if (concurrent == _concurrent) return this;
    return new Settings(_cmp, _keyFn, _hasher, _measures, _onDuplicate, _intern, concurrent);
  }

  public Settings withOnDuplicate(OnDuplicate onDuplicate) {
    if (onDuplicate == _onDuplicate) return this;
    return new Settings(_cmp, _keyFn, _hasher, _measures, onDuplicate, _intern, _concurrent);
  }

  public boolean positional() {
    return _cmp == null;
  }

  public Object sortKey(Object element) {
    return _keyFn.apply(element);
  }

  // key vs the sort key of element
  public int compareKey(Object key, Object element) {
    return _cmp.compare(key, _keyFn.apply(element));
  }

  public int compare(Object element1, Object element2) {
    return _cmp.compare(_keyFn.apply(element1), _keyFn.apply(element2));
  }

  public int level(Object element) {
    return Weight.level(_hasher.hash(_keyFn.apply(element)));
  }

  public <Key> IStash<Key> newStash() {
    return _concurrent ? new SynchronizedStash<Key>(_intern) : new Stash<Key>(_intern);
  }

  /**
   * Trees of compatible settings have interchangeable shapes and measures,
   * so they can be combined with set operations.
   */
  public boolean compatible(Settings other) {
    if (this == other) return true;
    return Objects.equals(_cmp, other._cmp)
      && _keyFn.equals(other._keyFn)
      && _hasher.equals(other._hasher)
      && _measures.equals(other._measures);
  }
}
