package org.replikativ.persistent_weighted_tree;

import java.util.*;
import clojure.lang.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.replikativ.persistent_weighted_tree.Fixtures.*;

public class PersistentWeightedMapTest {

  static Map<Object, Object> hashMap(Object... kvs) {
    Map<Object, Object> res = new HashMap<>();
    for (int i = 0; i < kvs.length; i += 2) res.put(kvs[i], kvs[i + 1]);
    return res;
  }

  @Test
  void assocOverwritesAndWithoutRemoves() throws Exception {
    PersistentWeightedMap<Object, Object> m0 = new PersistentWeightedMap<>();
    PersistentWeightedMap<Object, Object> ma = m0.assoc(1L, "a");
    PersistentWeightedMap<Object, Object> m1 = ma.assoc(2L, "b");
    PersistentWeightedMap<Object, Object> m2 = m1.assoc(1L, "z");
    PersistentWeightedMap<Object, Object> m3 = m2.without(2L);

    assertThat(m1.valAt(1L)).isEqualTo("a");
    assertThat(m2.valAt(1L)).isEqualTo("z");
    assertThat(m2.count()).isEqualTo(2);
    assertThat(m3.containsKey(2L)).isFalse();
    assertThat(m3.valAt(2L, "missing")).isEqualTo("missing");
    assertThat(m2.entryAt(2L).val()).isEqualTo("b");
    assertThat(m2.toString()).isEqualTo("{1 z, 2 b}");

    closeAll(m0, ma, m1, m2, m3);
    assertThat(m0.tree().stash().live()).isEqualTo(0);
  }

  @Test
  void assocExRejectsPresentKey() throws Exception {
    try (PersistentWeightedMap<Object, Object> m = PersistentWeightedMap.from(hashMap(1L, "a"))) {
      assertThatThrownBy(() -> m.assocEx(1L, "a"))
        .isInstanceOf(DuplicateKeyException.class)
        .hasMessageContaining("1");
      try (PersistentWeightedMap<Object, Object> m2 = m.assocEx(2L, "b")) {
        assertThat(m2.count()).isEqualTo(2);
      }
    }
  }

  @Test
  void consAcceptsEntriesAndPairs() throws Exception {
    PersistentWeightedMap<Object, Object> m = new PersistentWeightedMap<>();
    PersistentWeightedMap<Object, Object> a = m.cons(entry("k", 1L));
    PersistentWeightedMap<Object, Object> b = a.cons(PersistentVector.create("j", 2L));
    assertThat(b.valAt("j")).isEqualTo(2L);
    assertThat(b.valAt("k")).isEqualTo(1L);
    assertThatThrownBy(() -> b.cons(PersistentVector.create("x"))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> b.cons("x")).isInstanceOf(IllegalArgumentException.class);
    closeAll(m, a, b);
  }

  @Test
  void mergeLetsOtherWin() throws Exception {
    PersistentWeightedMap<Object, Object> a = PersistentWeightedMap.from(hashMap(1L, "a1", 2L, "a2"));
    PersistentWeightedMap<Object, Object> b = PersistentWeightedMap.from(hashMap(2L, "b2", 3L, "b3"));
    PersistentWeightedMap<Object, Object> merged = a.merge(b);
    PersistentWeightedMap<Object, Object> selected = a.selectKeys(b);
    PersistentWeightedMap<Object, Object> removed = a.removeKeys(b);

    assertThat(merged.equiv(hashMap(1L, "a1", 2L, "b2", 3L, "b3"))).isTrue();
    assertThat(selected.equiv(hashMap(2L, "a2"))).isTrue();
    assertThat(removed.equiv(hashMap(1L, "a1"))).isTrue();

    closeAll(a, b, merged, selected, removed);
  }

  @Test
  void keyAndValueDigests() throws Exception {
    PersistentWeightedMap<Object, Object> a = PersistentWeightedMap.from(hashMap(1L, "x", 2L, "y"));
    PersistentWeightedMap<Object, Object> sameKeys = PersistentWeightedMap.from(hashMap(1L, "p", 2L, "q"));
    PersistentWeightedMap<Object, Object> sameVals = PersistentWeightedMap.from(hashMap(5L, "x", 6L, "y"));

    assertThat(a.keysEqual(sameKeys)).isTrue();
    assertThat(a.valuesEqual(sameKeys)).isFalse();
    assertThat(a.keysEqual(sameVals)).isFalse();
    assertThat(a.valuesEqual(sameVals)).isTrue();
    assertThat(a.equiv(sameKeys)).isFalse();
    assertThat(a.checksum()).isNotEqualTo(sameKeys.checksum());

    closeAll(a, sameKeys, sameVals);
  }

  @Test
  void equivalentToClojureMaps() throws Exception {
    Map<Object, Object> src = hashMap(1L, "a", 2L, "b", 3L, null);
    try (PersistentWeightedMap<Object, Object> m = PersistentWeightedMap.from(src)) {
      IPersistentMap clj = PersistentHashMap.create(src);
      assertThat(m.equiv(clj)).isTrue();
      assertThat(m.equiv(src)).isTrue();
      assertThat(m.hasheq()).isEqualTo(((IHashEq) clj).hasheq());
      assertThat(m.hashCode()).isEqualTo(src.hashCode());
      assertThat(m.valAt(3L, "missing")).isNull();
      assertThat(((Map.Entry) RT.first(m.rseq())).getKey()).isEqualTo(3L);
    }
  }

  static final int LOTS = 100_000;

  static final IFn DEC = new AFn() {
    @Override
    public Object invoke(Object x) {
      return (Long) x - 1;
    }
  };

  @Test
  void updateAppliesToPresentKeysOnly() throws Exception {
    PersistentWeightedMap<Object, Object> m = PersistentWeightedMap.from(hashMap(1L, 10L, 2L, 20L));
    PersistentWeightedMap<Object, Object> updated = m.update(2L, DEC);
    PersistentWeightedMap<Object, Object> missing = m.update(3L, DEC);
    assertThat(updated.valAt(2L)).isEqualTo(19L);
    assertThat(updated.valAt(1L)).isEqualTo(10L);
    assertThat(m.valAt(2L)).isEqualTo(20L);
    assertThat(missing.equiv(m)).isTrue();
    assertThat(missing.tree().root()).isSameAs(m.tree().root());
    closeAll(m, updated, missing);
  }

  @Test
  void updateEveryValue() throws Exception {
    Map<Object, Object> as = new HashMap<>();
    Map<Object, Object> bs = new HashMap<>();
    for (long i = 0; i < LOTS; ++i) {
      as.put(i, i);
      bs.put(i, i + 1);
    }
    PersistentWeightedMap<Object, Object> a = PersistentWeightedMap.from(as);
    PersistentWeightedMap<Object, Object> b = PersistentWeightedMap.from(bs);
    assertThat(a.keysEqual(b)).isTrue();
    assertThat(a.valuesEqual(b)).isFalse();
    for (long i = 0; i < LOTS; ++i) {
      PersistentWeightedMap<Object, Object> next = b.update(i, DEC);
      b.close();
      b = next;
    }
    assertThat(a.count()).isEqualTo(LOTS);
    assertThat(a.equiv(b)).isTrue();
    assertThat(a.valuesEqual(b)).isTrue();
    assertThat(b.valAt(LOTS / 2L)).isEqualTo(LOTS / 2L);
    assertThat(b.tree().verify()).isTrue();
    closeAll(a, b);
  }

  @Test
  void manyShuffledAssocs() throws Exception {
    PersistentWeightedMap<Object, Object> m = new PersistentWeightedMap<>();
    for (long k: shuffled(range(0, LOTS), 7)) {
      PersistentWeightedMap<Object, Object> next = m.assoc(k, -k);
      m.close();
      m = next;
    }
    assertThat(m.count()).isEqualTo(LOTS);
    assertThat(height(m.tree())).isLessThan(100);
    for (long k = 0; k < LOTS; k += 997) {
      assertThat(m.valAt(k)).isEqualTo(-k);
    }
    assertThat(m.nth(LOTS - 1).getKey()).isEqualTo((long) LOTS - 1);
    assertThat(m.tree().verify()).isTrue();
    m.close();
  }

  @Test
  void entryAtAcceptsAnyStoredEntry() {
    List<Map.Entry<Object, Object>> plain = new ArrayList<>();
    plain.add(new AbstractMap.SimpleEntry<Object, Object>(1L, "a"));
    plain.add(new AbstractMap.SimpleEntry<Object, Object>(2L, "b"));
    try (PersistentWeightedMap<Object, Object> m = new PersistentWeightedMap<>(Tree.from(Settings.forMap(), plain))) {
      IMapEntry e = m.entryAt(2L);
      assertThat(e.key()).isEqualTo(2L);
      assertThat(e.val()).isEqualTo("b");
      assertThat(m.entryAt(3L)).isNull();
      assertThat(m.valAt(1L)).isEqualTo("a");
    }
  }
}
