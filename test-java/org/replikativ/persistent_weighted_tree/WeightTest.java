package org.replikativ.persistent_weighted_tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class WeightTest {

  @Test
  void levelCountsLeadingZeros() {
    assertThat(Weight.level(0)).isEqualTo(Weight.MAX_LEVEL);
    assertThat(Weight.level(-1)).isEqualTo(0);
    assertThat(Weight.level(1)).isEqualTo(31);
    assertThat(Weight.level(0x00FF0000)).isEqualTo(8);
  }

  @Test
  void levelsAreGeometric() {
    IHasher<Object> hasher = new HasheqHasher(Settings.SET_SALT);
    int[] counts = new int[Weight.MAX_LEVEL + 1];
    for (long i = 0; i < 100000; ++i) {
      counts[Weight.level(hasher, (Object) i)] += 1;
    }
    // roughly half at level 0, a quarter at level 1
    assertThat(counts[0]).isBetween(47000, 53000);
    assertThat(counts[1]).isBetween(23000, 27000);
    assertThat(counts[2]).isBetween(11000, 14000);
  }

  @Test
  void hashIsDeterministicAndSalted() {
    IHasher<Object> a = new HasheqHasher(Settings.SET_SALT);
    IHasher<Object> b = new HasheqHasher(Settings.SET_SALT);
    IHasher<Object> c = new HasheqHasher(Settings.MAP_SALT);

    int differing = 0;
    for (long i = 0; i < 1000; ++i) {
      assertThat(a.hash(i)).isEqualTo(b.hash(i));
      if (a.hash(i) != c.hash(i)) differing++;
    }
    assertThat(differing).isGreaterThan(990);
    assertThat(a).isEqualTo(b).isNotEqualTo(c);
  }

  @Test
  void equivKeysHashAlike() {
    IHasher<Object> hasher = new HasheqHasher(Settings.SET_SALT);
    assertThat(hasher.hash(42)).isEqualTo(hasher.hash(42L));
    assertThat(hasher.hash("abc")).isEqualTo(hasher.hash(new String("abc")));
  }
}
