package org.replikativ.persistent_weighted_tree;

import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.replikativ.persistent_weighted_tree.Fixtures.*;

public class SynchronizedStashTest {

  @Test
  void treesSharedAcrossThreads() throws Exception {
    Settings settings = Settings.forSet().withConcurrent(true);
    IStash<Long> stash = settings.newStash();
    assertThat(stash).isInstanceOf(SynchronizedStash.class);

    Tree<Long> base = build(stash, settings, range(0, 1000));
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Long>> futures = new ArrayList<>();
      for (int t = 0; t < 32; ++t) {
        final long seed = t;
        final Tree<Long> mine = base.clone();
        futures.add(pool.submit(() -> {
          try (Tree<Long> extra = build(stash, settings, random(200, 5000, seed));
               Tree<Long> union = mine.union(extra);
               Tree<Long> diff = union.difference(mine)) {
            assertThat(union.verify()).isTrue();
            return diff.size();
          } finally {
            mine.close();
          }
        }));
      }
      for (int t = 0; t < futures.size(); ++t) {
        TreeSet<Long> expected = new TreeSet<>(random(200, 5000, t));
        expected.removeAll(range(0, 1000));
        assertThat(futures.get(t).get(30, TimeUnit.SECONDS)).isEqualTo((long) expected.size());
      }
    } finally {
      pool.shutdown();
    }

    assertThat(stash.live()).isEqualTo(1000);
    base.close();
    assertThat(stash.live()).isEqualTo(0);
  }
}
