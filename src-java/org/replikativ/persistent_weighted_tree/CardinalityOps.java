package org.replikativ.persistent_weighted_tree;

/**
 * IMeasure counting elements of a subtree.
 *
 * Gives O(1) size and drives rank navigation (nth, positional split).
 */
@SuppressWarnings("unchecked")
public class CardinalityOps<Key> implements IMeasure<Key, Long> {

    private static final CardinalityOps<?> INSTANCE = new CardinalityOps<>();

    private static final Long ONE = 1L;
    private static final Long ZERO = 0L;

    /**
     * Get a singleton instance.
     */
    public static <K> CardinalityOps<K> instance() {
        return (CardinalityOps<K>) INSTANCE;
    }

    @Override
    public Long identity() {
        return ZERO;
    }

    @Override
    public Long extract(Key key) {
        return ONE;
    }

    @Override
    public Long merge(Long c1, Long c2) {
        return c1 + c2;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CardinalityOps;
    }

    @Override
    public int hashCode() {
        return CardinalityOps.class.hashCode();
    }
}
