package org.replikativ.persistent_weighted_tree;

/**
 * Order-sensitive checksum of a sequence of element hashes.
 *
 * A digest is the polynomial {@code h1*B^(n-1) + h2*B^(n-2) + ... + hn}
 * modulo 2^64, kept together with {@code B^n} so that two digests can be
 * concatenated without knowing the elements they cover:
 * {@code (h1, s1) ++ (h2, s2) = (h1*s2 + h2, s1*s2)}.
 * Concatenation is associative and not commutative, which is exactly what
 * an in-order aggregate needs.
 *
 * All fields are immutable. Create new instances for updates.
 */
public final class Digest {

    /**
     * Odd, so that multiplication by it is a bijection modulo 2^64.
     */
    public static final long BASE = 0x9E3779B97F4A7C15L;

    public static final Digest IDENTITY = new Digest(0L, 1L);

    public final long hash;
    public final long scale;

    public Digest(long hash, long scale) {
        this.hash = hash;
        this.scale = scale;
    }

    /**
     * Digest of a single element with the given hash.
     */
    public static Digest of(int elementHash) {
        return new Digest(elementHash & 0xFFFFFFFFL, BASE);
    }

    /**
     * Concatenate: {@code this} covers elements before the ones {@code other} covers.
     */
    public Digest merge(Digest other) {
        if (other == IDENTITY) return this;
        if (this == IDENTITY) return other;
        return new Digest(hash * other.scale + other.hash, scale * other.scale);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Digest)) return false;
        Digest that = (Digest) o;
        return hash == that.hash && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(hash * 31 + scale);
    }

    @Override
    public String toString() {
        return "Digest{" +
               "hash=" + Long.toHexString(hash) +
               ", scale=" + Long.toHexString(scale) +
               '}';
    }
}
