package comiam.chaining;


import java.util.Objects;


/**
 * Ready-made {@link KeyHasher} implementations.
 *
 * <p>All hashers return a 32-bit value that the table reads as unsigned. String-only hashers work on
 * UTF-16 code units of a {@link CharSequence}.
 */
public final class HashFunctions {

    // Fixed-point form of (sqrt(5) - 1) / 2, i.e. floor(A * 2^32).
    private static final int GOLDEN_RATIO_32 = 0x9E3779B9;

    private static final int DJB2_SEED = 5381;

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 16777619;

    private static final long DEFAULT_ROLLING_BASE = 31;
    private static final long DEFAULT_ROLLING_MOD = 1_000_000_007L;

    private HashFunctions() {
    }

    // ---------------------- General Purpose ----------------------

    /**
     * Division-method hasher: strings hash as {@code h = h * 31 + c} over their characters, any other
     * key by its {@link Object#hashCode()}. The table's modulo by capacity completes the method.
     *
     * @return division hasher.
     */
    public static KeyHasher<Object> division() {
        return HashFunctions::numericKey;
    }

    /**
     * Multiplication-method hasher: {@code floor(2^32 * frac(k * A))} with {@code A = (sqrt(5) - 1) / 2},
     * where {@code k} is the division-method value of the key.
     *
     * @return multiplication hasher.
     */
    public static KeyHasher<Object> multiplication() {
        return key -> numericKey(key) * GOLDEN_RATIO_32;
    }

    /**
     * Member of the universal family {@code (a * k + b) mod prime}, where {@code k} is the sum of the
     * characters of a string key or the {@link Object#hashCode()} of any other key.
     *
     * @param a     multiplier, in {@code [1, prime)}.
     * @param b     offset, in {@code [0, prime)}.
     * @param prime modulus.
     * @return universal hasher.
     */
    public static KeyHasher<Object> universal(final long a, final long b, final int prime) {
        if (prime <= 0) {
            throw new IllegalArgumentException("prime must be positive");
        }
        if (a < 1 || a >= prime) {
            throw new IllegalArgumentException("a must be in [1, prime)");
        }
        if (b < 0 || b >= prime) {
            throw new IllegalArgumentException("b must be in [0, prime)");
        }
        return key -> {
            final long k = key instanceof CharSequence cs ? charSum(cs) : key.hashCode();
            return (int) Math.floorMod(a * k + b, (long) prime);
        };
    }

    // ---------------------- String Hashers ----------------------

    /**
     * DJB2: {@code h = 5381; h = h * 33 + c}.
     *
     * @return DJB2 hasher.
     */
    public static KeyHasher<CharSequence> djb2() {
        return text -> {
            int h = DJB2_SEED;
            for (int i = 0; i < text.length(); i++) {
                h = (h << 5) + h + text.charAt(i);
            }
            return h;
        };
    }

    /**
     * FNV-1a, 32-bit variant: xor each character into the state, then multiply by the FNV prime.
     *
     * @return FNV-1a hasher.
     */
    public static KeyHasher<CharSequence> fnv1a() {
        return text -> {
            int h = FNV_OFFSET_BASIS;
            for (int i = 0; i < text.length(); i++) {
                h ^= text.charAt(i);
                h *= FNV_PRIME;
            }
            return h;
        };
    }

    /**
     * Polynomial rolling hash with base 31 modulo 1_000_000_007.
     *
     * @return rolling hasher.
     */
    public static KeyHasher<CharSequence> polynomialRolling() {
        return polynomialRolling(DEFAULT_ROLLING_BASE, DEFAULT_ROLLING_MOD);
    }

    /**
     * Polynomial rolling hash {@code sum(c_i * base^i) mod mod}.
     *
     * @param base positive base.
     * @param mod  positive modulus, at most {@link Integer#MAX_VALUE}.
     * @return rolling hasher.
     */
    public static KeyHasher<CharSequence> polynomialRolling(final long base, final long mod) {
        if (mod <= 0 || mod > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("mod must be in [1, Integer.MAX_VALUE]");
        }
        if (base <= 0 || base >= mod) {
            throw new IllegalArgumentException("base must be in [1, mod)");
        }
        return text -> {
            long h = 0;
            long power = 1;
            for (int i = 0; i < text.length(); i++) {
                h = (h + text.charAt(i) * power) % mod;
                power = (power * base) % mod;
            }
            return (int) h;
        };
    }

    // ---------------------- Distribution Analysis ----------------------

    /**
     * Counts how many of the given keys land in each of {@code buckets} buckets.
     *
     * @param hasher  hasher under test.
     * @param keys    keys to place.
     * @param buckets number of buckets.
     * @param <K>     key type.
     * @return occupancy per bucket.
     */
    public static <K> int[] distribution(final KeyHasher<? super K> hasher, final Iterable<? extends K> keys,
                                         final int buckets) {
        Objects.requireNonNull(hasher, "hasher");
        if (buckets <= 0) {
            throw new IllegalArgumentException("buckets must be positive");
        }
        final int[] counts = new int[buckets];
        for (final K key : keys) {
            counts[Integer.remainderUnsigned(hasher.hash(key), buckets)]++;
        }
        return counts;
    }

    /**
     * Population standard deviation of a bucket histogram; lower means a more uniform spread.
     *
     * @param counts occupancy per bucket.
     * @return standard deviation.
     */
    public static double standardDeviation(final int[] counts) {
        if (counts.length == 0) {
            return 0.0;
        }
        long total = 0;
        for (final int c : counts) {
            total += c;
        }
        final double mean = (double) total / counts.length;
        double variance = 0.0;
        for (final int c : counts) {
            variance += (c - mean) * (c - mean);
        }
        return Math.sqrt(variance / counts.length);
    }

    private static int numericKey(final Object key) {
        if (key instanceof CharSequence cs) {
            int h = 0;
            for (int i = 0; i < cs.length(); i++) {
                h = h * 31 + cs.charAt(i);
            }
            return h;
        }
        return key.hashCode();
    }

    private static long charSum(final CharSequence cs) {
        long sum = 0;
        for (int i = 0; i < cs.length(); i++) {
            sum += cs.charAt(i);
        }
        return sum;
    }
}
