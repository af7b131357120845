package comiam.chaining;


import java.util.Objects;
import java.util.function.ToIntFunction;


/**
 * Hash capability consumed by {@link ChainedHashTable}.
 *
 * <p>The value returned by {@link #hash(Object)} is read as an unsigned 32-bit integer, so every
 * {@code int} is a valid hash. The table computes the bucket index as
 * {@code Integer.remainderUnsigned(hash(key), capacity)}.
 *
 * <p>Implementations must be deterministic and consistent with {@link #equivalent(Object, Object)}:
 * equivalent keys must produce equal hashes.
 *
 * @param <K> the type of keys hashed
 */
@FunctionalInterface
public interface KeyHasher<K> {

    /**
     * Computes the hash of a non-null key.
     *
     * @param key the key.
     * @return hash, interpreted as unsigned.
     */
    int hash(K key);

    /**
     * Key equality predicate used when walking a chain.
     *
     * @param a key stored in the table.
     * @param b key being looked up.
     * @return true if both keys denote the same entry.
     */
    default boolean equivalent(final K a, final K b) {
        return Objects.equals(a, b);
    }

    /**
     * Returns a hasher based on {@link Object#hashCode()} with the high bits folded into the low ones,
     * the same spreading {@code java.util.HashMap} applies.
     *
     * @param <K> key type.
     * @return natural hasher.
     */
    static <K> KeyHasher<K> natural() {
        return key -> {
            final int h = key.hashCode();
            return h ^ (h >>> 16);
        };
    }

    /**
     * Adapts a plain function to a hasher with {@link Objects#equals(Object, Object)} equality.
     *
     * @param function hash function.
     * @param <K>      key type.
     * @return hasher delegating to {@code function}.
     */
    static <K> KeyHasher<K> of(final ToIntFunction<? super K> function) {
        Objects.requireNonNull(function, "function");
        return function::applyAsInt;
    }
}
