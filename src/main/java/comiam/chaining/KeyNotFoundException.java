package comiam.chaining;


import java.util.NoSuchElementException;


/**
 * Thrown by {@link ChainedHashTable#search(Object)} and {@link ChainedHashTable#delete(Object)} when
 * the table holds no entry for the requested key. This is an expected outcome, not a defect.
 */
public class KeyNotFoundException extends NoSuchElementException {

    private final transient Object key;

    /**
     * Creates the exception for a missing key.
     *
     * @param key the key that was looked up.
     */
    public KeyNotFoundException(final Object key) {
        super("Key '" + key + "' not found");
        this.key = key;
    }

    /**
     * Returns the key that was not found.
     *
     * @return the missing key.
     */
    public Object getKey() {
        return key;
    }
}
