package comiam.chaining;


/**
 * One key-value pair in a bucket's chain. A node is owned by its predecessor: either the bucket
 * head slot or the previous node's {@code next} link.
 */
final class ChainNode<K, V> {

    final K key;
    V value;
    ChainNode<K, V> next;

    ChainNode(final K key, final V value) {
        this.key = key;
        this.value = value;
    }

    /**
     * Replaces the value held by this node.
     *
     * @param newValue the new value.
     * @return previous value.
     */
    V replace(final V newValue) {
        final V old = value;
        value = newValue;
        return old;
    }
}
