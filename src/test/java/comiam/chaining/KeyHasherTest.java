package comiam.chaining;


import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;


/**
 * Tests for the KeyHasher defaults.
 */
public class KeyHasherTest {

    /**
     * Tests that the natural hasher folds the high half of hashCode into the low half.
     */
    @Test
    public void testNaturalSpreadsHighBits() {
        KeyHasher<Integer> natural = KeyHasher.natural();
        assertEquals(0, natural.hash(0));
        assertEquals(5, natural.hash(5));
        assertEquals(0x10001, natural.hash(0x10000));
        assertEquals("apple".hashCode() ^ ("apple".hashCode() >>> 16), KeyHasher.<String>natural().hash("apple"));
    }

    /**
     * Tests the lambda adapter and the default equality predicate.
     */
    @Test
    public void testOfUsesObjectsEquals() {
        KeyHasher<String> length = KeyHasher.of(String::length);
        assertEquals(5, length.hash("apple"));
        assertTrue(length.equivalent("apple", new String("apple")));
        assertFalse(length.equivalent("apple", "grape"));
    }
}
