package comiam.chaining;


import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;


/**
 * Tests for the HashFunctions class.
 */
public class HashFunctionsTest {

    /**
     * Tests the division method against String.hashCode and plain hash codes.
     */
    @Test
    public void testDivision() {
        KeyHasher<Object> division = HashFunctions.division();
        assertEquals("apple".hashCode(), division.hash("apple"));
        assertEquals(0, division.hash(""));
        assertEquals(42, division.hash(42));
        assertEquals("apple".hashCode(), division.hash(new StringBuilder("apple")),
                "Any CharSequence hashes by its characters");
    }

    /**
     * Tests the multiplication method: k = 1 yields floor(A * 2^32).
     */
    @Test
    public void testMultiplication() {
        KeyHasher<Object> multiplication = HashFunctions.multiplication();
        assertEquals(0, multiplication.hash(0));
        assertEquals(2654435769L, Integer.toUnsignedLong(multiplication.hash(1)));
        assertEquals(0x9E3779B9 * 2, multiplication.hash(2));
    }

    /**
     * Tests DJB2 on known inputs.
     */
    @Test
    public void testDjb2() {
        KeyHasher<CharSequence> djb2 = HashFunctions.djb2();
        assertEquals(5381, djb2.hash(""));
        assertEquals(5381 * 33 + 'a', djb2.hash("a"));
    }

    /**
     * Tests FNV-1a against the reference 32-bit vectors.
     */
    @Test
    public void testFnv1a() {
        KeyHasher<CharSequence> fnv1a = HashFunctions.fnv1a();
        assertEquals(0x811C9DC5, fnv1a.hash(""));
        assertEquals(0xE40C292C, fnv1a.hash("a"));
        assertEquals(0xBF9CF968, fnv1a.hash("foobar"));
    }

    /**
     * Tests the polynomial rolling hash.
     */
    @Test
    public void testPolynomialRolling() {
        assertEquals(97 + 98 * 31 + 99 * 31 * 31, HashFunctions.polynomialRolling().hash("abc"));
        assertEquals((1 + 2 * 3 + 3 * 9) % 7, HashFunctions.polynomialRolling(3, 7).hash("\u0001\u0002\u0003"));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.polynomialRolling(0, 7));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.polynomialRolling(7, 7));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.polynomialRolling(3, 0));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.polynomialRolling(3, 1L << 40));
    }

    /**
     * Tests a universal family member on string and integer keys.
     */
    @Test
    public void testUniversal() {
        KeyHasher<Object> universal = HashFunctions.universal(3, 7, 101);
        assertEquals(37, universal.hash(10));
        assertEquals(78, universal.hash(-10), "Negative keys wrap into [0, prime)");
        // 'a' + 'b' = 195; 3 * 195 + 7 = 592 = 5 * 101 + 87
        assertEquals(87, universal.hash("ab"));

        assertThrows(IllegalArgumentException.class, () -> HashFunctions.universal(3, 7, 0));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.universal(0, 7, 101));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.universal(101, 7, 101));
        assertThrows(IllegalArgumentException.class, () -> HashFunctions.universal(3, -1, 101));
    }

    /**
     * Tests the bucket histogram and its standard deviation.
     */
    @Test
    public void testDistribution() {
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            keys.add(i);
        }
        int[] even = HashFunctions.distribution(KeyHasher.<Integer>of(Integer::intValue), keys, 5);
        assertArrayEquals(new int[]{2, 2, 2, 2, 2}, even);
        assertEquals(0.0, HashFunctions.standardDeviation(even));

        int[] skewed = HashFunctions.distribution(KeyHasher.<Integer>of(k -> 0), keys, 2);
        assertArrayEquals(new int[]{10, 0}, skewed);
        assertEquals(5.0, HashFunctions.standardDeviation(skewed), 1e-9);

        assertEquals(0.0, HashFunctions.standardDeviation(new int[0]));
        assertThrows(IllegalArgumentException.class,
                () -> HashFunctions.distribution(HashFunctions.djb2(), List.of("a"), 0));
    }

    /**
     * Tests that every provided hasher drives a table correctly through several resizes.
     */
    @Test
    public void testHashersAsTableCapability() {
        List<KeyHasher<? super String>> hashers = List.of(
                HashFunctions.division(),
                HashFunctions.multiplication(),
                HashFunctions.universal(31, 17, 1_000_003),
                HashFunctions.djb2(),
                HashFunctions.fnv1a(),
                HashFunctions.polynomialRolling());
        for (KeyHasher<? super String> hasher : hashers) {
            ChainedHashTable<String, Integer> table = new ChainedHashTable<>(5, 0.75, hasher);
            for (int i = 0; i < 500; i++) {
                table.insert("key" + i, i);
            }
            assertEquals(500, table.size());
            for (int i = 0; i < 500; i++) {
                assertEquals(i, table.search("key" + i));
            }
        }
    }
}
