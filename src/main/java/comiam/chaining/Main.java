package comiam.chaining;


import java.util.Arrays;
import java.util.List;


public class Main {

    public static void main(String[] args) {
        ChainedHashTable<String, Integer> table = new ChainedHashTable<>(5, 0.75, HashFunctions.division());

        table.insert("apple", 100);
        table.insert("banana", 200);
        table.insert("cherry", 300);
        table.insert("date", 400);
        table.insert("elderberry", 500);
        table.insert("fig", 600);
        table.insert("grape", 700);

        System.out.println("Size: " + table.size() + ", capacity: " + table.capacity());
        System.out.println("Chain lengths: " + Arrays.toString(table.chainLengths()));

        System.out.println("apple = " + table.search("apple"));
        System.out.println("date = " + table.search("date"));
        System.out.println("Contains 'grape': " + table.contains("grape"));
        System.out.println("Contains 'orange': " + table.contains("orange"));

        System.out.println("Deleted cherry = " + table.delete("cherry"));
        try {
            table.search("cherry");
        } catch (KeyNotFoundException e) {
            System.out.println("After deletion: " + e.getMessage());
        }

        Integer previous = table.insert("apple", 150);
        System.out.println("Updated apple from " + previous + " to " + table.search("apple"));
        System.out.println("Table: " + table);

        List<String> keys = List.of("apple", "banana", "cherry", "date", "elderberry", "fig", "grape");
        System.out.println("Std deviation over 7 buckets: division="
                + HashFunctions.standardDeviation(HashFunctions.distribution(HashFunctions.division(), keys, 7))
                + ", djb2="
                + HashFunctions.standardDeviation(HashFunctions.distribution(HashFunctions.djb2(), keys, 7))
                + ", fnv1a="
                + HashFunctions.standardDeviation(HashFunctions.distribution(HashFunctions.fnv1a(), keys, 7)));
    }
}
