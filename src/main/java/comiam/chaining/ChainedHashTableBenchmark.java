package comiam.chaining;


import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;


/**
 * Benchmark comparing java.util.HashMap and ChainedHashTable.
 *
 * <p>Benchmarks:
 * <ul>
 *   <li>benchmarkHashMapPut: Insertion of mapSize keys into a standard HashMap.
 *   <li>benchmarkChainedHashTablePut: Insertion of mapSize keys into a ChainedHashTable starting at
 *       the default capacity, so every doubling resize is included.
 *   <li>benchmarkHashMapGet / benchmarkChainedHashTableGet: Lookup of every key in a pre-filled table.
 *   <li>benchmarkChainedHashTableFnv1aGet: Same lookup with the FNV-1a hasher instead of the natural one.
 * </ul>
 * </p>
 *
 * <p>Expected cost per operation is O(1 + load factor) for both put and get; resizing takes O(n) time
 * but is amortized over all insertions.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
public class ChainedHashTableBenchmark {

    @Param({"1024", "4096", "16384"})
    public int mapSize;

    public List<String> keys;

    private Map<String, Integer> hashMap;
    private ChainedHashTable<String, Integer> table;
    private ChainedHashTable<CharSequence, Integer> fnvTable;

    @Setup(Level.Trial)
    public void setup() {
        keys = new ArrayList<>(mapSize);
        for (int i = 0; i < mapSize; i++) {
            keys.add("key" + i);
        }
        Collections.shuffle(keys);

        hashMap = new HashMap<>();
        table = new ChainedHashTable<>();
        fnvTable = new ChainedHashTable<>(ChainedHashTable.DEFAULT_INITIAL_CAPACITY,
                ChainedHashTable.DEFAULT_LOAD_FACTOR_THRESHOLD, HashFunctions.fnv1a());
        for (int i = 0; i < keys.size(); i++) {
            hashMap.put(keys.get(i), i);
            table.insert(keys.get(i), i);
            fnvTable.insert(keys.get(i), i);
        }
    }

    @Benchmark
    public Map<String, Integer> benchmarkHashMapPut() {
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            map.put(keys.get(i), i);
        }
        return map;
    }

    @Benchmark
    public ChainedHashTable<String, Integer> benchmarkChainedHashTablePut() {
        ChainedHashTable<String, Integer> t = new ChainedHashTable<>();
        for (int i = 0; i < keys.size(); i++) {
            t.insert(keys.get(i), i);
        }
        return t;
    }

    @Benchmark
    public int benchmarkHashMapGet() {
        int sum = 0;
        for (String key : keys) {
            sum += hashMap.get(key);
        }
        return sum;
    }

    @Benchmark
    public int benchmarkChainedHashTableGet() {
        int sum = 0;
        for (String key : keys) {
            sum += table.search(key);
        }
        return sum;
    }

    @Benchmark
    public int benchmarkChainedHashTableFnv1aGet() {
        int sum = 0;
        for (String key : keys) {
            sum += fnvTable.search(key);
        }
        return sum;
    }
}
