// file: bench/src/test/java/io/neural/bench/ZipfianKeyGeneratorTest.java
package io.neural.bench;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ZipfianKeyGeneratorTest {

    @Test
    void ranks_cover_the_whole_range() {
        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(100, 0.99);

        assertEquals(0, zipf.rank(0.0));
        assertEquals(99, zipf.rank(1.0));
    }

    @Test
    void low_ranks_are_hot() {
        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(1000, 1.2);
        Random rnd = new Random(7);
        long hottest = zipf.keyAt(0);
        long coldest = zipf.keyAt(999);

        int hot = 0;
        int cold = 0;
        for (int i = 0; i < 20_000; i++) {
            long k = zipf.next(rnd);
            if (k == hottest) hot++;
            if (k == coldest) cold++;
        }
        assertTrue(hot > 1000, "rank 0 drawn " + hot + " times");
        assertTrue(hot > cold * 50);
    }

    @Test
    void ranks_map_to_distinct_keys() {
        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(5000, 0.99);
        Set<Long> keys = new HashSet<>();
        for (int r = 0; r < zipf.size(); r++) {
            keys.add(zipf.keyAt(r));
        }
        assertEquals(5000, keys.size());
    }

    @Test
    void rejects_bad_parameters() {
        assertThrows(IllegalArgumentException.class, () -> new ZipfianKeyGenerator(0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ZipfianKeyGenerator(10, 0.0));
    }

    @Test
    void percentile_interpolates() {
        List<Double> sorted = List.of(1.0, 2.0, 3.0, 4.0);

        assertEquals(1.0, TableBench.percentile(sorted, 0.0));
        assertEquals(2.5, TableBench.percentile(sorted, 0.5), 1e-9);
        assertEquals(4.0, TableBench.percentile(sorted, 1.0));
        assertTrue(Double.isNaN(TableBench.percentile(List.of(), 0.5)));
    }
}
