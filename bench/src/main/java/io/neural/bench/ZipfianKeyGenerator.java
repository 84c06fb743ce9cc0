// file: bench/src/main/java/io/neural/bench/ZipfianKeyGenerator.java
package io.neural.bench;

import io.neural.core.KeyHash;

import java.util.Random;

/**
 * Zipf-distributed table keys.
 * <p>
 * Rank r in [0, n) is drawn with probability proportional to 1 / (r + 1)^skew,
 * then mapped to a pre-hashed 64-bit key ({@code KeyHash.of("key-" + r)}) so hot
 * ranks land on unrelated shards rather than neighboring ones.
 * <p>
 * Immutable after construction; callers bring their own Random per thread.
 */
public final class ZipfianKeyGenerator {

    private final double[] cdf;
    private final long[] keys;

    public ZipfianKeyGenerator(int n, double skew) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += 1.0 / Math.pow(i + 1, skew);
        }
        this.cdf = new double[n];
        this.keys = new long[n];
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += (1.0 / Math.pow(i + 1, skew)) / sum;
            cdf[i] = running;
            keys[i] = KeyHash.of("key-" + i);
        }
        cdf[n - 1] = 1.0; // absorb rounding
    }

    public int size() {
        return keys.length;
    }

    /** Rank for a uniform sample {@code u} in [0, 1]. */
    public int rank(double u) {
        int lo = 0;
        int hi = keys.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    public long keyAt(int rank) {
        return keys[rank];
    }

    public long next(Random rnd) {
        return keys[rank(rnd.nextDouble())];
    }
}
