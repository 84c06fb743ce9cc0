// file: core/src/main/java/io/neural/core/KeyHash.java
package io.neural.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Helper for hosts that address tables by string keys.
 * <p>
 * Tables only ever see 64-bit integer keys and never hash them again; callers
 * are expected to hand in a well-distributed value. This derives one from the
 * first 8 bytes of SHA-256 (big-endian), which spreads evenly over any shard count.
 * Two different strings may collide; resolving that is the caller's job.
 */
public final class KeyHash {

    private KeyHash() {
        // utility
    }

    public static long of(String key) {
        if (key == null) throw new IllegalArgumentException("key");
        return of(key.getBytes(StandardCharsets.UTF_8));
    }

    public static long of(byte[] key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] h = md.digest(key);
            return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /** Parse an unsigned decimal key, e.g. from a URL path segment. */
    public static long parseUnsigned(String decimal) {
        try {
            return Long.parseUnsignedLong(decimal);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("key must be an unsigned 64-bit integer: " + decimal, e);
        }
    }
}
