// file: core/src/main/java/io/neural/core/IncrementOp.java
package io.neural.core;

/**
 * One step of an increment: add {@code delta} to the numeric field at
 * {@code position} (1-based).
 */
public record IncrementOp(int position, long delta) {}
