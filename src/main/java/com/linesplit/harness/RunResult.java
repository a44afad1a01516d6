package com.linesplit.harness;

import lombok.Value;

/**
 * Measurements of one timed run of one strategy.
 */
@Value
public class RunResult {
    public static final RunResult EMPTY = new RunResult(0, 0, 0);

    /**
     * Time spent from the start of iteration 1 to the end of the last iteration.
     */
    long elapsedNanos;
    /**
     * Young-generation collections observed while the run executed, warmup iteration included.
     */
    long collectionDelta;
    /**
     * Bytes allocated by the measuring thread while the run executed, warmup iteration included.
     */
    long allocatedBytes;

    public double getElapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
