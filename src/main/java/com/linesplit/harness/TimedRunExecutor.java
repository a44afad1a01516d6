package com.linesplit.harness;

import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;
import com.linesplit.probe.Probe;
import com.linesplit.strategy.FieldSink;
import com.linesplit.strategy.ParseStrategy;

import java.util.Objects;

/**
 * Drives a strategy through a fixed number of iterations and measures the run.
 * <p>
 * Iteration 0 is a warmup: the clock starts at the beginning of iteration 1 and stops right after
 * the last one, so a run of a single iteration has no measurement window and reports zero elapsed
 * time. Collection and allocation counters bracket the whole loop, warmup included.
 */
public final class TimedRunExecutor {

    private final Probe probe;

    public TimedRunExecutor(Probe probe) {
        this.probe = Objects.requireNonNull(probe, "Probe cannot be null");
    }

    /**
     * Run {@code strategy} over {@code line} {@code iterations} times, feeding every result to {@code sink}.
     *
     * @throws BenchException if {@code iterations} is negative, or whatever the strategy throws
     */
    public RunResult run(ParseStrategy strategy, String line, FieldSink sink, long iterations) throws BenchException {
        if (iterations < 0) {
            throw new BenchException(ErrorType.INVALID_CONFIGURATION, "Iterations must be non-negative: " + iterations);
        }
        if (iterations == 0) {
            return RunResult.EMPTY;
        }

        long collectionsBefore = probe.collectionCount();
        long bytesBefore = probe.allocatedBytes();

        long start = 0;
        boolean started = false;
        for (long i = 0; i < iterations; i++) {
            if (i == 1) {
                start = probe.now();
                started = true;
            }
            strategy.parse(line, sink);
        }
        long elapsed = started ? probe.now() - start : 0;

        long collectionsAfter = probe.collectionCount();
        long bytesAfter = probe.allocatedBytes();

        return new RunResult(
                Math.max(elapsed, 0),
                Math.max(collectionsAfter - collectionsBefore, 0),
                Math.max(bytesAfter - bytesBefore, 0));
    }
}
