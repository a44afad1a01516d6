package com.linesplit.harness;

import com.linesplit.strategy.StrategyType;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs of one strategy across trials, in trial order.
 */
public final class AggregateResult {

    @Getter
    private final StrategyType strategyType;
    private final List<RunResult> runs = new ArrayList<>();
    private final LongArrayList elapsedNanos = new LongArrayList();

    AggregateResult(StrategyType strategyType) {
        this.strategyType = strategyType;
    }

    void add(RunResult result) {
        runs.add(result);
        elapsedNanos.add(result.getElapsedNanos());
    }

    public List<RunResult> getRuns() {
        return Collections.unmodifiableList(runs);
    }

    public int getRunCount() {
        return runs.size();
    }

    /**
     * @return arithmetic mean of the elapsed time of every run, or 0 when there are none
     */
    public double getMeanElapsedMillis() {
        if (elapsedNanos.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (int i = 0; i < elapsedNanos.size(); i++) {
            total += elapsedNanos.getLong(i);
        }
        return total / elapsedNanos.size() / 1_000_000.0;
    }

    public long getTotalCollections() {
        long total = 0;
        for (var run : runs) {
            total += run.getCollectionDelta();
        }
        return total;
    }

    public double getMeanAllocatedBytesPerRun() {
        if (runs.isEmpty()) {
            return 0;
        }
        long total = 0;
        for (var run : runs) {
            total += run.getAllocatedBytes();
        }
        return (double) total / runs.size();
    }
}
