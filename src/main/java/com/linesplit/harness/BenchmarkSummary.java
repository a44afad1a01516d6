package com.linesplit.harness;

import com.linesplit.strategy.StrategyType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-strategy results of a benchmark, filled in by {@link TrialOrchestrator} as trials complete.
 */
public final class BenchmarkSummary {

    private final Map<StrategyType, AggregateResult> aggregates = new EnumMap<>(StrategyType.class);

    BenchmarkSummary() {
        for (var type : StrategyType.values()) {
            aggregates.put(type, new AggregateResult(type));
        }
    }

    void record(StrategyType type, RunResult result) {
        aggregates.get(type).add(result);
    }

    public AggregateResult get(StrategyType type) {
        return aggregates.get(type);
    }

    /**
     * @return one aggregate per strategy, in execution order
     */
    public List<AggregateResult> getAggregates() {
        return new ArrayList<>(aggregates.values());
    }

    public int getTotalRuns() {
        int total = 0;
        for (var aggregate : aggregates.values()) {
            total += aggregate.getRunCount();
        }
        return total;
    }
}
