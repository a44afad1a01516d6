package com.linesplit.harness;

import com.linesplit.strategy.StrategyType;

/**
 * Observes a benchmark as it progresses.
 */
public interface RunListener {

    RunListener NONE = new RunListener() {
        @Override
        public void onRun(int trial, StrategyType type, RunResult result) {
        }

        @Override
        public void onComplete(BenchmarkSummary summary) {
        }
    };

    /**
     * Called as soon as a run finishes, before the next run starts.
     */
    void onRun(int trial, StrategyType type, RunResult result);

    void onComplete(BenchmarkSummary summary);
}
