package com.linesplit.harness;

import com.linesplit.error.BenchException;
import com.linesplit.strategy.FieldSink;
import com.linesplit.strategy.ParseStrategy;
import com.linesplit.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Repeats a timed run of every strategy for a number of trials and aggregates the results.
 * <p>
 * Within a trial strategies always run in {@link StrategyType} declaration order; later strategies
 * may profit from caches warmed by earlier ones, and keeping the order fixed keeps results
 * comparable between benchmarks. Everything runs on the calling thread.
 */
public final class TrialOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TrialOrchestrator.class);

    private final BenchmarkConfig config;
    private final TimedRunExecutor executor;
    private final FieldSink sink;
    private final RunListener listener;

    public TrialOrchestrator(BenchmarkConfig config, TimedRunExecutor executor, FieldSink sink, RunListener listener) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.sink = Objects.requireNonNull(sink, "Sink cannot be null");
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
    }

    public BenchmarkSummary run() throws BenchException {
        config.validate();

        Map<StrategyType, ParseStrategy> strategies = new EnumMap<>(StrategyType.class);
        for (var type : StrategyType.values()) {
            strategies.put(type, type.newStrategy());
        }

        log.debug("Running {} trials of {} iterations over '{}'", config.getTrials(), config.getIterations(), config.getLine());
        var summary = new BenchmarkSummary();
        for (int trial = 0; trial < config.getTrials(); trial++) {
            for (var entry : strategies.entrySet()) {
                var result = executor.run(entry.getValue(), config.getLine(), sink, config.getIterations());
                summary.record(entry.getKey(), result);
                listener.onRun(trial, entry.getKey(), result);
            }
        }
        listener.onComplete(summary);
        return summary;
    }
}
