package com.linesplit;

import com.linesplit.error.BenchException;
import com.linesplit.harness.BenchmarkConfig;
import com.linesplit.harness.LoggingRunListener;
import com.linesplit.harness.TimedRunExecutor;
import com.linesplit.harness.TrialOrchestrator;
import com.linesplit.probe.JvmProbe;
import com.linesplit.strategy.ConsumingSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full benchmark: every strategy, every trial, reported through the log.
 * Iterations and trials can be overridden with {@code -Dlinesplit.iterations} and {@code -Dlinesplit.trials}.
 */
public final class LineSplitBench {
    private static final Logger log = LoggerFactory.getLogger(LineSplitBench.class);

    private LineSplitBench() {}

    public static void main(String[] args) {
        try {
            var config = BenchmarkConfig.fromProperties(System.getProperties());
            var probe = JvmProbe.create();
            var orchestrator = new TrialOrchestrator(
                    config, new TimedRunExecutor(probe), new ConsumingSink(), new LoggingRunListener());
            orchestrator.run();
        } catch (BenchException e) {
            log.error("Benchmark aborted ({}): {}", e.getErrorType(), e.getMessage(), e);
            System.exit(1);
        }
    }
}
