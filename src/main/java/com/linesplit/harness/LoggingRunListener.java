package com.linesplit.harness;

import com.linesplit.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Reports collection counts per run and mean elapsed time per strategy through SLF4J.
 */
public final class LoggingRunListener implements RunListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingRunListener.class);

    @Override
    public void onRun(int trial, StrategyType type, RunResult result) {
        log.info("GC {}: {}", type.getDisplayName(), result.getCollectionDelta());
        if (log.isDebugEnabled()) {
            log.debug("trial {} {}: {} ms, {} bytes allocated", trial, type.getDisplayName(),
                    String.format(Locale.ROOT, "%.3f", result.getElapsedMillis()), result.getAllocatedBytes());
        }
    }

    @Override
    public void onComplete(BenchmarkSummary summary) {
        var line = new StringBuilder();
        for (var aggregate : summary.getAggregates()) {
            if (line.length() > 0) {
                line.append(", ");
            }
            line.append(aggregate.getStrategyType().getDisplayName().toLowerCase(Locale.ROOT))
                    .append(" avg: ")
                    .append(String.format(Locale.ROOT, "%.2f ms", aggregate.getMeanElapsedMillis()));
        }
        log.info("{}", line);
    }
}
