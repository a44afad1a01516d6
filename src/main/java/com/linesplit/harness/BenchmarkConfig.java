package com.linesplit.harness;

import com.linesplit.Constants;
import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;
import lombok.Builder;
import lombok.Value;

import java.util.Properties;

/**
 * Parameters of a benchmark: the parsed line, iterations per run and number of trials.
 */
@Value
@Builder(toBuilder = true)
public class BenchmarkConfig {
    @Builder.Default
    String line = Constants.REFERENCE_LINE;
    @Builder.Default
    long iterations = Constants.DEFAULT_ITERATIONS;
    @Builder.Default
    int trials = Constants.DEFAULT_TRIALS;

    public static BenchmarkConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by {@code linesplit.line}, {@code linesplit.iterations} and
     * {@code linesplit.trials} where present.
     *
     * @throws BenchException if an override is not a valid value
     */
    public static BenchmarkConfig fromProperties(Properties properties) throws BenchException {
        var builder = builder();
        var line = properties.getProperty(Constants.LINE_PROPERTY);
        if (line != null) {
            builder.line(line);
        }
        var iterations = properties.getProperty(Constants.ITERATIONS_PROPERTY);
        if (iterations != null) {
            builder.iterations(parseLong(Constants.ITERATIONS_PROPERTY, iterations));
        }
        var trials = properties.getProperty(Constants.TRIALS_PROPERTY);
        if (trials != null) {
            builder.trials(parseInt(Constants.TRIALS_PROPERTY, trials));
        }
        return builder.build().validate();
    }

    private static long parseLong(String key, String value) throws BenchException {
        try {
            return Long.parseLong(value.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new BenchException(ErrorType.INVALID_CONFIGURATION,
                    "Property " + key + " is not a number: '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) throws BenchException {
        long parsed = parseLong(key, value);
        if (parsed < 0 || parsed > Integer.MAX_VALUE) {
            throw new BenchException(ErrorType.INVALID_CONFIGURATION,
                    "Property " + key + " must be between 0 and " + Integer.MAX_VALUE + ": '" + value + "'");
        }
        return (int) parsed;
    }

    /**
     * @return this config
     * @throws BenchException if the line is missing or a count is negative
     */
    public BenchmarkConfig validate() throws BenchException {
        if (line == null) {
            throw new BenchException(ErrorType.INVALID_CONFIGURATION, "Line cannot be null");
        }
        if (iterations < 0) {
            throw new BenchException(ErrorType.INVALID_CONFIGURATION, "Iterations must be non-negative: " + iterations);
        }
        if (trials < 0) {
            throw new BenchException(ErrorType.INVALID_CONFIGURATION, "Trials must be non-negative: " + trials);
        }
        return this;
    }
}
