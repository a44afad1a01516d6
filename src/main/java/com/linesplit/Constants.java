package com.linesplit;

public final class Constants {
    public static final String REFERENCE_LINE = "GET /css/styles.css HTTP/1.1";
    public static final char SEPARATOR = ' ';

    // 0..=20_000_000, iteration 0 is the warmup
    public static final long DEFAULT_ITERATIONS = 20_000_001L;
    public static final int DEFAULT_TRIALS = 10;

    public static final String ITERATIONS_PROPERTY = "linesplit.iterations";
    public static final String TRIALS_PROPERTY = "linesplit.trials";
    public static final String LINE_PROPERTY = "linesplit.line";

    private Constants() {}
}
