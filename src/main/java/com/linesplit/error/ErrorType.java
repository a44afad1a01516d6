package com.linesplit.error;

/**
 * Types of errors that can occur while running the benchmark.
 */
public enum ErrorType {
    MALFORMED_INPUT,
    PROBE_UNAVAILABLE,
    INVALID_CONFIGURATION
}
