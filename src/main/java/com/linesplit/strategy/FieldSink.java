package com.linesplit.strategy;

/**
 * Receives the three fields of a parsed request line.
 * <p>
 * Fields may be views into the parsed line rather than owned strings, and are only valid for the
 * duration of the call. Implementations that need to keep a field must copy it with
 * {@code toString()}.
 */
@FunctionalInterface
public interface FieldSink {

    /**
     * A sink that ignores its arguments.
     */
    FieldSink NOOP = (method, resource, httpVersion) -> { };

    void accept(CharSequence method, CharSequence resource, CharSequence httpVersion);
}
