package com.linesplit.strategy;

import com.linesplit.error.BenchException;

/**
 * One way of splitting a request line into method, resource and HTTP version.
 * <p>
 * Implementations assume a well-formed line with exactly two single-space separators. Lines that
 * cannot yield three fields are rejected with {@link com.linesplit.error.ErrorType#MALFORMED_INPUT};
 * any other deviation is not checked.
 */
public interface ParseStrategy {

    /**
     * Derive the fields of {@code line} and hand them to {@code sink} exactly once.
     *
     * @throws BenchException if the line does not contain the separators needed for three fields
     */
    void parse(String line, FieldSink sink) throws BenchException;

    /**
     * Parse {@code line} into owned copies of its fields. Allocates; not for measured loops.
     */
    default ParsedFields parse(String line) throws BenchException {
        var captured = new ParsedFields[1];
        parse(line, (method, resource, httpVersion) ->
                captured[0] = new ParsedFields(method.toString(), resource.toString(), httpVersion.toString()));
        return captured[0];
    }
}
