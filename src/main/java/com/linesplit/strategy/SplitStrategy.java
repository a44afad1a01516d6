package com.linesplit.strategy;

import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;

/**
 * Tokenizes the line into a new array of new strings and takes the first three tokens.
 * <p>
 * Tokens are separated by the single space character only, the same separator the index based
 * strategies search for; tabs and other whitespace stay inside a token.
 */
public final class SplitStrategy implements ParseStrategy {

    // single-char, non-regex-meta pattern: String.split takes its fast path and never compiles a regex
    private static final String SEPARATOR = " ";

    @Override
    public void parse(String line, FieldSink sink) throws BenchException {
        String[] parts = line.split(SEPARATOR);
        if (parts.length < 3) {
            throw new BenchException(ErrorType.MALFORMED_INPUT,
                    "Expected 3 space separated fields but found " + parts.length + ": '" + line + "'");
        }
        sink.accept(parts[0], parts[1], parts[2]);
    }
}
