package com.linesplit.strategy;

import com.linesplit.Constants;
import com.linesplit.error.BenchException;
import com.linesplit.util.TextSlice;

/**
 * Locates the first and last separator and exposes each field as a {@link TextSlice} over the
 * original line.
 * <p>
 * The three slices belong to this instance and are re-pointed on every call, so parsing allocates
 * nothing. The fields handed to the sink are only valid until the next call to {@code parse} on
 * the same instance. Instances are not thread safe.
 */
public final class SliceStrategy implements ParseStrategy {

    private final TextSlice method = new TextSlice();
    private final TextSlice resource = new TextSlice();
    private final TextSlice httpVersion = new TextSlice();

    @Override
    public void parse(String line, FieldSink sink) throws BenchException {
        int first = line.indexOf(Constants.SEPARATOR);
        int last = line.lastIndexOf(Constants.SEPARATOR);
        Separators.check(line, first, last);

        method.wrap(line, 0, first);
        resource.wrap(line, first + 1, last);
        httpVersion.wrap(line, last + 1, line.length());
        sink.accept(method, resource, httpVersion);
    }
}
