package com.linesplit.strategy;

import com.linesplit.Constants;
import com.linesplit.error.BenchException;

/**
 * Locates the first and last separator and copies each field out with {@link String#substring}.
 */
public final class IndexSubstringStrategy implements ParseStrategy {

    @Override
    public void parse(String line, FieldSink sink) throws BenchException {
        int first = line.indexOf(Constants.SEPARATOR);
        int last = line.lastIndexOf(Constants.SEPARATOR);
        Separators.check(line, first, last);

        String method = line.substring(0, first);
        String resource = line.substring(first + 1, last);
        String httpVersion = line.substring(last + 1);
        sink.accept(method, resource, httpVersion);
    }
}
