package com.linesplit.strategy;

import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;

final class Separators {

    private Separators() {}

    /**
     * Rejects separator positions that cannot delimit three fields: none found, or first == last.
     */
    static void check(String line, int first, int last) throws BenchException {
        if (first < 0 || first == last) {
            throw new BenchException(ErrorType.MALFORMED_INPUT,
                    "Expected two separators in request line: '" + line + "'");
        }
    }
}
