package com.linesplit.strategy;

import lombok.Value;

/**
 * Owned copy of the three fields of a request line.
 */
@Value
public class ParsedFields {
    String method;
    String resource;
    String httpVersion;
}
