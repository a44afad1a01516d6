package com.linesplit.strategy;

import lombok.Getter;

import java.util.function.Supplier;

/**
 * The fixed set of measured strategies, in the order they run within a trial.
 */
public enum StrategyType {
    SPLIT("Split", SplitStrategy::new),
    INDEX_SUBSTRING("Substring", IndexSubstringStrategy::new),
    SLICE("Slice", SliceStrategy::new);

    @Getter
    private final String displayName;
    private final Supplier<ParseStrategy> factory;

    StrategyType(String displayName, Supplier<ParseStrategy> factory) {
        this.displayName = displayName;
        this.factory = factory;
    }

    public ParseStrategy newStrategy() {
        return factory.get();
    }
}
