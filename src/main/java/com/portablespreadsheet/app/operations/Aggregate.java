package com.portablespreadsheet.app.operations;

import java.util.List;
import java.util.Optional;

/**
 * Functions reducing the values of a range of cells.
 */
public enum Aggregate {
    SUM("sum"),
    PRODUCT("product"),
    MEAN("mean"),
    MINIMUM("minimum"),
    MAXIMUM("maximum"),
    STDEV("stdev"),
    MEDIAN("median"),
    COUNT("count"),
    IRR("irr"),
    MATCH_NEGATIVE_BEFORE_POSITIVE("matchNegativeBeforePositive");

    private final String grammarKey;

    Aggregate(String grammarKey) {
        this.grammarKey = grammarKey;
    }

    public String getGrammarKey() {
        return grammarKey;
    }

    public static Optional<Aggregate> fromGrammarKey(String key) {
        for (Aggregate aggregate : values()) {
            if (aggregate.grammarKey.equals(key)) {
                return Optional.of(aggregate);
            }
        }
        return Optional.empty();
    }

    public Object evaluate(List<Object> values) {
        switch (this) {
            case SUM:
                return CellValues.sum(values);
            case PRODUCT:
                return CellValues.product(values);
            case MEAN:
                return CellValues.mean(values);
            case MINIMUM:
                return CellValues.minimum(values);
            case MAXIMUM:
                return CellValues.maximum(values);
            case STDEV:
                return CellValues.stdev(values);
            case MEDIAN:
                return CellValues.median(values);
            case COUNT:
                return CellValues.count(values);
            case IRR:
                return CellValues.irr(values);
            default:
                return CellValues.matchNegativeBeforePositive(values);
        }
    }
}
