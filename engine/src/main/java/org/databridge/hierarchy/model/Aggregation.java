package org.databridge.hierarchy.model;

/**
 * Aggregations a TotalFormula (or an aggregate rule) can apply to a value stream.
 */
public enum Aggregation {
    SUM,
    AVERAGE,
    COUNT,
    MIN,
    MAX
}
