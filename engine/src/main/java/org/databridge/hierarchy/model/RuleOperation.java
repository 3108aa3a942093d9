package org.databridge.hierarchy.model;

/**
 * Operation a FormulaRule applies to the running accumulator of its tier.
 *
 * <p>The closed set is fixed: arithmetic operations combine the operand with the
 * accumulator, aggregate operations reduce the operand's value stream to a scalar term
 * that is then added to the accumulator.
 */
public enum RuleOperation {
    ADD(null),
    SUBTRACT(null),
    MULTIPLY(null),
    DIVIDE(null),
    SUM(Aggregation.SUM),
    AVERAGE(Aggregation.AVERAGE),
    COUNT(Aggregation.COUNT),
    MIN(Aggregation.MIN),
    MAX(Aggregation.MAX);

    private final Aggregation aggregation;

    RuleOperation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public boolean isAggregate() {
        return aggregation != null;
    }

    /**
     * @return The aggregation for aggregate operations
     * @throws IllegalStateException for arithmetic operations
     */
    public Aggregation aggregation() {
        if (aggregation == null) {
            throw new IllegalStateException(name() + " is not an aggregate operation");
        }
        return aggregation;
    }
}
