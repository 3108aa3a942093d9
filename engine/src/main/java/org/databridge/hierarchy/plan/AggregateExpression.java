package org.databridge.hierarchy.plan;

import org.databridge.hierarchy.model.Aggregation;

import java.util.Objects;

/**
 * An aggregate over a {@link ValueStream}, rendered as a self-contained scalar sub-select
 * so it can sit anywhere a single value is expected.
 *
 * @param function The aggregate function
 * @param values   The rows to aggregate
 */
public record AggregateExpression(AggregateFunction function, ValueStream values) implements Expression {

    /**
     * Aggregate functions, named as all supported dialects spell them.
     */
    public enum AggregateFunction {
        SUM("SUM"),
        AVG("AVG"),
        COUNT("COUNT"),
        MIN("MIN"),
        MAX("MAX");

        private final String sql;

        AggregateFunction(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }

        public static AggregateFunction of(Aggregation aggregation) {
            return switch (aggregation) {
                case SUM -> SUM;
                case AVERAGE -> AVG;
                case COUNT -> COUNT;
                case MIN -> MIN;
                case MAX -> MAX;
            };
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        Objects.requireNonNull(values, "Aggregate values cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        return function.sql() + "(" + values + ")";
    }
}
