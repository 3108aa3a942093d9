package org.databridge.hierarchy.plan;

import java.util.Objects;

/**
 * Equality test between two values. Only division guards build one.
 */
public record ComparisonExpression(Expression left, Expression right) implements Expression {

    public ComparisonExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ComparisonExpression isZero(Expression value) {
        return new ComparisonExpression(value, Literal.integer(0));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
