package org.databridge.hierarchy.plan;

import java.util.Objects;

/**
 * A single-branch conditional:
 *
 * <pre>
 * CASE WHEN condition THEN thenValue ELSE elseValue END
 * </pre>
 */
public record CaseExpression(
        Expression condition,
        Expression thenValue,
        Expression elseValue
) implements Expression {

    public CaseExpression {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(thenValue, "Then value cannot be null");
        Objects.requireNonNull(elseValue, "Else value cannot be null");
    }

    /**
     * Guarded division: NULL when the divisor is zero, the quotient otherwise. The dividend
     * is cast to the exact decimal type so integer operands do not truncate.
     */
    public static CaseExpression nullSafeDivide(Expression dividend, Expression divisor) {
        return new CaseExpression(
                ComparisonExpression.isZero(divisor),
                Literal.nullValue(),
                ArithmeticExpression.divide(new CastExpression(dividend), divisor));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCase(this);
    }

    @Override
    public String toString() {
        return "CASE WHEN " + condition + " THEN " + thenValue + " ELSE " + elseValue + " END";
    }
}
