package org.databridge.hierarchy.plan;

import java.util.Objects;

/**
 * CAST expression: CAST(expr AS decimal), where the decimal type name comes from the
 * dialect.
 */
public record CastExpression(Expression source) implements Expression {

    public CastExpression {
        Objects.requireNonNull(source, "Cast source cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCast(this);
    }

    @Override
    public String toString() {
        return "CAST(" + source + " AS DECIMAL)";
    }
}
