package org.databridge.hierarchy.plan;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Represents a literal value.
 *
 * @param value       The literal value (null only for NULL literals)
 * @param literalType The type of the literal
 */
public record Literal(Object value, LiteralType literalType) implements Expression {

    public enum LiteralType {
        STRING,
        INTEGER,
        DECIMAL,
        BOOLEAN,
        NULL
    }

    public Literal {
        Objects.requireNonNull(literalType, "Literal type cannot be null");

        switch (literalType) {
            case STRING -> {
                if (!(value instanceof String)) {
                    throw new IllegalArgumentException("STRING literal must have String value");
                }
            }
            case INTEGER -> {
                if (!(value instanceof Long)) {
                    throw new IllegalArgumentException("INTEGER literal must have Long value");
                }
            }
            case DECIMAL -> {
                if (!(value instanceof BigDecimal)) {
                    throw new IllegalArgumentException("DECIMAL literal must have BigDecimal value");
                }
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                }
            }
            case NULL -> {
                if (value != null) {
                    throw new IllegalArgumentException("NULL literal cannot have a value");
                }
            }
        }
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal decimal(BigDecimal value) {
        return new Literal(value, LiteralType.DECIMAL);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal nullValue() {
        return new Literal(null, LiteralType.NULL);
    }

    /**
     * String factory that maps null to a NULL literal.
     */
    public static Literal stringOrNull(String value) {
        return value == null ? nullValue() : string(value);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return switch (literalType) {
            case NULL -> "NULL";
            case STRING -> "'" + value + "'";
            case DECIMAL -> ((BigDecimal) value).toPlainString();
            default -> String.valueOf(value);
        };
    }
}
