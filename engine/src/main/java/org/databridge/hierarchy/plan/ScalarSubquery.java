package org.databridge.hierarchy.plan;

import java.util.Objects;

/**
 * A single value read from an external table:
 * <pre>
 * (SELECT ext."column" FROM table ext)
 * </pre>
 * The external table is expected to hold one row; more rows fail at query time.
 */
public record ScalarSubquery(ValueStream.ExternalColumn source) implements Expression {

    public ScalarSubquery {
        Objects.requireNonNull(source, "Source cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitScalarSubquery(this);
    }

    @Override
    public String toString() {
        return "(" + source.table() + "." + source.column() + ")";
    }
}
