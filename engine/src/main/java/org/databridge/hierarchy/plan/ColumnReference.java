package org.databridge.hierarchy.plan;

import java.util.Objects;

/**
 * A value column read from an aliased relation: the source table, an external table or a
 * view layer.
 */
public record ColumnReference(String tableAlias, String columnName) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableAlias, "Table alias cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");
        if (tableAlias.isBlank()) {
            throw new IllegalArgumentException("Column " + columnName + " needs a table alias");
        }
    }

    public static ColumnReference of(String tableAlias, String columnName) {
        return new ColumnReference(tableAlias, columnName);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return tableAlias + "." + columnName;
    }
}
