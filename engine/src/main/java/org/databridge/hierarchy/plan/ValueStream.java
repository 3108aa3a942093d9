package org.databridge.hierarchy.plan;

import java.util.List;
import java.util.Objects;

/**
 * The rows an aggregate runs over.
 */
public sealed interface ValueStream permits ValueStream.ScalarValues, ValueStream.ExternalColumn {

    /**
     * A fixed list of scalar values, one row each.
     */
    record ScalarValues(List<Expression> values) implements ValueStream {
        public ScalarValues {
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Value stream cannot be empty");
            }
        }
    }

    /**
     * Every row of one column of an external table.
     */
    record ExternalColumn(QualifiedName table, String column) implements ValueStream {
        public ExternalColumn {
            Objects.requireNonNull(table, "Table cannot be null");
            Objects.requireNonNull(column, "Column cannot be null");
        }
    }
}
