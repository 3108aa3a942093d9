package org.databridge.hierarchy.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node value computed through nested derived tables, one per dependency rank:
 * <pre>
 * (SELECT "l"."GP" FROM (SELECT "l"."REV", ... AS "GP" FROM (SELECT "src"."rev_value" AS "REV") "l") "l")
 * </pre>
 * Every layer names each value it computes, so a dependency shared by several nodes is
 * written once instead of once per reference. The innermost layer reads the current row
 * of the enclosing query.
 *
 * @param layers Column name to value per layer, innermost first
 * @param alias  Alias of every layer, referenced by the next layer out
 * @param column The column of the outermost layer holding the node value
 */
public record LayeredSubquery(List<Map<String, Expression>> layers, String alias, String column)
        implements Expression {

    public LayeredSubquery {
        Objects.requireNonNull(layers, "Layers cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(column, "Column cannot be null");
        if (layers.isEmpty()) {
            throw new IllegalArgumentException("Layered subquery needs at least one layer");
        }
        layers = layers.stream()
                .map(layer -> Collections.unmodifiableMap(new LinkedHashMap<>(layer)))
                .toList();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLayeredSubquery(this);
    }

    @Override
    public String toString() {
        return "(" + alias + "." + column + " over " + layers.size() + " layer(s))";
    }
}
