package org.databridge.hierarchy.transpiler;

import org.databridge.hierarchy.plan.AggregateExpression;
import org.databridge.hierarchy.plan.ArithmeticExpression;
import org.databridge.hierarchy.plan.CaseExpression;
import org.databridge.hierarchy.plan.CastExpression;
import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.plan.ComparisonExpression;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.plan.ExpressionVisitor;
import org.databridge.hierarchy.plan.LayeredSubquery;
import org.databridge.hierarchy.plan.Literal;
import org.databridge.hierarchy.plan.ScalarSubquery;
import org.databridge.hierarchy.plan.ValueStream;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders an Expression tree into dialect-specific SQL text.
 *
 * <p>Output depends only on the tree and the dialect, so rendering the same tree twice
 * gives byte-identical SQL.
 */
public final class SQLGenerator implements ExpressionVisitor<String> {

    static final String STREAM_ALIAS = "v";
    static final String STREAM_COLUMN = "node_value";
    static final String EXTERNAL_ALIAS = "ext";

    private final SQLDialect dialect;

    public SQLGenerator(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Generates SQL from an expression.
     *
     * @param expression The expression to generate SQL for
     * @return The generated SQL string
     */
    public String generateExpression(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public String visitColumnReference(ColumnReference columnRef) {
        return dialect.quoteIdentifier(columnRef.tableAlias())
                + "." + dialect.quoteIdentifier(columnRef.columnName());
    }

    @Override
    public String visitLiteral(Literal literal) {
        return switch (literal.literalType()) {
            case STRING -> dialect.quoteStringLiteral((String) literal.value());
            case INTEGER -> String.valueOf(literal.value());
            case DECIMAL -> ((BigDecimal) literal.value()).toPlainString();
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case NULL -> dialect.formatNull();
        };
    }

    @Override
    public String visitArithmetic(ArithmeticExpression arithmetic) {
        String left = arithmetic.left().accept(this);
        String right = arithmetic.right().accept(this);
        return "(" + left + " " + arithmetic.sqlOperator() + " " + right + ")";
    }

    @Override
    public String visitCase(CaseExpression caseExpr) {
        return "CASE WHEN " + caseExpr.condition().accept(this)
                + " THEN " + caseExpr.thenValue().accept(this)
                + " ELSE " + caseExpr.elseValue().accept(this)
                + " END";
    }

    @Override
    public String visitComparison(ComparisonExpression comparison) {
        return comparison.left().accept(this) + " = " + comparison.right().accept(this);
    }

    @Override
    public String visitCast(CastExpression cast) {
        return "CAST(" + cast.source().accept(this) + " AS " + dialect.decimalType() + ")";
    }

    /**
     * Aggregates render as self-contained scalar sub-selects:
     * <pre>
     * (SELECT SUM("v"."node_value") FROM (SELECT a AS "node_value" UNION ALL SELECT b AS "node_value") "v")
     * (SELECT SUM("ext"."amount") FROM DB.T "ext")
     * </pre>
     */
    @Override
    public String visitAggregate(AggregateExpression aggregate) {
        String function = dialect.aggregateName(aggregate.function());
        ValueStream values = aggregate.values();
        if (values instanceof ValueStream.ScalarValues scalars) {
            String column = dialect.quoteIdentifier(STREAM_COLUMN);
            String rows = scalars.values().stream()
                    .map(value -> "SELECT " + value.accept(this) + " AS " + column)
                    .collect(Collectors.joining(" UNION ALL "));
            String alias = dialect.quoteIdentifier(STREAM_ALIAS);
            return "(SELECT " + function + "(" + alias + "." + column + ") FROM (" + rows + ") " + alias + ")";
        }
        ValueStream.ExternalColumn external = (ValueStream.ExternalColumn) values;
        return "(SELECT " + function + "(" + externalColumn(external) + ") FROM " + externalTable(external) + ")";
    }

    @Override
    public String visitScalarSubquery(ScalarSubquery subquery) {
        ValueStream.ExternalColumn external = subquery.source();
        return "(SELECT " + externalColumn(external) + " FROM " + externalTable(external) + ")";
    }

    @Override
    public String visitLayeredSubquery(LayeredSubquery subquery) {
        String alias = dialect.quoteIdentifier(subquery.alias());
        return "(SELECT " + alias + "." + dialect.quoteIdentifier(subquery.column())
                + " FROM " + generateLayers(subquery.layers(), subquery.alias(), null) + ")";
    }

    /**
     * Nests layers as derived tables, innermost first, each aliased {@code alias}:
     * <pre>
     * (SELECT ... FROM (SELECT ... FROM source) "l") "l"
     * </pre>
     *
     * @param source FROM clause of the innermost layer, or null when it reads the row of an
     *               enclosing query
     */
    public String generateLayers(List<Map<String, Expression>> layers, String alias, String source) {
        String quotedAlias = dialect.quoteIdentifier(alias);
        String from = source;
        for (Map<String, Expression> layer : layers) {
            List<String> columns = new ArrayList<>();
            layer.forEach((name, value) -> columns.add(value.accept(this) + " AS " + dialect.quoteIdentifier(name)));
            String select = "SELECT " + String.join(", ", columns) + (from == null ? "" : " FROM " + from);
            from = "(" + select + ") " + quotedAlias;
        }
        return from;
    }

    private String externalColumn(ValueStream.ExternalColumn external) {
        return dialect.quoteIdentifier(EXTERNAL_ALIAS) + "." + dialect.quoteIdentifier(external.column());
    }

    private String externalTable(ValueStream.ExternalColumn external) {
        return dialect.formatQualifiedName(external.table()) + " " + dialect.quoteIdentifier(EXTERNAL_ALIAS);
    }
}
