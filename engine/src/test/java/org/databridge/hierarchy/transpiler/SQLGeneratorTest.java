package org.databridge.hierarchy.transpiler;

import org.databridge.hierarchy.plan.AggregateExpression;
import org.databridge.hierarchy.plan.ArithmeticExpression;
import org.databridge.hierarchy.plan.CaseExpression;
import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.plan.LayeredSubquery;
import org.databridge.hierarchy.plan.Literal;
import org.databridge.hierarchy.plan.QualifiedName;
import org.databridge.hierarchy.plan.ScalarSubquery;
import org.databridge.hierarchy.plan.ValueStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SQLGeneratorTest {

    private static final Expression GUARDED_DIVISION = CaseExpression.nullSafeDivide(
            ColumnReference.of("src", "a_value"),
            ColumnReference.of("src", "b_value"));

    @Nested
    @DisplayName("Division guard per dialect")
    class DivisionGuard {

        @Test
        @DisplayName("Snowflake casts to NUMBER")
        void testSnowflake() {
            assertEquals("CASE WHEN \"src\".\"b_value\" = 0 THEN NULL"
                            + " ELSE (CAST(\"src\".\"a_value\" AS NUMBER(38, 10)) / \"src\".\"b_value\") END",
                    new SQLGenerator(SQLDialect.SNOWFLAKE).generateExpression(GUARDED_DIVISION));
        }

        @Test
        @DisplayName("Postgres casts to NUMERIC")
        void testPostgres() {
            assertEquals("CASE WHEN \"src\".\"b_value\" = 0 THEN NULL"
                            + " ELSE (CAST(\"src\".\"a_value\" AS NUMERIC(38, 10)) / \"src\".\"b_value\") END",
                    new SQLGenerator(SQLDialect.POSTGRES).generateExpression(GUARDED_DIVISION));
        }

        @Test
        @DisplayName("MySQL uses backticks and DECIMAL")
        void testMySql() {
            assertEquals("CASE WHEN `src`.`b_value` = 0 THEN NULL"
                            + " ELSE (CAST(`src`.`a_value` AS DECIMAL(38, 10)) / `src`.`b_value`) END",
                    new SQLGenerator(SQLDialect.MYSQL).generateExpression(GUARDED_DIVISION));
        }

        @Test
        @DisplayName("SQL Server uses brackets and DECIMAL")
        void testSqlServer() {
            assertEquals("CASE WHEN [src].[b_value] = 0 THEN NULL"
                            + " ELSE (CAST([src].[a_value] AS DECIMAL(38, 10)) / [src].[b_value]) END",
                    new SQLGenerator(SQLDialect.SQL_SERVER).generateExpression(GUARDED_DIVISION));
        }
    }

    @Test
    @DisplayName("Literals render per type and dialect")
    void testLiterals() {
        SQLGenerator sqlServer = new SQLGenerator(SQLDialect.SQL_SERVER);

        assertEquals("'it''s'", sqlServer.generateExpression(Literal.string("it's")));
        assertEquals("NULL", sqlServer.generateExpression(Literal.stringOrNull(null)));
        assertEquals("1", sqlServer.generateExpression(Literal.bool(true)));
        assertEquals("42", sqlServer.generateExpression(Literal.integer(42)));
        assertEquals("0.000001", sqlServer.generateExpression(Literal.decimal(new BigDecimal("1E-6"))));
    }

    @Test
    @DisplayName("Nested arithmetic is fully parenthesized")
    void testArithmetic() {
        Expression expression = ArithmeticExpression.multiply(
                ArithmeticExpression.subtract(Literal.integer(0), ColumnReference.of("src", "x")),
                Literal.integer(2));

        assertEquals("((0 - `src`.`x`) * 2)", new SQLGenerator(SQLDialect.MYSQL).generateExpression(expression));
    }

    @Test
    @DisplayName("Aggregates over external columns and scalar sub-selects read the external table")
    void testExternalColumns() {
        ValueStream.ExternalColumn external =
                new ValueStream.ExternalColumn(QualifiedName.of("FINANCE", "ADJ"), "amount");
        SQLGenerator sqlServer = new SQLGenerator(SQLDialect.SQL_SERVER);

        assertEquals("(SELECT MAX([ext].[amount]) FROM FINANCE.ADJ [ext])", sqlServer.generateExpression(
                new AggregateExpression(AggregateExpression.AggregateFunction.MAX, external)));
        assertEquals("(SELECT [ext].[amount] FROM FINANCE.ADJ [ext])",
                sqlServer.generateExpression(new ScalarSubquery(external)));
    }

    @Test
    @DisplayName("Value streams alias their single column for every dialect")
    void testValueStream() {
        Expression count = new AggregateExpression(AggregateExpression.AggregateFunction.COUNT,
                new ValueStream.ScalarValues(List.of(Literal.integer(1), Literal.integer(2))));

        assertEquals("(SELECT COUNT([v].[node_value]) FROM (SELECT 1 AS [node_value] UNION ALL SELECT 2 AS [node_value]) [v])",
                new SQLGenerator(SQLDialect.SQL_SERVER).generateExpression(count));
    }

    @Test
    @DisplayName("Layers nest innermost first, correlated or over a source table")
    void testLayers() {
        Map<String, Expression> base = new LinkedHashMap<>();
        base.put("A", ColumnReference.of("src", "a_value"));
        Map<String, Expression> sum = new LinkedHashMap<>();
        sum.put("A", ColumnReference.of("l", "A"));
        sum.put("S", ArithmeticExpression.add(ColumnReference.of("l", "A"), ColumnReference.of("l", "A")));
        SQLGenerator sqlServer = new SQLGenerator(SQLDialect.SQL_SERVER);

        assertEquals("(SELECT [l].[S] FROM (SELECT [l].[A] AS [A], ([l].[A] + [l].[A]) AS [S]"
                        + " FROM (SELECT [src].[a_value] AS [A]) [l]) [l])",
                sqlServer.generateExpression(new LayeredSubquery(List.of(base, sum), "l", "S")));
        assertEquals("(SELECT [l].[A] AS [A], ([l].[A] + [l].[A]) AS [S]"
                        + " FROM (SELECT [src].[a_value] AS [A] FROM SOURCE [src]) [l]) [l]",
                sqlServer.generateLayers(List.of(base, sum), "l", "SOURCE [src]"));
    }
}
