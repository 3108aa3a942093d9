package org.databridge.hierarchy.test;

import org.databridge.hierarchy.SampleProjects;
import org.databridge.hierarchy.compiler.CompiledProject;
import org.databridge.hierarchy.compiler.ProjectCompiler;
import org.databridge.hierarchy.compiler.RenderedProject;
import org.databridge.hierarchy.compiler.SourceMapping;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.resolve.DependencyResolver;
import org.databridge.hierarchy.resolve.EvaluationOrder;
import org.databridge.hierarchy.script.ArtifactKind;
import org.databridge.hierarchy.script.NodeSelection;
import org.databridge.hierarchy.script.ScriptAssembler;
import org.databridge.hierarchy.script.ScriptBundle;
import org.databridge.hierarchy.script.ScriptOptions;
import org.databridge.hierarchy.transpiler.SQLDialect;
import org.databridge.hierarchy.transpiler.SQLGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Executes generated Postgres SQL on in-memory DuckDB to check runtime semantics.
 */
@DisplayName("DuckDB execution of generated formula SQL")
class DuckDBFormulaExecutionTest {

    private static final double DELTA = 1e-9;

    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            connection.close();
        }
    }

    private void execute(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Runs every statement of a generated script, one at a time.
     */
    private void executeScript(String script) throws SQLException {
        for (String statement : script.split(";\n")) {
            boolean onlyComments = statement.lines().allMatch(line -> line.isBlank() || line.startsWith("--"));
            if (!onlyComments) {
                execute(statement);
            }
        }
    }

    private static RenderedProject renderPostgres(ProjectSnapshot snapshot, SourceMapping mapping) {
        EvaluationOrder order = new DependencyResolver().resolve(snapshot);
        CompiledProject compiled = new ProjectCompiler(mapping).compile(snapshot, order);
        return compiled.render(new SQLGenerator(SQLDialect.POSTGRES));
    }

    /**
     * Evaluates one node's inline SQL against every source row, ordered by the row id.
     */
    private List<Double> evaluate(String nodeSql) throws SQLException {
        String query = "SELECT CAST(" + nodeSql + " AS DOUBLE) FROM HIERARCHY_SOURCE \"src\" ORDER BY \"src\".\"id\"";
        System.out.println("Query: " + query);
        List<Double> values = new ArrayList<>();
        try (Statement stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(query)) {
            while (rs.next()) {
                double value = rs.getDouble(1);
                values.add(rs.wasNull() ? null : value);
            }
        }
        return values;
    }

    @Nested
    @DisplayName("Formula groups")
    class FormulaGroups {

        @BeforeEach
        void createSource() throws SQLException {
            execute("CREATE TABLE HIERARCHY_SOURCE (id INTEGER, a_value INTEGER, b_value INTEGER, c_value INTEGER)");
            execute("INSERT INTO HIERARCHY_SOURCE VALUES (1, 3, 4, 5), (2, 7, 0, 1)");
        }

        private List<Double> evaluate(FormulaGroup group) throws SQLException {
            Map<String, FormulaGroup> formulas = new LinkedHashMap<>();
            formulas.put("RESULT", group);
            RenderedProject rendered = renderPostgres(SampleProjects.snapshot(formulas, "A", "B", "C"),
                    SourceMapping.DEFAULT);
            return DuckDBFormulaExecutionTest.this.evaluate(rendered.sqlOf("RESULT"));
        }

        @Test
        @DisplayName("Division by zero yields NULL instead of an error")
        void testDivisionByZeroIsNull() throws SQLException {
            // GIVEN: A / B where B is 0 on the second row
            FormulaGroup group = FormulaGroup.of("Ratio",
                    FormulaRule.hierarchy("A", RuleOperation.ADD, 1),
                    FormulaRule.hierarchy("B", RuleOperation.DIVIDE, 1));

            // WHEN
            List<Double> values = evaluate(group);

            // THEN: 3 / 4 without integer truncation, then NULL
            assertEquals(0.75, values.get(0), DELTA);
            assertNull(values.get(1));
        }

        @Test
        @DisplayName("Each tier reduces fully before the next")
        void testTierReduction() throws SQLException {
            // GIVEN: [1] A + B; [2] * 2
            FormulaGroup group = FormulaGroup.of("Doubled",
                    FormulaRule.constant(2, RuleOperation.MULTIPLY, 2),
                    FormulaRule.hierarchy("A", RuleOperation.ADD, 1),
                    FormulaRule.hierarchy("B", RuleOperation.ADD, 1));

            // THEN: (3 + 4) * 2 and (7 + 0) * 2
            assertEquals(List.of(14.0, 14.0), evaluate(group));
        }

        @Test
        @DisplayName("Same-tier rules apply in list order through the accumulator")
        void testSameTierListOrder() throws SQLException {
            // GIVEN: [1] A * B + C, folded left to right
            FormulaGroup group = FormulaGroup.of("Mixed",
                    FormulaRule.hierarchy("A", RuleOperation.ADD, 1),
                    FormulaRule.hierarchy("B", RuleOperation.MULTIPLY, 1),
                    FormulaRule.hierarchy("C", RuleOperation.ADD, 1));

            assertEquals(List.of(17.0, 1.0), evaluate(group));
        }

        @Test
        @DisplayName("A leading SUBTRACT negates its operand")
        void testSubtractSeed() throws SQLException {
            FormulaGroup group = FormulaGroup.of("Net",
                    FormulaRule.hierarchy("A", RuleOperation.SUBTRACT, 1),
                    FormulaRule.hierarchy("C", RuleOperation.ADD, 1));

            assertEquals(List.of(2.0, -6.0), evaluate(group));
        }

        @Test
        @DisplayName("Aggregate rules add the aggregate of their operand")
        void testAggregateRule() throws SQLException {
            FormulaGroup group = FormulaGroup.of("Agg",
                    FormulaRule.hierarchy("A", RuleOperation.ADD, 1),
                    FormulaRule.hierarchy("C", RuleOperation.MAX, 1));

            assertEquals(List.of(8.0, 8.0), evaluate(group));
        }
    }

    @Nested
    @DisplayName("Income statement")
    class IncomeStatement {

        private final SourceMapping mapping = SourceMapping.DEFAULT.withKeyColumns(List.of("region"));

        @BeforeEach
        void createSource() throws SQLException {
            execute("CREATE TABLE HIERARCHY_SOURCE (id INTEGER, region VARCHAR, product_rev_value INTEGER,"
                    + " service_rev_value INTEGER, cogs_value INTEGER)");
            execute("INSERT INTO HIERARCHY_SOURCE VALUES (1, 'EAST', 70, 30, 40), (2, 'WEST', 0, 0, 10)");
        }

        @Test
        @DisplayName("Inline expressions compute totals, profit and a guarded margin")
        void testInlineExpressions() throws SQLException {
            RenderedProject rendered = renderPostgres(SampleProjects.incomeStatement(), mapping);

            assertEquals(List.of(100.0, 0.0), evaluate(rendered.sqlOf("TOTAL_REVENUE")));
            assertEquals(List.of(60.0, -10.0), evaluate(rendered.sqlOf("GROSS_PROFIT")));

            List<Double> margin = evaluate(rendered.sqlOf("GROSS_MARGIN_PCT"));
            assertEquals(60.0, margin.get(0), DELTA);
            assertNull(margin.get(1));
        }

        @Test
        @DisplayName("The layered view returns one row per node and key")
        void testLayeredView() throws SQLException {
            // GIVEN
            ProjectSnapshot snapshot = SampleProjects.incomeStatement();
            EvaluationOrder order = new DependencyResolver().resolve(snapshot);
            CompiledProject compiled = new ProjectCompiler(mapping).compile(snapshot, order);
            ScriptBundle bundle = new ScriptAssembler(mapping, ScriptOptions.DEFAULT).generate(snapshot, order,
                    compiled, NodeSelection.all(), Set.of(ArtifactKind.VIEW), SQLDialect.POSTGRES, false);
            String script = bundle.script(ArtifactKind.VIEW);
            System.out.println(script);

            // WHEN
            executeScript(script);

            // THEN
            Map<String, Double> east = new LinkedHashMap<>();
            String query = "SELECT hierarchy_id, CAST(node_value AS DOUBLE) FROM vw_demo_income_hierarchy_values"
                    + " WHERE region = 'EAST' ORDER BY hierarchy_id";
            try (Statement stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(query)) {
                while (rs.next()) {
                    east.put(rs.getString(1), rs.getDouble(2));
                }
            }
            assertEquals(6, east.size());
            assertEquals(40.0, east.get("COGS"), DELTA);
            assertEquals(100.0, east.get("TOTAL_REVENUE"), DELTA);
            assertEquals(60.0, east.get("GROSS_PROFIT"), DELTA);
            assertEquals(60.0, east.get("GROSS_MARGIN_PCT"), DELTA);

            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM vw_demo_income_hierarchy_values"
                         + " WHERE region = 'WEST' AND hierarchy_id = 'GROSS_MARGIN_PCT' AND node_value IS NULL")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1));
            }
        }

        @Test
        @DisplayName("The insert script fills the target table in dependency order")
        void testInsertScript() throws SQLException {
            // GIVEN
            ProjectSnapshot snapshot = SampleProjects.incomeStatement();
            EvaluationOrder order = new DependencyResolver().resolve(snapshot);
            CompiledProject compiled = new ProjectCompiler(mapping).compile(snapshot, order);
            ScriptBundle bundle = new ScriptAssembler(mapping, ScriptOptions.DEFAULT).generate(snapshot, order,
                    compiled, NodeSelection.all(), Set.of(ArtifactKind.INSERT), SQLDialect.POSTGRES, false);
            execute("CREATE TABLE hierarchy_values (project_id VARCHAR, hierarchy_id VARCHAR,"
                    + " hierarchy_name VARCHAR, region VARCHAR, node_value DOUBLE)");

            // WHEN
            executeScript(bundle.script(ArtifactKind.INSERT));

            // THEN
            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*), SUM(node_value) FROM hierarchy_values"
                         + " WHERE region = 'EAST'")) {
                assertTrue(rs.next());
                assertEquals(6, rs.getInt(1));
                // 70 + 30 + 40 + 100 + 60 + 60
                assertEquals(360.0, rs.getDouble(2), DELTA);
            }
        }
    }
}
