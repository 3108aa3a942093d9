package org.databridge.hierarchy.server;

import org.databridge.hierarchy.NotFoundException;
import org.databridge.hierarchy.SampleProjects;
import org.databridge.hierarchy.compiler.DanglingReferenceException;
import org.databridge.hierarchy.compiler.FailedDependencyException;
import org.databridge.hierarchy.model.Aggregation;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaKind;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.model.TotalFormula;
import org.databridge.hierarchy.resolve.CircularDependencyException;
import org.databridge.hierarchy.resolve.EvaluationOrder;
import org.databridge.hierarchy.script.ArtifactKind;
import org.databridge.hierarchy.script.NodeError;
import org.databridge.hierarchy.script.NodeSelection;
import org.databridge.hierarchy.script.ScriptBundle;
import org.databridge.hierarchy.store.InMemoryHierarchyStore;
import org.databridge.hierarchy.transpiler.SQLDialect;
import org.databridge.hierarchy.transpiler.UnsupportedDialectOperationException;
import org.databridge.hierarchy.validation.InvalidFormulaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.databridge.hierarchy.SampleProjects.PROJECT_ID;
import static org.junit.jupiter.api.Assertions.*;

class FormulaEngineServiceTest {

    private InMemoryHierarchyStore store;
    private FormulaEngineService service;

    @BeforeEach
    void setUp() {
        store = SampleProjects.incomeStatementStore();
        service = new FormulaEngineService(store);
    }

    @Test
    @DisplayName("Validation checks references against the project's current nodes")
    void testValidateFormula() {
        NodeFormula valid = service.validateFormula(PROJECT_ID, "GROSS_PROFIT", FormulaKind.TOTAL_FORMULA,
                "{\"aggregation\":\"SUM\",\"children\":[{\"hierarchyId\":\"COGS\"},{\"hierarchyId\":\"COGS\"}]}");
        assertEquals(List.of("COGS"), valid.referencedHierarchyIds());

        FormulaGroup unknown = FormulaGroup.of("G", FormulaRule.hierarchy("NOT_THERE", RuleOperation.ADD, 1));
        assertThrows(InvalidFormulaException.class,
                () -> service.validateFormula(PROJECT_ID, "GROSS_PROFIT", unknown));
    }

    @Test
    @DisplayName("Evaluation order reflects the stored formulas")
    void testResolveEvaluationOrder() {
        EvaluationOrder order = service.resolveEvaluationOrder(PROJECT_ID);

        assertEquals(List.of("TOTAL_REVENUE", "GROSS_PROFIT", "GROSS_MARGIN_PCT"), order.order());
    }

    @Test
    @DisplayName("A cycle introduced in the store surfaces as a circular dependency")
    void testCycleFromStore() {
        store.saveFormulaGroup(PROJECT_ID, "COGS",
                FormulaGroup.of("COGS", FormulaRule.hierarchy("GROSS_PROFIT", RuleOperation.ADD, 1)));

        CircularDependencyException e = assertThrows(CircularDependencyException.class,
                () -> service.resolveEvaluationOrder(PROJECT_ID));
        assertEquals(List.of("COGS", "GROSS_PROFIT"), e.cycle());
    }

    @Test
    @DisplayName("Node SQL covers base and formula nodes and is cached per dialect")
    void testCompileNode() {
        assertEquals("[src].[cogs_value]", service.compileNode(PROJECT_ID, "COGS", SQLDialect.SQL_SERVER));

        String first = service.compileNode(PROJECT_ID, "GROSS_PROFIT", SQLDialect.SNOWFLAKE);
        String second = service.compileNode(PROJECT_ID, "GROSS_PROFIT", SQLDialect.SNOWFLAKE);
        assertEquals(first, second);
        assertTrue(first.startsWith("(SELECT \"l\".\"GROSS_PROFIT\" FROM (SELECT "), first);
        assertTrue(first.contains("\"src\".\"cogs_value\" AS \"COGS\""), first);
        assertEquals(2L, service.cache().size());

        assertThrows(NotFoundException.class, () -> service.compileNode(PROJECT_ID, "NOPE", SQLDialect.POSTGRES));
        assertThrows(NotFoundException.class, () -> service.compileNode("other", "COGS", SQLDialect.POSTGRES));
    }

    @Test
    @DisplayName("A node depending on a deleted node fails to compile")
    void testCompileDanglingNode() {
        store.deleteNode(PROJECT_ID, "COGS");

        DanglingReferenceException e = assertThrows(DanglingReferenceException.class,
                () -> service.compileNode(PROJECT_ID, "GROSS_MARGIN_PCT", SQLDialect.POSTGRES));
        assertEquals(List.of("COGS"), e.missingIds());
        assertEquals("GROSS_PROFIT", e.via());
    }

    @Nested
    @DisplayName("Invalid stored formulas")
    class InvalidStoredFormulas {

        private static final String PROJECT = "broken";

        @BeforeEach
        void setUp() {
            // A = SUM(B) is valid, E reads C, C is stored invalid by each test
            store.createProject(PROJECT, "Broken");
            for (String id : List.of("A", "B", "C", "D", "E")) {
                store.saveNode(PROJECT, HierarchyNode.of(id, id));
            }
            store.saveTotalFormula(PROJECT, "A", TotalFormula.of(Aggregation.SUM, "B"));
            store.saveFormulaGroup(PROJECT, "E", FormulaGroup.of("E", FormulaRule.hierarchy("C", RuleOperation.ADD, 1)));
        }

        @Test
        @DisplayName("A rule with two operand sources fails its node, the rest of the project is generated")
        void testRuleWithTwoOperandSources() {
            // GIVEN
            store.saveFormulaGroup(PROJECT, "C", FormulaGroup.of("C",
                    new FormulaRule("D", "D", RuleOperation.ADD, 1, null, BigDecimal.valueOf(100), null, null)));

            // WHEN
            ScriptBundle bundle = service.generateScripts(PROJECT, NodeSelection.all(),
                    EnumSet.allOf(ArtifactKind.class), SQLDialect.POSTGRES);
            System.out.println(bundle.errors());

            // THEN
            assertInvalidAndPropagated(bundle);
            InvalidFormulaException e = assertThrows(InvalidFormulaException.class,
                    () -> service.compileNode(PROJECT, "C", SQLDialect.POSTGRES));
            assertEquals("D", e.violations().get(0).hierarchyId());
        }

        @Test
        @DisplayName("A total formula without children fails its node, the rest of the project is generated")
        void testTotalFormulaWithoutChildren() {
            // GIVEN
            store.saveTotalFormula(PROJECT, "C", new TotalFormula("C", Aggregation.SUM, List.of()));

            // WHEN
            ScriptBundle bundle = service.generateScripts(PROJECT, NodeSelection.all(),
                    EnumSet.of(ArtifactKind.INSERT, ArtifactKind.VIEW), SQLDialect.SNOWFLAKE);

            // THEN
            assertInvalidAndPropagated(bundle);
            assertThrows(InvalidFormulaException.class, () -> service.compileNode(PROJECT, "C", SQLDialect.SNOWFLAKE));
        }

        private void assertInvalidAndPropagated(ScriptBundle bundle) {
            assertEquals(List.of("B", "D", "A"), bundle.emittedNodeIds());
            assertTrue(bundle.script(ArtifactKind.INSERT).contains("-- A (TOTAL_FORMULA)"));
            assertFalse(bundle.script(ArtifactKind.VIEW).contains("'C'"));

            Map<String, NodeError> errors = new TreeMap<>();
            bundle.errors().forEach(error -> errors.put(error.hierarchyId(), error));
            assertEquals(Set.of("C", "E"), errors.keySet());
            assertEquals(NodeError.Reason.INVALID_FORMULA, errors.get("C").reason());
            assertFalse(errors.get("C").violations().isEmpty());
            assertEquals(NodeError.Reason.FAILED_DEPENDENCY, errors.get("E").reason());
            assertEquals("C", errors.get("E").via());

            FailedDependencyException e = assertThrows(FailedDependencyException.class,
                    () -> service.compileNode(PROJECT, "E", SQLDialect.POSTGRES));
            assertEquals("C", e.via());
            assertInstanceOf(InvalidFormulaException.class, e.getCause());
            assertNotNull(service.compileNode(PROJECT, "A", SQLDialect.POSTGRES));
        }
    }

    @Test
    @DisplayName("Single-dialect generation fails on unsupported kinds, all-dialect generation skips them")
    void testGenerateScripts() {
        Set<ArtifactKind> all = EnumSet.allOf(ArtifactKind.class);

        assertThrows(UnsupportedDialectOperationException.class,
                () -> service.generateScripts(PROJECT_ID, NodeSelection.all(), all, SQLDialect.MYSQL));

        Map<SQLDialect, ScriptBundle> bundles = service.generateScriptsForAllDialects(PROJECT_ID,
                NodeSelection.all(), all);
        assertEquals(SQLDialect.all(), List.copyOf(bundles.keySet()));
        assertEquals(List.of(ArtifactKind.DYNAMIC_TABLE), bundles.get(SQLDialect.MYSQL).unsupportedKinds());
        assertEquals(4, bundles.get(SQLDialect.SNOWFLAKE).scripts().size());
        assertEquals(3, bundles.get(SQLDialect.MYSQL).scripts().size());
    }
}
