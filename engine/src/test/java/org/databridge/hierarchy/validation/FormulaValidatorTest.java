package org.databridge.hierarchy.validation;

import org.databridge.hierarchy.model.Aggregation;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.HierarchyRef;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.model.TotalFormula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaValidatorTest {

    private static final Set<String> NODES = Set.of("REVENUE", "COGS", "X", "TOTAL", "GP", "A", "B");

    private final FormulaValidator validator = new FormulaValidator();

    @Nested
    @DisplayName("Total formulas")
    class TotalFormulas {

        @Test
        @DisplayName("Duplicate children are removed, first occurrence wins")
        void testDuplicateChildrenNormalized() {
            // GIVEN
            TotalFormula formula = new TotalFormula("Total", Aggregation.SUM, List.of(
                    new HierarchyRef("A", "First A"),
                    new HierarchyRef("B", "B"),
                    new HierarchyRef("A", "Second A")));

            // WHEN
            TotalFormula normalized = validator.validateTotalFormula("TOTAL", formula, NODES);

            // THEN
            assertEquals(List.of("A", "B"), normalized.referencedHierarchyIds());
            assertEquals("First A", normalized.children().get(0).hierarchyName());
            assertEquals("Total", normalized.mainHierarchyName());
        }

        @Test
        @DisplayName("Empty children, self reference and unknown children are all reported")
        void testViolationsCollected() {
            TotalFormula selfAndUnknown = TotalFormula.of(Aggregation.SUM, "TOTAL", "MISSING");

            InvalidFormulaException e = assertThrows(InvalidFormulaException.class,
                    () -> validator.validateTotalFormula("TOTAL", selfAndUnknown, NODES));

            assertEquals("TOTAL", e.hierarchyId());
            assertEquals(2, e.violations().size());
            assertEquals(0, e.violations().get(0).ruleIndex());
            assertEquals(1, e.violations().get(1).ruleIndex());
            assertEquals("MISSING", e.violations().get(1).hierarchyId());

            InvalidFormulaException empty = assertThrows(InvalidFormulaException.class,
                    () -> validator.validateTotalFormula("TOTAL", TotalFormula.of(Aggregation.MAX), NODES));
            assertEquals(Violation.NO_INDEX, empty.violations().get(0).ruleIndex());
        }
    }

    @Nested
    @DisplayName("Formula groups")
    class FormulaGroups {

        @Test
        @DisplayName("A rule with both a constant and a hierarchy id is rejected")
        void testMultipleOperandSources() {
            // GIVEN: constantNumber 100 and hierarchyId X on the same rule
            FormulaGroup group = FormulaGroup.of("G",
                    new FormulaRule("X", "X", RuleOperation.ADD, 1, null, BigDecimal.valueOf(100), null, null));

            // WHEN
            InvalidFormulaException e = assertThrows(InvalidFormulaException.class,
                    () -> validator.validateFormulaGroup("GP", group, NODES));

            // THEN
            assertEquals(1, e.violations().size());
            Violation violation = e.violations().get(0);
            assertEquals(0, violation.ruleIndex());
            assertTrue(violation.message().contains("multiple operand sources"), violation.message());
        }

        @Test
        @DisplayName("Every broken rule is reported with its index")
        void testAllRuleViolationsReported() {
            FormulaGroup group = FormulaGroup.of("G",
                    FormulaRule.hierarchy("REVENUE", RuleOperation.ADD, 1),
                    FormulaRule.hierarchy("GP", RuleOperation.SUBTRACT, 1),
                    FormulaRule.hierarchy("UNKNOWN", RuleOperation.ADD, 1),
                    FormulaRule.constant(2, RuleOperation.MULTIPLY, 0),
                    new FormulaRule(null, null, RuleOperation.ADD, 2, null, null, "FINANCE", null),
                    new FormulaRule(null, null, RuleOperation.ADD, 2, null, null, null, null));

            InvalidFormulaException e = assertThrows(InvalidFormulaException.class,
                    () -> validator.validateFormulaGroup("GP", group, NODES));

            e.violations().forEach(System.out::println);
            assertEquals(List.of(1, 2, 3, 4, 5), e.violations().stream().map(Violation::ruleIndex).toList());
            assertTrue(e.violations().get(0).message().contains("own node"));
            assertTrue(e.violations().get(2).message().contains("positive"));
            assertTrue(e.violations().get(3).message().contains("formulaRefTable"));
        }

        @Test
        @DisplayName("Parameter references must be plain column names")
        void testParameterNames() {
            FormulaGroup group = FormulaGroup.of("G",
                    FormulaRule.parameter("fx_rate", RuleOperation.MULTIPLY, 1),
                    FormulaRule.parameter("fx rate", RuleOperation.MULTIPLY, 1),
                    FormulaRule.parameter("rate\"; DROP TABLE x; --", RuleOperation.MULTIPLY, 1),
                    FormulaRule.parameter("2024_rate", RuleOperation.MULTIPLY, 1));

            InvalidFormulaException e = assertThrows(InvalidFormulaException.class,
                    () -> validator.validateFormulaGroup("GP", group, NODES));

            assertEquals(List.of(1, 2, 3), e.violations().stream().map(Violation::ruleIndex).toList());
            assertTrue(e.violations().get(0).message().contains("'fx rate'"));
        }

        @Test
        @DisplayName("An empty rule list is rejected")
        void testEmptyGroup() {
            assertThrows(InvalidFormulaException.class,
                    () -> validator.validateFormulaGroup("GP", FormulaGroup.of("G"), NODES));
        }

        @Test
        @DisplayName("Constant, parameter and complete external rules are accepted unchanged")
        void testValidGroup() {
            FormulaGroup group = FormulaGroup.of("G",
                    FormulaRule.hierarchy("REVENUE", RuleOperation.ADD, 1),
                    FormulaRule.hierarchy("COGS", RuleOperation.SUBTRACT, 1),
                    FormulaRule.parameter("fx_rate", RuleOperation.MULTIPLY, 2),
                    FormulaRule.external("FINANCE", "ADJUSTMENTS", RuleOperation.SUM, 3),
                    FormulaRule.constant(100, RuleOperation.DIVIDE, 4));

            assertSame(group, validator.validate("GP", group, NODES));
        }
    }
}
