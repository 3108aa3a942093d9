package org.databridge.hierarchy.validation;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.HierarchyRef;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.OperandSource;
import org.databridge.hierarchy.model.TotalFormula;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validation of formula payloads before they are persisted or compiled.
 *
 * <p>Pure: no state, no side effects. Violations are collected for the whole payload and
 * thrown together as one {@link InvalidFormulaException}.
 */
public final class FormulaValidator {

    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Validates any formula kind.
     *
     * @param ownerId      The node the formula is attached to
     * @param formula      The payload
     * @param projectNodes Ids of every node in the project
     * @return The normalized formula
     */
    public NodeFormula validate(String ownerId, NodeFormula formula, Set<String> projectNodes) {
        if (formula instanceof TotalFormula total) {
            return validateTotalFormula(ownerId, total, projectNodes);
        }
        return validateFormulaGroup(ownerId, (FormulaGroup) formula, projectNodes);
    }

    /**
     * Validates a TotalFormula and returns it with duplicate children removed, keeping the
     * first occurrence of each id in its original position.
     */
    public TotalFormula validateTotalFormula(String ownerId, TotalFormula formula, Set<String> projectNodes) {
        List<Violation> violations = new ArrayList<>();
        if (formula.children().isEmpty()) {
            violations.add(Violation.of("Total formula needs at least one child"));
        }

        Map<String, HierarchyRef> distinct = new LinkedHashMap<>();
        List<HierarchyRef> children = formula.children();
        for (int i = 0; i < children.size(); i++) {
            String childId = children.get(i).hierarchyId();
            if (childId.isBlank()) {
                violations.add(Violation.at(i, null, "Child hierarchy id cannot be blank"));
            } else if (childId.equals(ownerId)) {
                violations.add(Violation.at(i, childId, "A node cannot be its own child"));
            } else if (!projectNodes.contains(childId)) {
                violations.add(Violation.at(i, childId, "Unknown hierarchy '" + childId + "'"));
            }
            distinct.putIfAbsent(childId, children.get(i));
        }

        if (!violations.isEmpty()) {
            throw new InvalidFormulaException(ownerId, violations);
        }
        return new TotalFormula(formula.mainHierarchyName(), formula.aggregation(), List.copyOf(distinct.values()));
    }

    /**
     * Validates a FormulaGroup: rules present, exactly one operand source per rule, positive
     * precedence, complete external references, parameter references that are plain column
     * names and known, non-self hierarchy references.
     */
    public FormulaGroup validateFormulaGroup(String ownerId, FormulaGroup group, Set<String> projectNodes) {
        List<Violation> violations = new ArrayList<>();
        if (group.rules().isEmpty()) {
            violations.add(Violation.of("Formula group needs at least one rule"));
        }

        List<FormulaRule> rules = group.rules();
        for (int i = 0; i < rules.size(); i++) {
            FormulaRule rule = rules.get(i);
            if (rule.precedence() <= 0) {
                violations.add(Violation.at(i, rule.hierarchyId(),
                        "Precedence must be a positive integer, got " + rule.precedence()));
            }

            List<OperandSource> sources = rule.operandSources();
            if (sources.isEmpty()) {
                violations.add(Violation.at(i, null,
                        "Rule needs one operand: a hierarchy, a constant, a parameter or an external table"));
                continue;
            }
            if (sources.size() > 1) {
                violations.add(Violation.at(i, rule.hierarchyId(), "Rule has multiple operand sources " + sources));
                continue;
            }

            switch (sources.get(0)) {
                case HIERARCHY -> {
                    String refId = rule.hierarchyId();
                    if (refId.equals(ownerId)) {
                        violations.add(Violation.at(i, refId, "A formula group cannot reference its own node"));
                    } else if (!projectNodes.contains(refId)) {
                        violations.add(Violation.at(i, refId, "Unknown hierarchy '" + refId + "'"));
                    }
                }
                case EXTERNAL -> {
                    if (isBlank(rule.formulaRefSource()) || isBlank(rule.formulaRefTable())) {
                        violations.add(Violation.at(i, null,
                                "External reference needs both formulaRefSource and formulaRefTable"));
                    }
                }
                case PARAMETER -> {
                    // names a source column and the layer column derived from it
                    if (!PARAMETER_NAME.matcher(rule.parameterReference()).matches()) {
                        violations.add(Violation.at(i, null, "Parameter reference '" + rule.parameterReference()
                                + "' must be a plain column name (letters, digits, underscores)"));
                    }
                }
                case CONSTANT -> {
                    // no further structure to check
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidFormulaException(ownerId, violations);
        }
        return group;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
