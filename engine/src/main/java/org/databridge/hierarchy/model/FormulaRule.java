package org.databridge.hierarchy.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One rule of a FormulaGroup.
 *
 * <p>A valid rule supplies exactly one operand source: a hierarchy reference, a constant,
 * a parameter reference, or an external table reference ({@code formulaRefSource} +
 * {@code formulaRefTable}). The record itself accepts any combination so that invalid
 * payloads can be represented and reported by the validator.
 *
 * @param hierarchyId        Referenced node id (nullable)
 * @param hierarchyName      Referenced node display name (nullable)
 * @param operation          Operation applied to the accumulator
 * @param precedence         Evaluation tier, lower runs first
 * @param parameterReference External column/parameter name (nullable)
 * @param constantNumber     Literal operand (nullable)
 * @param formulaRefSource   External system/database the value is pulled from (nullable)
 * @param formulaRefTable    External table the value is pulled from (nullable)
 */
public record FormulaRule(
        String hierarchyId,
        String hierarchyName,
        RuleOperation operation,
        int precedence,
        String parameterReference,
        BigDecimal constantNumber,
        String formulaRefSource,
        String formulaRefTable) {

    public FormulaRule {
        Objects.requireNonNull(operation, "Rule operation cannot be null");
    }

    public static FormulaRule hierarchy(String hierarchyId, RuleOperation operation, int precedence) {
        return new FormulaRule(hierarchyId, hierarchyId, operation, precedence, null, null, null, null);
    }

    public static FormulaRule constant(BigDecimal value, RuleOperation operation, int precedence) {
        return new FormulaRule(null, null, operation, precedence, null, value, null, null);
    }

    public static FormulaRule constant(long value, RuleOperation operation, int precedence) {
        return constant(BigDecimal.valueOf(value), operation, precedence);
    }

    public static FormulaRule parameter(String parameterReference, RuleOperation operation, int precedence) {
        return new FormulaRule(null, null, operation, precedence, parameterReference, null, null, null);
    }

    public static FormulaRule external(String source, String table, RuleOperation operation, int precedence) {
        return new FormulaRule(null, null, operation, precedence, null, null, source, table);
    }

    public boolean hasHierarchyReference() {
        return notBlank(hierarchyId);
    }

    public boolean hasConstant() {
        return constantNumber != null;
    }

    public boolean hasParameterReference() {
        return notBlank(parameterReference);
    }

    /**
     * True when either half of an external table reference is present.
     */
    public boolean hasExternalReference() {
        return notBlank(formulaRefSource) || notBlank(formulaRefTable);
    }

    /**
     * @return Every operand source this rule supplies, in a fixed order
     */
    public List<OperandSource> operandSources() {
        List<OperandSource> sources = new ArrayList<>(1);
        if (hasHierarchyReference()) {
            sources.add(OperandSource.HIERARCHY);
        }
        if (hasConstant()) {
            sources.add(OperandSource.CONSTANT);
        }
        if (hasParameterReference()) {
            sources.add(OperandSource.PARAMETER);
        }
        if (hasExternalReference()) {
            sources.add(OperandSource.EXTERNAL);
        }
        return sources;
    }

    /**
     * @return The single operand source of a validated rule
     * @throws IllegalStateException if the rule does not supply exactly one
     */
    public OperandSource operandSource() {
        List<OperandSource> sources = operandSources();
        if (sources.size() != 1) {
            throw new IllegalStateException("Rule supplies " + sources.size() + " operand sources: " + sources);
        }
        return sources.get(0);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
