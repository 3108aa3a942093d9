package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.PrecedenceTier;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.model.TotalFormula;
import org.databridge.hierarchy.plan.AggregateExpression;
import org.databridge.hierarchy.plan.ArithmeticExpression;
import org.databridge.hierarchy.plan.CaseExpression;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.plan.Literal;
import org.databridge.hierarchy.plan.QualifiedName;
import org.databridge.hierarchy.plan.ScalarSubquery;
import org.databridge.hierarchy.plan.ValueStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles one validated formula into a dialect-neutral {@link Expression}.
 *
 * <p>TotalFormula: the aggregation over the distinct children's values.
 *
 * <p>FormulaGroup: tiers reduce in ascending precedence, each rule folding its operand into
 * one running accumulator in list order. The first rule seeds the accumulator
 * (SUBTRACT seeds with the negated operand). Aggregate operations reduce their own operand
 * stream to a term that is added. Division is guarded against a zero divisor.
 */
public final class ExpressionCompiler {

    private final SourceMapping mapping;

    public ExpressionCompiler(SourceMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "Source mapping cannot be null");
    }

    public Expression compile(NodeFormula formula, OperandResolver resolver) {
        if (formula instanceof TotalFormula total) {
            return compileTotalFormula(total, resolver);
        }
        return compileFormulaGroup((FormulaGroup) formula, resolver);
    }

    public Expression compileTotalFormula(TotalFormula formula, OperandResolver resolver) {
        List<Expression> values = new ArrayList<>();
        for (String childId : formula.referencedHierarchyIds()) {
            values.add(resolver.hierarchyValue(childId));
        }
        return new AggregateExpression(
                AggregateExpression.AggregateFunction.of(formula.aggregation()),
                new ValueStream.ScalarValues(values));
    }

    public Expression compileFormulaGroup(FormulaGroup group, OperandResolver resolver) {
        Expression accumulator = null;
        for (PrecedenceTier tier : group.tiers()) {
            for (PrecedenceTier.IndexedRule indexed : tier.rules()) {
                accumulator = apply(accumulator, indexed.rule(), resolver);
            }
        }
        if (accumulator == null) {
            throw new IllegalArgumentException("Formula group '" + group.mainHierarchyName() + "' has no rules");
        }
        return accumulator;
    }

    private Expression apply(Expression accumulator, FormulaRule rule, OperandResolver resolver) {
        RuleOperation operation = rule.operation();
        if (operation.isAggregate()) {
            Expression term = aggregateTerm(rule, resolver);
            return accumulator == null ? term : ArithmeticExpression.add(accumulator, term);
        }

        Expression operand = operand(rule, resolver);
        if (accumulator == null) {
            return operation == RuleOperation.SUBTRACT
                    ? ArithmeticExpression.subtract(Literal.integer(0), operand)
                    : operand;
        }
        return switch (operation) {
            case ADD -> ArithmeticExpression.add(accumulator, operand);
            case SUBTRACT -> ArithmeticExpression.subtract(accumulator, operand);
            case MULTIPLY -> ArithmeticExpression.multiply(accumulator, operand);
            case DIVIDE -> CaseExpression.nullSafeDivide(accumulator, operand);
            default -> throw new IllegalStateException("Unexpected operation " + operation);
        };
    }

    private Expression aggregateTerm(FormulaRule rule, OperandResolver resolver) {
        AggregateExpression.AggregateFunction function =
                AggregateExpression.AggregateFunction.of(rule.operation().aggregation());
        ValueStream values = switch (rule.operandSource()) {
            case EXTERNAL -> externalColumn(rule);
            default -> new ValueStream.ScalarValues(List.of(operand(rule, resolver)));
        };
        return new AggregateExpression(function, values);
    }

    private Expression operand(FormulaRule rule, OperandResolver resolver) {
        return switch (rule.operandSource()) {
            case HIERARCHY -> resolver.hierarchyValue(rule.hierarchyId());
            case CONSTANT -> Literal.decimal(rule.constantNumber());
            case PARAMETER -> resolver.parameterValue(rule.parameterReference());
            case EXTERNAL -> new ScalarSubquery(externalColumn(rule));
        };
    }

    private ValueStream.ExternalColumn externalColumn(FormulaRule rule) {
        return new ValueStream.ExternalColumn(
                QualifiedName.of(rule.formulaRefSource(), rule.formulaRefTable()),
                mapping.externalValueColumn());
    }
}
