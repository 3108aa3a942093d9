package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.PrecedenceTier;
import org.databridge.hierarchy.model.TotalFormula;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable rendering of a formula, as shown in the mapping-expansion view.
 *
 * <pre>
 * SUM(PRODUCT_REV, SERVICE_REV)
 * [1] REVENUE - COGS; [2] / 100
 * </pre>
 */
public final class FormulaText {

    private FormulaText() {
    }

    public static String describe(NodeFormula formula) {
        if (formula == null) {
            return null;
        }
        if (formula instanceof TotalFormula total) {
            return total.aggregation().name() + "(" + String.join(", ", total.referencedHierarchyIds()) + ")";
        }
        List<String> tiers = new ArrayList<>();
        boolean first = true;
        for (PrecedenceTier tier : ((FormulaGroup) formula).tiers()) {
            StringBuilder sb = new StringBuilder("[").append(tier.precedence()).append("]");
            for (PrecedenceTier.IndexedRule indexed : tier.rules()) {
                sb.append(' ').append(term(indexed.rule(), first));
                first = false;
            }
            tiers.add(sb.toString());
        }
        return String.join("; ", tiers);
    }

    private static String term(FormulaRule rule, boolean seed) {
        String operand = operand(rule);
        return switch (rule.operation()) {
            case ADD, MULTIPLY, DIVIDE -> seed ? operand : symbol(rule) + " " + operand;
            case SUBTRACT -> "- " + operand;
            default -> (seed ? "" : "+ ") + rule.operation().name() + "(" + operand + ")";
        };
    }

    private static String symbol(FormulaRule rule) {
        return switch (rule.operation()) {
            case ADD -> "+";
            case MULTIPLY -> "*";
            default -> "/";
        };
    }

    private static String operand(FormulaRule rule) {
        List<String> parts = new ArrayList<>();
        if (rule.hasHierarchyReference()) {
            parts.add(rule.hierarchyId());
        }
        if (rule.hasConstant()) {
            parts.add(rule.constantNumber().toPlainString());
        }
        if (rule.hasParameterReference()) {
            parts.add("$" + rule.parameterReference());
        }
        if (rule.hasExternalReference()) {
            parts.add(externalName(rule.formulaRefSource(), rule.formulaRefTable()));
        }
        return String.join("|", parts);
    }

    private static String externalName(String source, String table) {
        if (source == null || source.isBlank()) {
            return table;
        }
        return table == null || table.isBlank() ? source : source + "." + table;
    }
}
