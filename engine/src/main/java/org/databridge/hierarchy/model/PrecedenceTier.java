package org.databridge.hierarchy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The rules of a FormulaGroup that share one precedence value.
 *
 * <p>Tiers reduce sequentially: the accumulator a tier ends with is the implicit left
 * operand of the next tier. Inside a tier, rules apply in authoring order.
 *
 * @param precedence The shared precedence value
 * @param rules      The tier's rules with their index in the group
 */
public record PrecedenceTier(int precedence, List<IndexedRule> rules) {

    public PrecedenceTier {
        rules = List.copyOf(rules);
    }

    /**
     * A rule together with its position in {@link FormulaGroup#rules()}.
     */
    public record IndexedRule(int index, FormulaRule rule) {
    }

    /**
     * Groups rules by precedence, ascending; ties keep list order.
     */
    public static List<PrecedenceTier> tiersOf(FormulaGroup group) {
        Map<Integer, List<IndexedRule>> byPrecedence = new TreeMap<>();
        List<FormulaRule> rules = group.rules();
        for (int i = 0; i < rules.size(); i++) {
            FormulaRule rule = rules.get(i);
            byPrecedence.computeIfAbsent(rule.precedence(), p -> new ArrayList<>())
                    .add(new IndexedRule(i, rule));
        }
        List<PrecedenceTier> tiers = new ArrayList<>(byPrecedence.size());
        byPrecedence.forEach((precedence, tierRules) -> tiers.add(new PrecedenceTier(precedence, tierRules)));
        return List.copyOf(tiers);
    }
}
