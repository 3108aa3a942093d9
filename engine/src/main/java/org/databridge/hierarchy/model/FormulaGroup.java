package org.databridge.hierarchy.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node value defined as an ordered, tiered arithmetic reduction over other nodes,
 * constants, parameters or external references.
 *
 * @param mainHierarchyName Display label of the group, independent of the node name
 * @param rules             Rules in authoring order
 */
public record FormulaGroup(
        String mainHierarchyName,
        List<FormulaRule> rules) implements NodeFormula {

    public FormulaGroup {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static FormulaGroup of(String mainHierarchyName, FormulaRule... rules) {
        return new FormulaGroup(mainHierarchyName, List.of(rules));
    }

    @Override
    public FormulaKind kind() {
        return FormulaKind.FORMULA_GROUP;
    }

    @Override
    public List<String> referencedHierarchyIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (FormulaRule rule : rules) {
            if (rule.hasHierarchyReference()) {
                ids.add(rule.hierarchyId());
            }
        }
        return List.copyOf(ids);
    }

    /**
     * @return The rules grouped into precedence tiers, lowest precedence first
     */
    public List<PrecedenceTier> tiers() {
        return PrecedenceTier.tiersOf(this);
    }
}
