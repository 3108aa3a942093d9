package org.databridge.hierarchy.resolve;

import org.databridge.hierarchy.model.PrecedenceTier;

import java.util.List;
import java.util.Map;

/**
 * Result of order resolution for one project.
 *
 * @param order      Formula-bearing node ids, safe to compute left to right
 * @param ranks      Dependency rank of every node in the graph: base values are 0, a
 *                   formula node is one more than its highest-ranked dependency
 * @param components Independent groups of formula nodes, each in evaluation order;
 *                   groups share no formula-to-formula edge and may compile in parallel
 * @param tiers      Precedence tiers of each FormulaGroup node
 * @param dangling   Referenced ids missing from the project, per formula node
 */
public record EvaluationOrder(
        List<String> order,
        Map<String, Integer> ranks,
        List<List<String>> components,
        Map<String, List<PrecedenceTier>> tiers,
        Map<String, List<String>> dangling) {

    public EvaluationOrder {
        order = List.copyOf(order);
        ranks = Map.copyOf(ranks);
        components = components.stream().map(List::copyOf).toList();
        tiers = Map.copyOf(tiers);
        dangling = Map.copyOf(dangling);
    }

    /**
     * @return The rank of a node, 0 for base values and for ids outside the graph
     */
    public int rankOf(String hierarchyId) {
        return ranks.getOrDefault(hierarchyId, 0);
    }

    /**
     * @return Position of a formula node in {@link #order()}, or -1
     */
    public int positionOf(String hierarchyId) {
        return order.indexOf(hierarchyId);
    }

    public List<PrecedenceTier> tiersOf(String hierarchyId) {
        return tiers.getOrDefault(hierarchyId, List.of());
    }

    public List<String> danglingReferencesOf(String hierarchyId) {
        return dangling.getOrDefault(hierarchyId, List.of());
    }
}
