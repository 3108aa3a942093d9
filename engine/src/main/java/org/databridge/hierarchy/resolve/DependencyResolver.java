package org.databridge.hierarchy.resolve;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.PrecedenceTier;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.SortedMaps;
import org.eclipse.collections.api.factory.SortedSets;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.sorted.MutableSortedMap;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a deterministic evaluation order for all formula-bearing nodes of a project.
 *
 * <p>Kahn's algorithm over {@link DependencyGraph}, always releasing the smallest ready id
 * first, so the same snapshot yields the same order on every run. A cycle aborts the
 * whole resolution with the full cycle path.
 */
public final class DependencyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Resolves the evaluation order of a snapshot.
     *
     * @throws CircularDependencyException if the formulas reference each other in a cycle
     */
    public EvaluationOrder resolve(ProjectSnapshot snapshot) {
        DependencyGraph graph = DependencyGraph.of(snapshot);
        List<String> order = resolveOrder(graph);

        Map<String, Integer> ranks = computeRanks(graph, order);
        Map<String, List<PrecedenceTier>> tiers = new HashMap<>();
        Map<String, List<String>> dangling = new HashMap<>();
        for (String nodeId : order) {
            NodeFormula formula = snapshot.formulaOf(nodeId);
            if (formula instanceof FormulaGroup group) {
                tiers.put(nodeId, group.tiers());
            }
            if (graph.hasDanglingReferences(nodeId)) {
                dangling.put(nodeId, graph.danglingReferencesOf(nodeId).toList());
            }
        }

        EvaluationOrder result = new EvaluationOrder(order, ranks, components(graph, order), tiers, dangling);
        LOGGER.debug("Evaluation order for project {}: {}", snapshot.projectId(), order);
        return result;
    }

    /**
     * Topologically sorts the formula nodes of a graph, dependencies first.
     *
     * @throws CircularDependencyException if the graph has a cycle
     */
    public List<String> resolveOrder(DependencyGraph graph) {
        ImmutableSortedSet<String> formulaNodes = graph.formulaNodes();

        Map<String, Integer> pending = new HashMap<>();
        MutableSortedMap<String, MutableList<String>> dependants = SortedMaps.mutable.empty();
        MutableSortedSet<String> ready = SortedSets.mutable.empty();
        for (String nodeId : formulaNodes) {
            ImmutableSortedSet<String> formulaDeps = graph.dependenciesOf(nodeId).select(graph::hasFormula);
            pending.put(nodeId, formulaDeps.size());
            formulaDeps.each(dep -> dependants.getIfAbsentPut(dep, Lists.mutable::empty).add(nodeId));
            if (formulaDeps.isEmpty()) {
                ready.add(nodeId);
            }
        }

        MutableList<String> order = Lists.mutable.withInitialCapacity(formulaNodes.size());
        while (ready.notEmpty()) {
            String next = ready.first();
            ready.remove(next);
            order.add(next);
            for (String dependant : dependants.getIfAbsentValue(next, Lists.mutable.empty())) {
                int remaining = pending.merge(dependant, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependant);
                }
            }
        }

        if (order.size() < formulaNodes.size()) {
            MutableSortedSet<String> unresolved = formulaNodes.toSortedSet().withoutAll(order);
            throw new CircularDependencyException(findCycle(graph, unresolved));
        }
        return order.toImmutable().castToList();
    }

    /**
     * Walks from the smallest unresolved node along its smallest unresolved dependency until
     * a node repeats. Every unresolved node has at least one unresolved dependency, so the
     * walk always closes a cycle.
     */
    private static List<String> findCycle(DependencyGraph graph, MutableSortedSet<String> unresolved) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        MutableList<String> path = Lists.mutable.empty();
        String current = unresolved.first();
        while (!positions.containsKey(current)) {
            positions.put(current, path.size());
            path.add(current);
            current = graph.dependenciesOf(current).detect(unresolved::contains);
        }
        MutableList<String> cycle = path.subList(positions.get(current), path.size());

        int start = cycle.indexOf(cycle.min());
        MutableList<String> rotated = Lists.mutable.withAll(cycle.subList(start, cycle.size()));
        rotated.addAll(cycle.subList(0, start));
        return rotated.toImmutable().castToList();
    }

    private static Map<String, Integer> computeRanks(DependencyGraph graph, List<String> order) {
        Map<String, Integer> ranks = new HashMap<>();
        graph.leaves().each(leaf -> ranks.put(leaf, 0));
        for (String nodeId : order) {
            int rank = 1;
            for (String dep : graph.dependenciesOf(nodeId)) {
                rank = Math.max(rank, ranks.getOrDefault(dep, 0) + 1);
            }
            ranks.put(nodeId, rank);
        }
        return ranks;
    }

    /**
     * Splits the formula nodes into groups connected by formula-to-formula edges. Shared
     * base values do not connect groups: they are read-only inputs.
     */
    private static List<List<String>> components(DependencyGraph graph, List<String> order) {
        Map<String, String> parent = new HashMap<>();
        order.forEach(id -> parent.put(id, id));
        for (String nodeId : order) {
            for (String dep : graph.dependenciesOf(nodeId)) {
                if (graph.hasFormula(dep)) {
                    union(parent, nodeId, dep);
                }
            }
        }

        Map<String, MutableList<String>> groups = new LinkedHashMap<>();
        for (String nodeId : order) {
            groups.computeIfAbsent(find(parent, nodeId), root -> Lists.mutable.empty()).add(nodeId);
        }
        return groups.values().stream().map(group -> group.toImmutable().castToList()).toList();
    }

    private static String find(Map<String, String> parent, String id) {
        String root = id;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        parent.put(id, root);
        return root;
    }

    private static void union(Map<String, String> parent, String a, String b) {
        String rootA = find(parent, a);
        String rootB = find(parent, b);
        if (!rootA.equals(rootB)) {
            if (rootA.compareTo(rootB) < 0) {
                parent.put(rootB, rootA);
            } else {
                parent.put(rootA, rootB);
            }
        }
    }
}
