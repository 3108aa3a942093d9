package org.databridge.hierarchy.resolve;

import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.eclipse.collections.api.factory.SortedMaps;
import org.eclipse.collections.api.factory.SortedSets;
import org.eclipse.collections.api.map.sorted.MutableSortedMap;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;

import java.util.Map;

/**
 * Directed reference graph of a project: every node carrying a formula points to each
 * hierarchy node its formula needs a value from.
 *
 * <p>Nodes are an id-keyed arena; edges are a separate id-to-ids table. References to
 * ids that are not in the project are kept apart as dangling references and do not
 * become edges.
 */
public final class DependencyGraph {

    private final MutableSortedMap<String, ImmutableSortedSet<String>> edges = SortedMaps.mutable.empty();
    private final MutableSortedMap<String, ImmutableSortedSet<String>> dangling = SortedMaps.mutable.empty();
    private final MutableSortedSet<String> leaves = SortedSets.mutable.empty();

    private DependencyGraph() {
    }

    /**
     * Builds the graph from the formulas in effect in a snapshot.
     */
    public static DependencyGraph of(ProjectSnapshot snapshot) {
        DependencyGraph graph = new DependencyGraph();
        for (Map.Entry<String, NodeFormula> entry : snapshot.formulas().entrySet()) {
            MutableSortedSet<String> targets = SortedSets.mutable.empty();
            MutableSortedSet<String> missing = SortedSets.mutable.empty();
            for (String referenced : entry.getValue().referencedHierarchyIds()) {
                if (snapshot.hasNode(referenced)) {
                    targets.add(referenced);
                } else {
                    missing.add(referenced);
                }
            }
            graph.edges.put(entry.getKey(), targets.toImmutable());
            if (missing.notEmpty()) {
                graph.dangling.put(entry.getKey(), missing.toImmutable());
            }
        }
        for (ImmutableSortedSet<String> targets : graph.edges.values()) {
            targets.reject(graph.edges::containsKey).each(graph.leaves::add);
        }
        return graph;
    }

    /**
     * @return Ids of the nodes carrying a formula, in id order
     */
    public ImmutableSortedSet<String> formulaNodes() {
        return SortedSets.immutable.withAll(edges.keySet());
    }

    /**
     * @return Referenced nodes without a formula of their own (base values)
     */
    public ImmutableSortedSet<String> leaves() {
        return leaves.toImmutable();
    }

    public boolean hasFormula(String hierarchyId) {
        return edges.containsKey(hierarchyId);
    }

    /**
     * @return Every existing node the given formula node references, in id order
     */
    public ImmutableSortedSet<String> dependenciesOf(String hierarchyId) {
        ImmutableSortedSet<String> targets = edges.get(hierarchyId);
        return targets == null ? SortedSets.immutable.empty() : targets;
    }

    /**
     * @return Referenced ids that do not exist in the project, in id order
     */
    public ImmutableSortedSet<String> danglingReferencesOf(String hierarchyId) {
        ImmutableSortedSet<String> missing = dangling.get(hierarchyId);
        return missing == null ? SortedSets.immutable.empty() : missing;
    }

    public boolean hasDanglingReferences(String hierarchyId) {
        return dangling.containsKey(hierarchyId);
    }
}
