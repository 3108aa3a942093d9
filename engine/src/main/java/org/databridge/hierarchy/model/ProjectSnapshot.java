package org.databridge.hierarchy.model;

import org.databridge.hierarchy.NotFoundException;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable view of one project's hierarchy nodes and the formulas in effect on them.
 *
 * <p>Nodes and formulas are keyed by hierarchy id and iterate in id order, which keeps
 * everything derived from a snapshot reproducible.
 *
 * @param projectId   Project id
 * @param projectName Project display name, used to derive object names in scripts
 * @param nodes       All nodes of the project
 * @param formulas    The formula in effect per node, for nodes that carry one
 */
public record ProjectSnapshot(
        String projectId,
        String projectName,
        Map<String, HierarchyNode> nodes,
        Map<String, NodeFormula> formulas) {

    public ProjectSnapshot {
        Objects.requireNonNull(projectId, "Project id cannot be null");
        projectName = projectName == null ? projectId : projectName;
        nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
        formulas = Collections.unmodifiableMap(new TreeMap<>(formulas));
    }

    public boolean hasNode(String hierarchyId) {
        return nodes.containsKey(hierarchyId);
    }

    public HierarchyNode node(String hierarchyId) {
        HierarchyNode node = nodes.get(hierarchyId);
        if (node == null) {
            throw new NotFoundException("Unknown hierarchy '" + hierarchyId + "' in project " + projectId);
        }
        return node;
    }

    /**
     * @return The formula of the node, or null when it is a base node
     */
    public NodeFormula formulaOf(String hierarchyId) {
        return formulas.get(hierarchyId);
    }

    /**
     * The given nodes together with every existing node they transitively depend on.
     * References to nodes missing from the project are skipped.
     */
    public Set<String> dependencyClosure(Collection<String> hierarchyIds) {
        Set<String> closure = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(hierarchyIds);
        while (!pending.isEmpty()) {
            String nodeId = pending.poll();
            if (!closure.add(nodeId)) {
                continue;
            }
            NodeFormula formula = formulas.get(nodeId);
            if (formula != null) {
                for (String dependency : formula.referencedHierarchyIds()) {
                    if (nodes.containsKey(dependency)) {
                        pending.add(dependency);
                    }
                }
            }
        }
        return closure;
    }
}
