package org.databridge.hierarchy.script;

import org.databridge.hierarchy.NotFoundException;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.resolve.EvaluationOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The nodes a script batch covers: every node of the project, or chosen nodes together
 * with everything they transitively depend on.
 */
public final class NodeSelection {

    private static final NodeSelection ALL = new NodeSelection(null);

    private final Set<String> requested;

    private NodeSelection(Set<String> requested) {
        this.requested = requested;
    }

    public static NodeSelection all() {
        return ALL;
    }

    public static NodeSelection of(List<String> hierarchyIds) {
        if (hierarchyIds == null || hierarchyIds.isEmpty()) {
            throw new IllegalArgumentException("Node selection cannot be empty");
        }
        return new NodeSelection(new TreeSet<>(hierarchyIds));
    }

    public boolean isAll() {
        return requested == null;
    }

    /**
     * Expands the selection and orders it for emission: base nodes first by id, then
     * formula nodes in evaluation order.
     *
     * @throws IllegalArgumentException if a requested id is not in the project
     */
    public List<String> resolve(ProjectSnapshot snapshot, EvaluationOrder order) {
        Set<String> selected = isAll() ? new TreeSet<>(snapshot.nodes().keySet()) : closure(snapshot);

        List<String> emission = new ArrayList<>();
        for (String nodeId : selected) {
            if (snapshot.formulaOf(nodeId) == null) {
                emission.add(nodeId);
            }
        }
        for (String nodeId : order.order()) {
            if (selected.contains(nodeId)) {
                emission.add(nodeId);
            }
        }
        return emission;
    }

    private Set<String> closure(ProjectSnapshot snapshot) {
        for (String nodeId : requested) {
            if (!snapshot.hasNode(nodeId)) {
                throw new NotFoundException("Unknown hierarchy '" + nodeId + "' in project " + snapshot.projectId());
            }
        }
        return snapshot.dependencyClosure(requested);
    }

    @Override
    public String toString() {
        return isAll() ? "all" : requested.toString();
    }
}
