package org.databridge.hierarchy.store;

import org.databridge.hierarchy.NotFoundException;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.model.TotalFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads one project from a {@link HierarchyStore} into an immutable snapshot, settling which
 * formula is in effect on each node.
 *
 * <p>A node carrying both a TotalFormula and a FormulaGroup uses the FormulaGroup; the
 * TotalFormula is ignored and a warning is logged.
 */
public final class SnapshotLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotLoader.class);

    private final HierarchyStore store;

    public SnapshotLoader(HierarchyStore store) {
        this.store = store;
    }

    /**
     * @throws IllegalArgumentException if the project does not exist
     */
    public ProjectSnapshot load(String projectId) {
        String projectName = store.projectName(projectId)
                .orElseThrow(() -> new NotFoundException("Unknown project: " + projectId));

        Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
        Map<String, NodeFormula> formulas = new LinkedHashMap<>();
        for (HierarchyNode node : store.listHierarchies(projectId)) {
            nodes.put(node.id(), node);
            Optional<FormulaGroup> group = store.getFormulaGroup(projectId, node.id());
            Optional<TotalFormula> total = store.getTotalFormula(projectId, node.id());
            if (group.isPresent()) {
                if (total.isPresent()) {
                    LOGGER.warn("Hierarchy {} of project {} has both a total formula and a formula group; "
                            + "using the formula group", node.id(), projectId);
                }
                formulas.put(node.id(), group.get());
            } else {
                total.ifPresent(formula -> formulas.put(node.id(), formula));
            }
        }
        return new ProjectSnapshot(projectId, projectName, nodes, formulas);
    }
}
