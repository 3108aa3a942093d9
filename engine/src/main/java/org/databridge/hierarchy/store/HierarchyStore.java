package org.databridge.hierarchy.store;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.TotalFormula;

import java.util.List;
import java.util.Optional;

/**
 * Source of hierarchy nodes and their formula attachments, keyed by project.
 */
public interface HierarchyStore {

    /**
     * @return The display name of a project, or empty if the project does not exist
     */
    Optional<String> projectName(String projectId);

    /**
     * @return Every node of the project, in id order
     * @throws IllegalArgumentException if the project does not exist
     */
    List<HierarchyNode> listHierarchies(String projectId);

    Optional<TotalFormula> getTotalFormula(String projectId, String hierarchyId);

    Optional<FormulaGroup> getFormulaGroup(String projectId, String hierarchyId);
}
