package org.databridge.hierarchy.store;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.TotalFormula;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything stored for one project, as exchanged in snapshot files.
 *
 * @param projectId     Project id
 * @param projectName   Project display name
 * @param nodes         Nodes in document order
 * @param totalFormulas TotalFormula per hierarchy id
 * @param formulaGroups FormulaGroup per hierarchy id
 */
public record ProjectDocument(
        String projectId,
        String projectName,
        List<HierarchyNode> nodes,
        Map<String, TotalFormula> totalFormulas,
        Map<String, FormulaGroup> formulaGroups) {

    public ProjectDocument {
        Objects.requireNonNull(projectId, "Project id cannot be null");
        projectName = projectName == null ? projectId : projectName;
        nodes = List.copyOf(nodes);
        totalFormulas = Collections.unmodifiableMap(new TreeMap<>(totalFormulas));
        formulaGroups = Collections.unmodifiableMap(new TreeMap<>(formulaGroups));
    }
}
