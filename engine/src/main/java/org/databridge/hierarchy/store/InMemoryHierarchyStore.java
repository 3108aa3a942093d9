package org.databridge.hierarchy.store;

import org.databridge.hierarchy.NotFoundException;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.TotalFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe in-memory {@link HierarchyStore}.
 *
 * <p>Nodes and formulas use create-or-update semantics keyed by hierarchy id. Deleting a
 * node removes the formulas attached to it but leaves formulas on other nodes untouched,
 * so references to the deleted node become dangling.
 */
public final class InMemoryHierarchyStore implements HierarchyStore {

    private final ConcurrentMap<String, Project> projects = new ConcurrentHashMap<>();

    public void createProject(String projectId, String projectName) {
        Objects.requireNonNull(projectId, "Project id cannot be null");
        projects.compute(projectId, (id, existing) -> existing == null
                ? new Project(projectName == null ? id : projectName)
                : existing.renamed(projectName == null ? existing.name : projectName));
    }

    /**
     * Replaces the whole content of a project with a document.
     */
    public void load(ProjectDocument document) {
        Project project = new Project(document.projectName());
        for (HierarchyNode node : document.nodes()) {
            project.nodes.put(node.id(), node);
        }
        project.totalFormulas.putAll(document.totalFormulas());
        project.formulaGroups.putAll(document.formulaGroups());
        projects.put(document.projectId(), project);
    }

    public List<String> projectIds() {
        List<String> ids = new ArrayList<>(projects.keySet());
        ids.sort(null);
        return ids;
    }

    public void saveNode(String projectId, HierarchyNode node) {
        project(projectId).nodes.put(node.id(), node);
    }

    /**
     * Removes a node and its own formulas. Formulas of other nodes keep their references.
     *
     * @return True if the node existed
     */
    public boolean deleteNode(String projectId, String hierarchyId) {
        Project project = project(projectId);
        project.totalFormulas.remove(hierarchyId);
        project.formulaGroups.remove(hierarchyId);
        return project.nodes.remove(hierarchyId) != null;
    }

    public void saveTotalFormula(String projectId, String hierarchyId, TotalFormula formula) {
        project(projectId).totalFormulas.put(hierarchyId, formula);
    }

    public void saveFormulaGroup(String projectId, String hierarchyId, FormulaGroup group) {
        project(projectId).formulaGroups.put(hierarchyId, group);
    }

    public boolean deleteTotalFormula(String projectId, String hierarchyId) {
        return project(projectId).totalFormulas.remove(hierarchyId) != null;
    }

    public boolean deleteFormulaGroup(String projectId, String hierarchyId) {
        return project(projectId).formulaGroups.remove(hierarchyId) != null;
    }

    @Override
    public Optional<String> projectName(String projectId) {
        Project project = projects.get(projectId);
        return project == null ? Optional.empty() : Optional.of(project.name);
    }

    @Override
    public List<HierarchyNode> listHierarchies(String projectId) {
        return List.copyOf(project(projectId).nodes.values());
    }

    @Override
    public Optional<TotalFormula> getTotalFormula(String projectId, String hierarchyId) {
        return Optional.ofNullable(project(projectId).totalFormulas.get(hierarchyId));
    }

    @Override
    public Optional<FormulaGroup> getFormulaGroup(String projectId, String hierarchyId) {
        return Optional.ofNullable(project(projectId).formulaGroups.get(hierarchyId));
    }

    private Project project(String projectId) {
        Project project = projects.get(projectId);
        if (project == null) {
            throw new NotFoundException("Unknown project: " + projectId);
        }
        return project;
    }

    private static final class Project {
        private final String name;
        private final ConcurrentNavigableMap<String, HierarchyNode> nodes;
        private final ConcurrentNavigableMap<String, TotalFormula> totalFormulas;
        private final ConcurrentNavigableMap<String, FormulaGroup> formulaGroups;

        Project(String name) {
            this(name, new ConcurrentSkipListMap<>(), new ConcurrentSkipListMap<>(), new ConcurrentSkipListMap<>());
        }

        private Project(String name,
                        ConcurrentNavigableMap<String, HierarchyNode> nodes,
                        ConcurrentNavigableMap<String, TotalFormula> totalFormulas,
                        ConcurrentNavigableMap<String, FormulaGroup> formulaGroups) {
            this.name = name;
            this.nodes = nodes;
            this.totalFormulas = totalFormulas;
            this.formulaGroups = formulaGroups;
        }

        Project renamed(String newName) {
            return new Project(newName, nodes, totalFormulas, formulaGroups);
        }
    }
}
