package org.databridge.hierarchy.model;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a project's financial reporting tree.
 *
 * <p>The level path is display and grouping metadata only; it never takes part in
 * value derivation.
 *
 * @param id        Hierarchy id, unique within the project
 * @param name      Display name
 * @param parentId  Id of the parent node, or null for a root
 * @param root      Whether the node is flagged as a root of the tree
 * @param levelPath Named levels from the top of the tree, at most {@value #MAX_LEVELS}
 */
public record HierarchyNode(
        String id,
        String name,
        String parentId,
        boolean root,
        List<String> levelPath) {

    public static final int MAX_LEVELS = 15;

    public HierarchyNode {
        Objects.requireNonNull(id, "Hierarchy id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Hierarchy id cannot be blank");
        }
        name = name == null ? id : name;
        levelPath = levelPath == null ? List.of() : List.copyOf(levelPath);
        if (levelPath.size() > MAX_LEVELS) {
            throw new IllegalArgumentException("Hierarchy " + id + " has " + levelPath.size()
                    + " levels, at most " + MAX_LEVELS + " are supported");
        }
    }

    /**
     * Creates a node without parent or levels.
     */
    public static HierarchyNode of(String id, String name) {
        return new HierarchyNode(id, name, null, false, List.of());
    }

    /**
     * @param index Zero-based level index
     * @return The level name, or null when the path is shorter
     */
    public String level(int index) {
        return index < levelPath.size() ? levelPath.get(index) : null;
    }
}
