package org.databridge.hierarchy.model;

import java.util.Objects;

/**
 * Reference from a formula to another hierarchy node.
 *
 * @param hierarchyId   Referenced node id
 * @param hierarchyName Display name captured when the formula was authored
 */
public record HierarchyRef(String hierarchyId, String hierarchyName) {

    public HierarchyRef {
        Objects.requireNonNull(hierarchyId, "Referenced hierarchy id cannot be null");
    }

    public static HierarchyRef of(String hierarchyId) {
        return new HierarchyRef(hierarchyId, hierarchyId);
    }
}
