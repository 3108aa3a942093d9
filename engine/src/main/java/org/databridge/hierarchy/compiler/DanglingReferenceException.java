package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.FormulaEngineException;

import java.util.List;

/**
 * A formula references hierarchy ids that no longer exist, either directly or through a
 * formula node it depends on. Fatal for the node only.
 */
public class DanglingReferenceException extends FormulaEngineException {

    private final String hierarchyId;
    private final List<String> missingIds;
    private final String via;

    public DanglingReferenceException(String hierarchyId, List<String> missingIds) {
        this(hierarchyId, missingIds, null);
    }

    /**
     * @param via The dependency through which the missing ids are reached, or null when
     *            the node references them directly
     */
    public DanglingReferenceException(String hierarchyId, List<String> missingIds, String via) {
        super("Hierarchy '" + hierarchyId + "' references missing hierarchies " + missingIds
                + (via == null ? "" : " via '" + via + "'"));
        this.hierarchyId = hierarchyId;
        this.missingIds = List.copyOf(missingIds);
        this.via = via;
    }

    public String hierarchyId() {
        return hierarchyId;
    }

    public List<String> missingIds() {
        return missingIds;
    }

    public String via() {
        return via;
    }
}
