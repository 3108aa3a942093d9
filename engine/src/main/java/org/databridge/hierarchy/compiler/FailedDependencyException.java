package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.FormulaEngineException;

/**
 * A formula node depends on a node that failed to compile, for example because its stored
 * formula is invalid, so it cannot be computed either. The cause is the failure of the
 * dependency. Fatal for the node only.
 */
public class FailedDependencyException extends FormulaEngineException {

    private final String hierarchyId;
    private final String via;

    public FailedDependencyException(String hierarchyId, String via, FormulaEngineException cause) {
        super("Hierarchy '" + hierarchyId + "' depends on '" + via + "', which failed: " + cause.getMessage(), cause);
        this.hierarchyId = hierarchyId;
        this.via = via;
    }

    public String hierarchyId() {
        return hierarchyId;
    }

    public String via() {
        return via;
    }
}
