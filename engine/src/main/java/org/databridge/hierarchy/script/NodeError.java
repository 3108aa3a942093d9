package org.databridge.hierarchy.script;

import org.databridge.hierarchy.FormulaEngineException;
import org.databridge.hierarchy.compiler.DanglingReferenceException;
import org.databridge.hierarchy.compiler.FailedDependencyException;
import org.databridge.hierarchy.validation.InvalidFormulaException;
import org.databridge.hierarchy.validation.Violation;

import java.util.List;

/**
 * Why one node was left out of a script bundle.
 *
 * @param hierarchyId The node that failed
 * @param reason      Kind of failure
 * @param message     Human-readable reason
 * @param missingIds  Hierarchy ids that no longer exist and caused the failure
 * @param via         The dependency the failure came through, or null when the node's own
 *                    formula is at fault
 * @param violations  Problems found in the node's own formula
 */
public record NodeError(
        String hierarchyId,
        Reason reason,
        String message,
        List<String> missingIds,
        String via,
        List<Violation> violations) {

    public enum Reason {
        DANGLING_REFERENCE,
        INVALID_FORMULA,
        FAILED_DEPENDENCY
    }

    public NodeError {
        missingIds = List.copyOf(missingIds);
        violations = List.copyOf(violations);
    }

    public static NodeError of(String hierarchyId, FormulaEngineException failure) {
        if (failure instanceof DanglingReferenceException dangling) {
            return new NodeError(hierarchyId, Reason.DANGLING_REFERENCE, dangling.getMessage(),
                    dangling.missingIds(), dangling.via(), List.of());
        }
        if (failure instanceof InvalidFormulaException invalid) {
            return new NodeError(hierarchyId, Reason.INVALID_FORMULA, invalid.getMessage(),
                    List.of(), null, invalid.violations());
        }
        String via = failure instanceof FailedDependencyException upstream ? upstream.via() : null;
        return new NodeError(hierarchyId, Reason.FAILED_DEPENDENCY, failure.getMessage(), List.of(), via, List.of());
    }
}
