package org.databridge.hierarchy.validation;

import org.databridge.hierarchy.FormulaEngineException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a formula payload fails structural validation. Carries every violation
 * found, not only the first one.
 */
public class InvalidFormulaException extends FormulaEngineException {

    private final String hierarchyId;
    private final List<Violation> violations;

    public InvalidFormulaException(String hierarchyId, List<Violation> violations) {
        super(buildMessage(hierarchyId, violations));
        this.hierarchyId = hierarchyId;
        this.violations = List.copyOf(violations);
    }

    public InvalidFormulaException(String hierarchyId, Violation violation) {
        this(hierarchyId, List.of(violation));
    }

    /**
     * @return The node the formula belongs to (nullable when unknown)
     */
    public String hierarchyId() {
        return hierarchyId;
    }

    public List<Violation> violations() {
        return violations;
    }

    private static String buildMessage(String hierarchyId, List<Violation> violations) {
        String prefix = hierarchyId == null ? "Invalid formula" : "Invalid formula for hierarchy " + hierarchyId;
        return prefix + ": " + violations.stream().map(Violation::toString).collect(Collectors.joining("; "));
    }
}
