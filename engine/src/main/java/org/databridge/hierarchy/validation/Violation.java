package org.databridge.hierarchy.validation;

/**
 * One structural problem found in a formula payload.
 *
 * @param ruleIndex   Index of the offending rule or child, -1 when not positional
 * @param hierarchyId The hierarchy id involved, if any
 * @param message     Human readable description
 */
public record Violation(int ruleIndex, String hierarchyId, String message) {

    public static final int NO_INDEX = -1;

    public static Violation of(String message) {
        return new Violation(NO_INDEX, null, message);
    }

    public static Violation at(int ruleIndex, String hierarchyId, String message) {
        return new Violation(ruleIndex, hierarchyId, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (ruleIndex != NO_INDEX) {
            sb.append("[").append(ruleIndex).append("] ");
        }
        sb.append(message);
        return sb.toString();
    }
}
