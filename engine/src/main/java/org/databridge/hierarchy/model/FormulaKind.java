package org.databridge.hierarchy.model;

/**
 * The two derivation modes a hierarchy node can carry.
 */
public enum FormulaKind {
    TOTAL_FORMULA,
    FORMULA_GROUP
}
