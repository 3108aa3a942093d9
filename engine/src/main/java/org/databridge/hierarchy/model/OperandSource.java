package org.databridge.hierarchy.model;

/**
 * Where a FormulaRule takes its operand from.
 */
public enum OperandSource {
    HIERARCHY,
    CONSTANT,
    PARAMETER,
    EXTERNAL
}
