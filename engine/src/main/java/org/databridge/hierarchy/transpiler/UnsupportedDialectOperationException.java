package org.databridge.hierarchy.transpiler;

import org.databridge.hierarchy.FormulaEngineException;

/**
 * A dialect has no rendering for a requested capability, for example a dynamic table on
 * MySQL. The caller should pick another artifact kind for that dialect.
 */
public class UnsupportedDialectOperationException extends FormulaEngineException {

    private final String dialect;
    private final String operation;

    public UnsupportedDialectOperationException(String dialect, String operation) {
        super(operation + " is not supported for dialect " + dialect);
        this.dialect = dialect;
        this.operation = operation;
    }

    public String dialect() {
        return dialect;
    }

    public String operation() {
        return operation;
    }
}
