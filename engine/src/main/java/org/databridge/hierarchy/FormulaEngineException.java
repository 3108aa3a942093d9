package org.databridge.hierarchy;

/**
 * Base class of every error the formula engine reports to its callers.
 */
public class FormulaEngineException extends RuntimeException {

    public FormulaEngineException(String message) {
        super(message);
    }

    public FormulaEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
