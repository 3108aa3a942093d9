package org.databridge.hierarchy.resolve;

import org.databridge.hierarchy.FormulaEngineException;

import java.util.List;

/**
 * Thrown when the formulas of a project reference each other in a cycle. Nothing in the
 * project is compiled once a cycle is found.
 */
public class CircularDependencyException extends FormulaEngineException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular formula dependency: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * @return The node ids on the cycle in traversal order; each depends on the next, the
     *         last depends on the first
     */
    public List<String> cycle() {
        return cycle;
    }
}
