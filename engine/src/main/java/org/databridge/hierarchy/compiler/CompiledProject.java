package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.FormulaEngineException;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.transpiler.SQLGenerator;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compiled formula nodes of a project, and the failure of every node that did not compile.
 *
 * @param expressions Value of each compiled node over the source row
 * @param layerValues Value of each compiled node over the columns of the layer below it,
 *                    see {@link LayerPlan}
 * @param failures    Failure per formula node id: a {@link DanglingReferenceException}, an
 *                    {@link org.databridge.hierarchy.validation.InvalidFormulaException} or
 *                    a {@link FailedDependencyException}
 */
public record CompiledProject(
        Map<String, Expression> expressions,
        Map<String, Expression> layerValues,
        Map<String, FormulaEngineException> failures) {

    public CompiledProject {
        expressions = Collections.unmodifiableMap(new TreeMap<>(expressions));
        layerValues = Collections.unmodifiableMap(new TreeMap<>(layerValues));
        failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    public boolean hasFailed(String hierarchyId) {
        return failures.containsKey(hierarchyId);
    }

    /**
     * @return The compiled expression of a formula node, or null for nodes without formula
     * @throws FormulaEngineException the node's failure if it did not compile
     */
    public Expression expression(String hierarchyId) {
        FormulaEngineException failure = failures.get(hierarchyId);
        if (failure != null) {
            throw failure;
        }
        return expressions.get(hierarchyId);
    }

    /**
     * @throws IllegalArgumentException if the node has no compiled layer value
     */
    public Expression layerValue(String hierarchyId) {
        Expression value = layerValues.get(hierarchyId);
        if (value == null) {
            throw new IllegalArgumentException("No compiled formula for hierarchy '" + hierarchyId + "'");
        }
        return value;
    }

    /**
     * Renders every compiled expression with one generator.
     */
    public RenderedProject render(SQLGenerator generator) {
        Map<String, String> sql = new TreeMap<>();
        expressions.forEach((id, expression) -> sql.put(id, generator.generateExpression(expression)));
        return new RenderedProject(generator.dialect(), sql, failures);
    }
}
