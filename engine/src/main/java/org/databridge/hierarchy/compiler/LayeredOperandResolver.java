package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.plan.Expression;

/**
 * Resolves operands against the previous CTE layer, where every node value computed so far
 * is a column named after the node id and every parameter a column prefixed with
 * {@value #PARAMETER_PREFIX}.
 */
public final class LayeredOperandResolver implements OperandResolver {

    public static final String PARAMETER_PREFIX = "param_";

    private final String layerAlias;

    public LayeredOperandResolver(String layerAlias) {
        this.layerAlias = layerAlias;
    }

    public static String parameterColumn(String parameterReference) {
        return PARAMETER_PREFIX + parameterReference;
    }

    @Override
    public Expression hierarchyValue(String hierarchyId) {
        return ColumnReference.of(layerAlias, hierarchyId);
    }

    @Override
    public Expression parameterValue(String parameterReference) {
        return ColumnReference.of(layerAlias, parameterColumn(parameterReference));
    }
}
