package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.plan.Expression;

/**
 * Resolves operands directly against the mapped source row. Only used for formulas whose
 * hierarchy references are all base nodes.
 */
final class InlineOperandResolver implements OperandResolver {

    private final SourceMapping mapping;

    InlineOperandResolver(SourceMapping mapping) {
        this.mapping = mapping;
    }

    @Override
    public Expression hierarchyValue(String hierarchyId) {
        return ColumnReference.of(mapping.sourceAlias(), mapping.valueColumn(hierarchyId));
    }

    @Override
    public Expression parameterValue(String parameterReference) {
        return ColumnReference.of(mapping.sourceAlias(), parameterReference);
    }
}
