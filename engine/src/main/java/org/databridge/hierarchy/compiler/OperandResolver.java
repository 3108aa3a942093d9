package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.plan.Expression;

/**
 * Supplies the value expressions formula operands resolve to. The same formula compiles
 * inline (dependencies substituted) or layered (dependencies read from a previous CTE)
 * depending on the resolver.
 */
public interface OperandResolver {

    /**
     * @return The value of a hierarchy node
     */
    Expression hierarchyValue(String hierarchyId);

    /**
     * @return The value of an external column/parameter named by a rule
     */
    Expression parameterValue(String parameterReference);
}
