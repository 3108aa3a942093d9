package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.FormulaEngineException;
import org.databridge.hierarchy.transpiler.SQLDialect;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * SQL text of every compiled formula node for one dialect.
 */
public record RenderedProject(
        SQLDialect dialect,
        Map<String, String> sql,
        Map<String, FormulaEngineException> failures) {

    public RenderedProject {
        sql = Collections.unmodifiableMap(new TreeMap<>(sql));
        failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    /**
     * @return The SQL of a formula node, or null for nodes without formula
     * @throws FormulaEngineException the node's failure if it did not compile
     */
    public String sqlOf(String hierarchyId) {
        FormulaEngineException failure = failures.get(hierarchyId);
        if (failure != null) {
            throw failure;
        }
        return sql.get(hierarchyId);
    }
}
