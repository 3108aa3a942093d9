package org.databridge.hierarchy.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deployment naming and refresh settings for generated scripts.
 *
 * @param targetDatabase Database qualifying generated object names (nullable)
 * @param targetSchema   Schema qualifying generated object names (nullable)
 * @param targetTable    Table populated by the INSERT script
 * @param targetLag      Refresh lag of dynamic tables, e.g. "1 hour"
 * @param warehouse      Warehouse running dynamic table refreshes
 */
public record ScriptOptions(
        String targetDatabase,
        String targetSchema,
        String targetTable,
        String targetLag,
        String warehouse) {

    public static final ScriptOptions DEFAULT = new ScriptOptions(null, null, "HIERARCHY_VALUES", "1 hour", "COMPUTE_WH");

    public ScriptOptions {
        targetTable = targetTable == null || targetTable.isBlank() ? "HIERARCHY_VALUES" : targetTable;
        targetLag = targetLag == null || targetLag.isBlank() ? "1 hour" : targetLag;
        warehouse = warehouse == null || warehouse.isBlank() ? "COMPUTE_WH" : warehouse;
    }

    /**
     * Database and schema, whichever are set, outermost first.
     */
    public List<String> qualifier() {
        List<String> parts = new ArrayList<>(2);
        if (targetDatabase != null && !targetDatabase.isBlank()) {
            parts.add(targetDatabase);
        }
        if (targetSchema != null && !targetSchema.isBlank()) {
            parts.add(targetSchema);
        }
        return parts;
    }

    /**
     * Upper-cases a project name and replaces anything but letters, digits and underscores,
     * so it can be embedded in object names.
     */
    public static String sanitizeProjectName(String projectName) {
        if (projectName == null || projectName.isBlank()) {
            return "PROJECT";
        }
        String sanitized = projectName.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]+", "_");
        return Character.isDigit(sanitized.charAt(0)) ? "P_" + sanitized : sanitized;
    }
}
