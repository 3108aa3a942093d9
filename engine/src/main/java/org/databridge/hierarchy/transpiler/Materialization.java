package org.databridge.hierarchy.transpiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of how a dialect keeps a computed result stored and refreshed.
 *
 * <p>Templates use the placeholders {@code {name}}, {@code {lag}} and {@code {warehouse}};
 * the SELECT body is appended after {@code createTemplate}.
 *
 * @param style          Kind of stored object
 * @param preStatements  Statements emitted before the CREATE
 * @param createTemplate CREATE clause up to and including AS
 * @param terminator     Text closing the CREATE statement
 * @param notes          Operational hints emitted as SQL comments after the statement
 */
public record Materialization(
        Style style,
        List<String> preStatements,
        String createTemplate,
        String terminator,
        List<String> notes) {

    public enum Style {
        DYNAMIC_TABLE,
        MATERIALIZED_VIEW,
        SCHEMA_BOUND_VIEW,
        NONE
    }

    public static final Materialization NONE = new Materialization(Style.NONE, List.of(), "", "", List.of());

    public Materialization {
        Objects.requireNonNull(style, "Style cannot be null");
        preStatements = List.copyOf(preStatements);
        notes = List.copyOf(notes);
    }

    public boolean isSupported() {
        return style != Style.NONE;
    }

    /**
     * Renders the full script for one stored object.
     *
     * @param objectName Rendered (quoted/qualified) object name
     * @param selectSql  The SELECT that defines the contents
     * @param targetLag  Refresh lag, used by dynamic tables
     * @param warehouse  Compute warehouse, used by dynamic tables
     */
    public String render(String objectName, String selectSql, String targetLag, String warehouse) {
        if (!isSupported()) {
            throw new IllegalStateException("No materialization to render");
        }
        List<String> lines = new ArrayList<>();
        for (String statement : preStatements) {
            lines.add(fill(statement, objectName, targetLag, warehouse));
        }
        lines.add(fill(createTemplate, objectName, targetLag, warehouse));
        lines.add(selectSql + terminator);
        if (!notes.isEmpty()) {
            lines.add("");
            for (String note : notes) {
                lines.add("-- " + fill(note, objectName, targetLag, warehouse));
            }
        }
        return String.join("\n", lines) + "\n";
    }

    private static String fill(String template, String name, String lag, String warehouse) {
        return template.replace("{name}", name)
                .replace("{lag}", lag)
                .replace("{warehouse}", warehouse);
    }
}
