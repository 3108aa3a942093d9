package org.databridge.hierarchy.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * A possibly qualified database object name such as {@code DB.SCHEMA.TABLE}.
 *
 * @param parts Name parts, outermost first; never empty
 */
public record QualifiedName(List<String> parts) {

    public QualifiedName {
        parts = List.copyOf(parts);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Qualified name needs at least one part");
        }
    }

    /**
     * Builds a name from dotted segments, skipping null or blank segments.
     * {@code of("DB.SCHEMA", "T")} yields DB, SCHEMA, T.
     */
    public static QualifiedName of(String... segments) {
        List<String> parts = new ArrayList<>();
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                continue;
            }
            for (String part : segment.split("\\.")) {
                if (!part.isBlank()) {
                    parts.add(part.trim());
                }
            }
        }
        return new QualifiedName(parts);
    }

    public String simpleName() {
        return parts.get(parts.size() - 1);
    }

    @Override
    public String toString() {
        return String.join(".", parts);
    }
}
