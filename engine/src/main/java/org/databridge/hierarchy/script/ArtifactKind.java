package org.databridge.hierarchy.script;

import java.util.Locale;

/**
 * Deployable SQL artifacts the assembler produces.
 */
public enum ArtifactKind {
    /** INSERT ... SELECT population of the hierarchy values table. */
    INSERT,
    /** View computing every node value through layered CTEs. */
    VIEW,
    /** View listing every node with its metadata and formula. */
    MAPPING,
    /** Dynamic table or materialized view holding the node values. */
    DYNAMIC_TABLE;

    /**
     * Parses a kind name case-insensitively; dashes are accepted for underscores.
     */
    public static ArtifactKind fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown artifact kind: " + name, e);
        }
    }
}
