package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.plan.QualifiedName;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Where raw values of base nodes come from.
 *
 * <p>The source is one relation with a row per key combination and a value column per base
 * node. By default a node's column is its lower-cased id plus {@code valueSuffix}, so
 * {@code REVENUE} reads {@code revenue_value}; {@code columnOverrides} maps ids to other
 * columns.
 *
 * @param sourceTable         Source relation
 * @param sourceAlias         Alias the source relation gets in generated SQL
 * @param keyColumns          Grain columns carried through to every output row
 * @param valueSuffix         Suffix of derived value column names
 * @param externalValueColumn Column read from external tables referenced by formula rules
 * @param columnOverrides     Explicit value column per hierarchy id
 */
public record SourceMapping(
        QualifiedName sourceTable,
        String sourceAlias,
        List<String> keyColumns,
        String valueSuffix,
        String externalValueColumn,
        Map<String, String> columnOverrides) {

    public static final SourceMapping DEFAULT = new SourceMapping(
            QualifiedName.of("HIERARCHY_SOURCE"), "src", List.of(), "_value", "amount", Map.of());

    public SourceMapping {
        Objects.requireNonNull(sourceTable, "Source table cannot be null");
        Objects.requireNonNull(sourceAlias, "Source alias cannot be null");
        keyColumns = List.copyOf(keyColumns);
        valueSuffix = valueSuffix == null ? "" : valueSuffix;
        Objects.requireNonNull(externalValueColumn, "External value column cannot be null");
        columnOverrides = Collections.unmodifiableMap(new TreeMap<>(columnOverrides));
    }

    /**
     * @return The source column holding the raw value of a node
     */
    public String valueColumn(String hierarchyId) {
        String override = columnOverrides.get(hierarchyId);
        return override != null ? override : hierarchyId.toLowerCase(Locale.ROOT) + valueSuffix;
    }

    public SourceMapping withSourceTable(QualifiedName table) {
        return new SourceMapping(table, sourceAlias, keyColumns, valueSuffix, externalValueColumn, columnOverrides);
    }

    public SourceMapping withKeyColumns(List<String> keys) {
        return new SourceMapping(sourceTable, sourceAlias, keys, valueSuffix, externalValueColumn, columnOverrides);
    }

    public SourceMapping withColumnOverride(String hierarchyId, String column) {
        Map<String, String> overrides = new TreeMap<>(columnOverrides);
        overrides.put(hierarchyId, column);
        return new SourceMapping(sourceTable, sourceAlias, keyColumns, valueSuffix, externalValueColumn, overrides);
    }
}
