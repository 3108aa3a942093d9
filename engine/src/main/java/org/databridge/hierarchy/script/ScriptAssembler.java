package org.databridge.hierarchy.script;

import org.databridge.hierarchy.FormulaEngineException;
import org.databridge.hierarchy.compiler.CompiledProject;
import org.databridge.hierarchy.compiler.FormulaText;
import org.databridge.hierarchy.compiler.LayerPlan;
import org.databridge.hierarchy.compiler.SourceMapping;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.plan.LayeredSubquery;
import org.databridge.hierarchy.plan.Literal;
import org.databridge.hierarchy.resolve.EvaluationOrder;
import org.databridge.hierarchy.transpiler.SQLDialect;
import org.databridge.hierarchy.transpiler.SQLGenerator;
import org.databridge.hierarchy.transpiler.UnsupportedDialectOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Composes compiled node values into deployable scripts, one per artifact kind, each
 * covering every selected node in dependency order.
 *
 * <p>Generated text carries no timestamps or other run-specific content: the same inputs
 * always produce the same bytes.
 */
public final class ScriptAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptAssembler.class);

    private static final String LAYER_PREFIX = "layer_";
    private static final String INDENT = "    ";

    private final SourceMapping mapping;
    private final ScriptOptions options;

    public ScriptAssembler(SourceMapping mapping, ScriptOptions options) {
        this.mapping = Objects.requireNonNull(mapping, "Source mapping cannot be null");
        this.options = Objects.requireNonNull(options, "Script options cannot be null");
    }

    public static boolean supports(SQLDialect dialect, ArtifactKind kind) {
        return kind != ArtifactKind.DYNAMIC_TABLE || dialect.supportsMaterialization();
    }

    /**
     * Generates the requested artifacts for one dialect.
     *
     * @param skipUnsupported When false, any requested kind the dialect cannot render fails
     *                        the whole call; when true such kinds are listed in the bundle
     * @throws UnsupportedDialectOperationException if a kind is unsupported and not skipped
     */
    public ScriptBundle generate(ProjectSnapshot snapshot, EvaluationOrder order, CompiledProject compiled,
                                 NodeSelection selection, Set<ArtifactKind> kinds, SQLDialect dialect,
                                 boolean skipUnsupported) {
        List<ArtifactKind> unsupported = new ArrayList<>();
        for (ArtifactKind kind : ArtifactKind.values()) {
            if (kinds.contains(kind) && !supports(dialect, kind)) {
                unsupported.add(kind);
            }
        }
        if (!unsupported.isEmpty() && !skipUnsupported) {
            throw new UnsupportedDialectOperationException(dialect.name(), unsupported.get(0).name());
        }

        List<String> emitted = new ArrayList<>();
        List<NodeError> errors = new ArrayList<>();
        for (String nodeId : selection.resolve(snapshot, order)) {
            FormulaEngineException failure = compiled.failures().get(nodeId);
            if (failure != null) {
                errors.add(NodeError.of(nodeId, failure));
            } else {
                emitted.add(nodeId);
            }
        }

        Assembly assembly = new Assembly(snapshot, order, compiled, emitted, new SQLGenerator(dialect));
        Map<ArtifactKind, String> scripts = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            if (kinds.contains(kind) && supports(dialect, kind)) {
                scripts.put(kind, assemble(kind, assembly));
            }
        }

        LOGGER.info("Generated {} script(s) for project {} ({}): {} node(s), {} error(s), {} unsupported kind(s)",
                scripts.size(), snapshot.projectId(), dialect.name(), emitted.size(), errors.size(), unsupported.size());
        return new ScriptBundle(dialect, scripts, emitted, errors, unsupported);
    }

    private String assemble(ArtifactKind kind, Assembly a) {
        return switch (kind) {
            case INSERT -> insertScript(a);
            case VIEW -> viewScript(a);
            case MAPPING -> mappingScript(a);
            case DYNAMIC_TABLE -> dynamicTableScript(a);
        };
    }

    // ==================== INSERT ====================

    private String insertScript(Assembly a) {
        SQLDialect dialect = a.dialect();
        StringBuilder sb = header(a, "Hierarchy value population");
        if (a.nodes().isEmpty()) {
            return sb.append("-- No hierarchy nodes to emit\n").toString();
        }

        String target = objectName(dialect, options.targetTable());
        List<String> columns = outputColumns(dialect);
        sb.append("-- Reference DDL for the target table:\n");
        sb.append("-- CREATE TABLE ").append(target).append(" (\n");
        for (int i = 0; i < columns.size(); i++) {
            String type = i == columns.size() - 1 ? dialect.decimalType() : "VARCHAR(255)";
            sb.append("--     ").append(columns.get(i)).append(' ').append(type)
                    .append(i < columns.size() - 1 ? ",\n" : "\n");
        }
        sb.append("-- );\n");

        String columnList = String.join(", ", columns);
        String source = dialect.formatQualifiedName(mapping.sourceTable()) + " " + dialect.quoteIdentifier(mapping.sourceAlias());
        for (String nodeId : a.nodes()) {
            NodeFormula formula = a.snapshot().formulaOf(nodeId);
            Expression value = formula == null
                    ? ColumnReference.of(mapping.sourceAlias(), mapping.valueColumn(nodeId))
                    : a.compiled().expression(nodeId);
            List<String> select = new ArrayList<>(metadataValues(a, nodeId));
            String from;
            if (value instanceof LayeredSubquery) {
                // rows come from the node's own layers so each dependency is computed once
                LayerPlan plan = layerPlan(a, a.snapshot().dependencyClosure(List.of(nodeId)));
                for (String key : mapping.keyColumns()) {
                    select.add(a.sql(ColumnReference.of(LayerPlan.LAYER_ALIAS, key)));
                }
                select.add(a.sql(ColumnReference.of(LayerPlan.LAYER_ALIAS, nodeId)));
                from = a.generator().generateLayers(plan.layers(), LayerPlan.LAYER_ALIAS, source);
            } else {
                for (String key : mapping.keyColumns()) {
                    select.add(a.sql(ColumnReference.of(mapping.sourceAlias(), key)));
                }
                select.add(a.sql(value));
                from = source;
            }

            sb.append('\n');
            sb.append("-- ").append(nodeId).append(" (").append(formulaType(formula)).append(")\n");
            sb.append("INSERT INTO ").append(target).append(" (").append(columnList).append(")\n");
            sb.append("SELECT ").append(String.join(", ", select)).append('\n');
            sb.append("FROM ").append(from).append(";\n");
        }
        return sb.toString();
    }

    // ==================== VIEW / DYNAMIC TABLE ====================

    private String viewScript(Assembly a) {
        SQLDialect dialect = a.dialect();
        StringBuilder sb = header(a, "Hierarchy values view");
        if (a.nodes().isEmpty()) {
            return sb.append("-- No hierarchy nodes to emit\n").toString();
        }
        String name = objectName(dialect, "VW_" + projectToken(a) + "_HIERARCHY_VALUES");
        sb.append(dialect.viewPrefix()).append(' ').append(name).append(" AS\n");
        sb.append(layeredSelect(a)).append(";\n");
        return sb.toString();
    }

    private String dynamicTableScript(Assembly a) {
        SQLDialect dialect = a.dialect();
        StringBuilder sb = header(a, "Hierarchy values " + dialect.materialization().style().name().toLowerCase(Locale.ROOT).replace('_', ' '));
        if (a.nodes().isEmpty()) {
            return sb.append("-- No hierarchy nodes to emit\n").toString();
        }
        String name = objectName(dialect, "DT_" + projectToken(a) + "_HIERARCHY_VALUES");
        sb.append(dialect.materialization().render(name, layeredSelect(a), options.targetLag(), options.warehouse()));
        return sb.toString();
    }

    /**
     * The {@link LayerPlan} of the emitted nodes as CTEs {@code layer_0..layer_n}, followed
     * by a SELECT that unpivots every node into one row per node and key combination.
     */
    private String layeredSelect(Assembly a) {
        SQLDialect dialect = a.dialect();
        String alias = dialect.quoteIdentifier(LayerPlan.LAYER_ALIAS);
        LayerPlan plan = layerPlan(a, a.nodes());

        List<String> layers = new ArrayList<>();
        for (Map<String, Expression> layer : plan.layers()) {
            List<String> columns = new ArrayList<>();
            layer.forEach((column, value) -> columns.add(a.sql(value) + " AS " + dialect.quoteIdentifier(column)));
            String from = layers.isEmpty()
                    ? dialect.formatQualifiedName(mapping.sourceTable()) + " " + dialect.quoteIdentifier(mapping.sourceAlias())
                    : dialect.quoteIdentifier(LAYER_PREFIX + (layers.size() - 1)) + " " + alias;
            layers.add(layer(dialect, layers.size(), columns, from));
        }

        String last = dialect.quoteIdentifier(LAYER_PREFIX + (layers.size() - 1)) + " " + alias;
        List<String> outputColumns = outputColumns(dialect);
        List<String> arms = new ArrayList<>();
        for (String nodeId : a.nodes()) {
            List<String> values = new ArrayList<>(metadataValues(a, nodeId));
            for (String key : mapping.keyColumns()) {
                values.add(alias + "." + dialect.quoteIdentifier(key));
            }
            values.add(alias + "." + dialect.quoteIdentifier(nodeId));

            List<String> select = new ArrayList<>();
            for (int i = 0; i < values.size(); i++) {
                select.add(values.get(i) + " AS " + outputColumns.get(i));
            }
            arms.add("SELECT " + String.join(", ", select) + "\nFROM " + last);
        }
        return "WITH " + String.join(",\n", layers) + "\n" + String.join("\nUNION ALL\n", arms);
    }

    private LayerPlan layerPlan(Assembly a, Collection<String> nodeIds) {
        return LayerPlan.build(a.snapshot(), a.order(), nodeIds, mapping.keyColumns(), mapping,
                a.compiled()::layerValue);
    }

    private static String layer(SQLDialect dialect, int index, List<String> columns, String from) {
        return dialect.quoteIdentifier(LAYER_PREFIX + index) + " AS (\n"
                + INDENT + "SELECT\n"
                + INDENT + INDENT + String.join(",\n" + INDENT + INDENT, columns) + "\n"
                + INDENT + "FROM " + from + "\n"
                + ")";
    }

    // ==================== MAPPING ====================

    private String mappingScript(Assembly a) {
        SQLDialect dialect = a.dialect();
        StringBuilder sb = header(a, "Hierarchy mapping expansion view");
        if (a.nodes().isEmpty()) {
            return sb.append("-- No hierarchy nodes to emit\n").toString();
        }
        String name = objectName(dialect, "VW_" + projectToken(a) + "_MAPPING_EXPANSION");
        sb.append(dialect.viewPrefix()).append(' ').append(name).append(" AS\n");

        List<String> arms = new ArrayList<>();
        for (String nodeId : a.nodes()) {
            HierarchyNode node = a.snapshot().node(nodeId);
            NodeFormula formula = a.snapshot().formulaOf(nodeId);
            boolean base = formula == null;

            Map<String, Expression> row = new LinkedHashMap<>();
            row.put("PROJECT_ID", Literal.string(a.snapshot().projectId()));
            row.put("HIERARCHY_ID", Literal.string(node.id()));
            row.put("HIERARCHY_NAME", Literal.string(node.name()));
            row.put("PARENT_ID", Literal.stringOrNull(node.parentId()));
            row.put("IS_ROOT", Literal.bool(node.root()));
            for (int level = 0; level < HierarchyNode.MAX_LEVELS; level++) {
                row.put("LEVEL_" + (level + 1), Literal.stringOrNull(node.level(level)));
            }
            row.put("EVALUATION_RANK", Literal.integer(a.order().rankOf(nodeId)));
            row.put("FORMULA_TYPE", Literal.string(formulaType(formula)));
            row.put("SOURCE_TABLE", base ? Literal.string(mapping.sourceTable().toString()) : Literal.nullValue());
            row.put("SOURCE_COLUMN", base ? Literal.string(mapping.valueColumn(nodeId)) : Literal.nullValue());
            row.put("FORMULA_TEXT", Literal.stringOrNull(FormulaText.describe(formula)));

            List<String> select = new ArrayList<>();
            row.forEach((column, value) -> select.add(a.sql(value) + " AS " + dialect.formatObjectName(column)));
            arms.add("SELECT " + String.join(", ", select));
        }
        sb.append(String.join("\nUNION ALL\n", arms)).append(";\n");
        return sb.toString();
    }

    // ==================== Shared ====================

    private StringBuilder header(Assembly a, String title) {
        StringBuilder sb = new StringBuilder();
        sb.append("-- ").append(title).append('\n');
        sb.append("-- Project: ").append(singleLine(a.snapshot().projectName()))
                .append(" (").append(singleLine(a.snapshot().projectId())).append(")\n");
        sb.append("-- Dialect: ").append(a.dialect().name()).append('\n');
        sb.append("-- Nodes: ").append(a.nodes().size()).append('\n');
        sb.append('\n');
        return sb;
    }

    /**
     * PROJECT_ID, HIERARCHY_ID, HIERARCHY_NAME, the key columns and NODE_VALUE.
     */
    private List<String> outputColumns(SQLDialect dialect) {
        List<String> columns = new ArrayList<>();
        columns.add(dialect.formatObjectName("PROJECT_ID"));
        columns.add(dialect.formatObjectName("HIERARCHY_ID"));
        columns.add(dialect.formatObjectName("HIERARCHY_NAME"));
        for (String key : mapping.keyColumns()) {
            columns.add(dialect.formatObjectName(key));
        }
        columns.add(dialect.formatObjectName("NODE_VALUE"));
        return columns;
    }

    private static List<String> metadataValues(Assembly a, String nodeId) {
        HierarchyNode node = a.snapshot().node(nodeId);
        return List.of(
                a.sql(Literal.string(a.snapshot().projectId())),
                a.sql(Literal.string(node.id())),
                a.sql(Literal.string(node.name())));
    }

    private String objectName(SQLDialect dialect, String baseName) {
        StringBuilder sb = new StringBuilder();
        for (String part : options.qualifier()) {
            sb.append(dialect.formatObjectName(part)).append('.');
        }
        return sb.append(dialect.formatObjectName(baseName)).toString();
    }

    private static String projectToken(Assembly a) {
        return ScriptOptions.sanitizeProjectName(a.snapshot().projectName());
    }

    private static String formulaType(NodeFormula formula) {
        return formula == null ? "BASE" : formula.kind().name();
    }

    private static String singleLine(String text) {
        return text.replaceAll("[\\r\\n]+", " ");
    }

    private record Assembly(
            ProjectSnapshot snapshot,
            EvaluationOrder order,
            CompiledProject compiled,
            List<String> nodes,
            SQLGenerator generator) {

        SQLDialect dialect() {
            return generator.dialect();
        }

        String sql(Expression expression) {
            return generator.generateExpression(expression);
        }
    }
}
