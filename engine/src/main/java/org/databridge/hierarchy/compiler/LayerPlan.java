package org.databridge.hierarchy.compiler;

import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.plan.ColumnReference;
import org.databridge.hierarchy.plan.Expression;
import org.databridge.hierarchy.plan.LayeredSubquery;
import org.databridge.hierarchy.plan.Literal;
import org.databridge.hierarchy.resolve.EvaluationOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Node values arranged in layers by dependency rank. Layer 0 reads key columns, base node
 * values and parameters from the source row; every further layer carries all earlier
 * columns forward and adds the formula nodes of one rank, computed from the layer below.
 *
 * <p>Each value appears once however many nodes depend on it. The same plan renders as
 * CTEs (views), as nested derived tables over the source table (INSERT) or as a
 * {@link LayeredSubquery} over the current source row (single node SQL).
 */
public final class LayerPlan {

    public static final String LAYER_ALIAS = "l";
    static final String SOURCE_ROW_COLUMN = "source_row";

    private final List<Map<String, Expression>> layers;

    private LayerPlan(List<Map<String, Expression>> layers) {
        this.layers = List.copyOf(layers);
    }

    /**
     * @param nodeIds     Nodes to include; base nodes become layer 0 columns, formula nodes
     *                    land in the layer of their rank
     * @param keyColumns  Source columns carried through every layer
     * @param layerValue  Value of a formula node over the columns of the layer below
     */
    public static LayerPlan build(ProjectSnapshot snapshot, EvaluationOrder order, Collection<String> nodeIds,
                                  List<String> keyColumns, SourceMapping mapping,
                                  Function<String, Expression> layerValue) {
        Map<String, Expression> base = new LinkedHashMap<>();
        for (String key : keyColumns) {
            base.put(key, ColumnReference.of(mapping.sourceAlias(), key));
        }
        Map<Integer, List<String>> formulaNodesByRank = new TreeMap<>();
        Set<String> parameters = new TreeSet<>();
        for (String nodeId : nodeIds) {
            NodeFormula formula = snapshot.formulaOf(nodeId);
            if (formula == null) {
                base.put(nodeId, ColumnReference.of(mapping.sourceAlias(), mapping.valueColumn(nodeId)));
                continue;
            }
            formulaNodesByRank.computeIfAbsent(order.rankOf(nodeId), r -> new ArrayList<>()).add(nodeId);
            if (formula instanceof FormulaGroup group) {
                for (FormulaRule rule : group.rules()) {
                    if (rule.hasParameterReference()) {
                        parameters.add(rule.parameterReference());
                    }
                }
            }
        }
        for (String parameter : parameters) {
            base.put(LayeredOperandResolver.parameterColumn(parameter),
                    ColumnReference.of(mapping.sourceAlias(), parameter));
        }
        if (base.isEmpty()) {
            base.put(SOURCE_ROW_COLUMN, Literal.integer(1));
        }

        List<Map<String, Expression>> layers = new ArrayList<>();
        layers.add(base);
        List<String> carried = new ArrayList<>(base.keySet());
        for (List<String> rankNodes : formulaNodesByRank.values()) {
            Map<String, Expression> layer = new LinkedHashMap<>();
            for (String column : carried) {
                layer.put(column, ColumnReference.of(LAYER_ALIAS, column));
            }
            for (String nodeId : rankNodes) {
                layer.put(nodeId, layerValue.apply(nodeId));
            }
            carried.addAll(rankNodes);
            layers.add(layer);
        }
        return new LayerPlan(layers);
    }

    /**
     * Layers innermost first; each maps column name to value.
     */
    public List<Map<String, Expression>> layers() {
        return layers;
    }

    /**
     * The value of one planned node as a scalar sub-select over the enclosing source row.
     */
    public LayeredSubquery valueOf(String hierarchyId) {
        return new LayeredSubquery(layers, LAYER_ALIAS, hierarchyId);
    }
}
