package org.databridge.hierarchy;

import org.databridge.hierarchy.model.Aggregation;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.ProjectSnapshot;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.model.TotalFormula;
import org.databridge.hierarchy.store.InMemoryHierarchyStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects shared by the tests.
 *
 * <pre>
 * TOTAL_REVENUE    = SUM(PRODUCT_REV, SERVICE_REV)
 * GROSS_PROFIT     = [1] TOTAL_REVENUE - COGS
 * GROSS_MARGIN_PCT = [1] GROSS_PROFIT / TOTAL_REVENUE; [2] * 100
 * </pre>
 */
public final class SampleProjects {

    public static final String PROJECT_ID = "p1";
    public static final String PROJECT_NAME = "Demo Income";

    private SampleProjects() {
    }

    public static TotalFormula totalRevenue() {
        return TotalFormula.of(Aggregation.SUM, "PRODUCT_REV", "SERVICE_REV");
    }

    public static FormulaGroup grossProfit() {
        return FormulaGroup.of("Gross Profit",
                FormulaRule.hierarchy("TOTAL_REVENUE", RuleOperation.ADD, 1),
                FormulaRule.hierarchy("COGS", RuleOperation.SUBTRACT, 1));
    }

    public static FormulaGroup grossMarginPct() {
        return FormulaGroup.of("Gross Margin %",
                FormulaRule.hierarchy("GROSS_PROFIT", RuleOperation.ADD, 1),
                FormulaRule.hierarchy("TOTAL_REVENUE", RuleOperation.DIVIDE, 1),
                FormulaRule.constant(100, RuleOperation.MULTIPLY, 2));
    }

    public static ProjectSnapshot incomeStatement() {
        Map<String, NodeFormula> formulas = new LinkedHashMap<>();
        formulas.put("TOTAL_REVENUE", totalRevenue());
        formulas.put("GROSS_PROFIT", grossProfit());
        formulas.put("GROSS_MARGIN_PCT", grossMarginPct());
        return snapshot(formulas, "PRODUCT_REV", "SERVICE_REV", "COGS");
    }

    /**
     * A snapshot holding the base nodes and one node per formula key.
     */
    public static ProjectSnapshot snapshot(Map<String, ? extends NodeFormula> formulas, String... baseIds) {
        Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
        for (String id : baseIds) {
            nodes.put(id, HierarchyNode.of(id, label(id)));
        }
        for (String id : formulas.keySet()) {
            nodes.put(id, HierarchyNode.of(id, label(id)));
        }
        return new ProjectSnapshot(PROJECT_ID, PROJECT_NAME, nodes, new LinkedHashMap<>(formulas));
    }

    /**
     * The income statement stored under {@link #PROJECT_ID}, with a small tree above it.
     */
    public static InMemoryHierarchyStore incomeStatementStore() {
        InMemoryHierarchyStore store = new InMemoryHierarchyStore();
        store.createProject(PROJECT_ID, PROJECT_NAME);
        store.saveNode(PROJECT_ID, new HierarchyNode("GROSS_MARGIN_PCT", "Gross Margin %", null, true,
                List.of("Income Statement")));
        store.saveNode(PROJECT_ID, new HierarchyNode("GROSS_PROFIT", "Gross Profit", "GROSS_MARGIN_PCT", false,
                List.of("Income Statement", "Gross Profit")));
        store.saveNode(PROJECT_ID, new HierarchyNode("TOTAL_REVENUE", "Total Revenue", "GROSS_PROFIT", false,
                List.of("Income Statement", "Gross Profit", "Revenue")));
        store.saveNode(PROJECT_ID, new HierarchyNode("PRODUCT_REV", "Product Revenue", "TOTAL_REVENUE", false,
                List.of("Income Statement", "Gross Profit", "Revenue", "Product")));
        store.saveNode(PROJECT_ID, new HierarchyNode("SERVICE_REV", "Service Revenue", "TOTAL_REVENUE", false,
                List.of("Income Statement", "Gross Profit", "Revenue", "Service")));
        store.saveNode(PROJECT_ID, new HierarchyNode("COGS", "Cost of Goods Sold", "GROSS_PROFIT", false,
                List.of("Income Statement", "Gross Profit", "COGS")));
        store.saveTotalFormula(PROJECT_ID, "TOTAL_REVENUE", totalRevenue());
        store.saveFormulaGroup(PROJECT_ID, "GROSS_PROFIT", grossProfit());
        store.saveFormulaGroup(PROJECT_ID, "GROSS_MARGIN_PCT", grossMarginPct());
        return store;
    }

    private static String label(String id) {
        return id.replace('_', ' ');
    }
}
