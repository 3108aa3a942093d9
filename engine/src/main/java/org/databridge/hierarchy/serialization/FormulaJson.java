package org.databridge.hierarchy.serialization;

import org.databridge.hierarchy.model.Aggregation;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaKind;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.HierarchyRef;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.model.TotalFormula;
import org.databridge.hierarchy.store.ProjectDocument;
import org.databridge.hierarchy.validation.InvalidFormulaException;
import org.databridge.hierarchy.validation.Violation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes the persisted JSON shapes of formulas and project snapshots.
 *
 * <pre>
 * TotalFormula: { "aggregation": "SUM", "children": [{ "hierarchyId": "A", "hierarchyName": "A" }] }
 * FormulaGroup: { "mainHierarchyName": "GP",
 *                 "rules": [{ "hierarchyId": "REVENUE", "operation": "ADD", "precedence": 1 }] }
 * Project:      { "projectId": "p1", "projectName": "Demo", "nodes": [...],
 *                 "totalFormulas": { "A": {...} }, "formulaGroups": { "B": {...} } }
 * </pre>
 *
 * Shape problems inside a formula (unknown enum names, missing or non-integral precedence,
 * non-numeric constants) raise {@link InvalidFormulaException} carrying the rule or child
 * index. Malformed JSON raises {@link IllegalArgumentException}.
 */
public final class FormulaJson {

    private FormulaJson() {
    }

    // ========== READING ==========

    public static NodeFormula readFormula(FormulaKind kind, String ownerId, String json) {
        return readFormula(kind, ownerId, Json.parseObject(json));
    }

    public static NodeFormula readFormula(FormulaKind kind, String ownerId, Map<String, Object> map) {
        return switch (kind) {
            case TOTAL_FORMULA -> readTotalFormula(ownerId, map);
            case FORMULA_GROUP -> readFormulaGroup(ownerId, map);
        };
    }

    public static TotalFormula readTotalFormula(String ownerId, Map<String, Object> map) {
        List<Violation> violations = new ArrayList<>();
        Aggregation aggregation = parseEnum(Aggregation.class, map.get("aggregation"), Violation.NO_INDEX,
                "aggregation", violations);

        List<HierarchyRef> children = new ArrayList<>();
        List<Object> rawChildren = Json.getList(map, "children");
        if (rawChildren != null) {
            for (int i = 0; i < rawChildren.size(); i++) {
                if (!(rawChildren.get(i) instanceof Map<?, ?>)) {
                    violations.add(Violation.at(i, null, "Child must be an object"));
                    continue;
                }
                Map<String, Object> child = asObject(rawChildren.get(i));
                String childId = Json.getString(child, "hierarchyId");
                if (childId == null) {
                    violations.add(Violation.at(i, null, "Child needs a hierarchyId"));
                    continue;
                }
                children.add(new HierarchyRef(childId, Json.getString(child, "hierarchyName")));
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidFormulaException(ownerId, violations);
        }
        return new TotalFormula(Json.getString(map, "mainHierarchyName"), aggregation, children);
    }

    public static FormulaGroup readFormulaGroup(String ownerId, Map<String, Object> map) {
        List<Violation> violations = new ArrayList<>();
        List<FormulaRule> rules = new ArrayList<>();
        List<Object> rawRules = Json.getList(map, "rules");
        if (rawRules != null) {
            for (int i = 0; i < rawRules.size(); i++) {
                if (!(rawRules.get(i) instanceof Map<?, ?>)) {
                    violations.add(Violation.at(i, null, "Rule must be an object"));
                    continue;
                }
                FormulaRule rule = readRule(i, asObject(rawRules.get(i)), violations);
                if (rule != null) {
                    rules.add(rule);
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidFormulaException(ownerId, violations);
        }
        return new FormulaGroup(Json.getString(map, "mainHierarchyName"), rules);
    }

    private static FormulaRule readRule(int index, Map<String, Object> rule, List<Violation> violations) {
        int before = violations.size();
        String hierarchyId = Json.getString(rule, "hierarchyId");
        RuleOperation operation = parseEnum(RuleOperation.class, rule.get("operation"), index, "operation", violations);
        Integer precedence = parsePrecedence(index, hierarchyId, rule.get("precedence"), violations);

        BigDecimal constant = null;
        Object rawConstant = rule.get("constantNumber");
        if (rawConstant instanceof Long l) {
            constant = BigDecimal.valueOf(l);
        } else if (rawConstant instanceof BigDecimal d) {
            constant = d;
        } else if (rawConstant != null) {
            violations.add(Violation.at(index, hierarchyId, "constantNumber must be a number"));
        }

        if (violations.size() > before) {
            return null;
        }
        return new FormulaRule(
                hierarchyId,
                Json.getString(rule, "hierarchyName"),
                operation,
                precedence,
                Json.getString(rule, "parameterReference"),
                constant,
                Json.getString(rule, "formulaRefSource"),
                Json.getString(rule, "formulaRefTable"));
    }

    private static Integer parsePrecedence(int index, String hierarchyId, Object raw, List<Violation> violations) {
        if (raw instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return l.intValue();
        }
        if (raw instanceof BigDecimal d) {
            try {
                return d.intValueExact();
            } catch (ArithmeticException e) {
                violations.add(Violation.at(index, hierarchyId, "Precedence must be an integer, got " + d.toPlainString()));
                return null;
            }
        }
        violations.add(Violation.at(index, hierarchyId,
                raw == null ? "Precedence is required" : "Precedence must be an integer, got " + raw));
        return null;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, Object raw, int index, String field,
                                                   List<Violation> violations) {
        if (!(raw instanceof String name)) {
            violations.add(Violation.at(index, null, field + " is required"));
            return null;
        }
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            violations.add(Violation.at(index, null, "Unknown " + field + " '" + name + "'"));
            return null;
        }
    }

    /**
     * Reads a project snapshot document.
     *
     * @throws IllegalArgumentException if the document is malformed
     * @throws InvalidFormulaException  if a formula in it has an invalid shape
     */
    public static ProjectDocument readProject(String json) {
        Map<String, Object> map = Json.parseObject(json);
        String projectId = Json.getString(map, "projectId");
        if (projectId == null) {
            throw new IllegalArgumentException("Project document needs a projectId");
        }

        List<HierarchyNode> nodes = new ArrayList<>();
        List<Object> rawNodes = Json.getList(map, "nodes");
        if (rawNodes != null) {
            for (Object rawNode : rawNodes) {
                nodes.add(readNode(asObject(rawNode)));
            }
        }

        Map<String, TotalFormula> totals = new LinkedHashMap<>();
        Map<String, Object> rawTotals = Json.getObject(map, "totalFormulas");
        if (rawTotals != null) {
            rawTotals.forEach((id, formula) -> totals.put(id, readTotalFormula(id, asObject(formula))));
        }
        Map<String, FormulaGroup> groups = new LinkedHashMap<>();
        Map<String, Object> rawGroups = Json.getObject(map, "formulaGroups");
        if (rawGroups != null) {
            rawGroups.forEach((id, group) -> groups.put(id, readFormulaGroup(id, asObject(group))));
        }
        return new ProjectDocument(projectId, Json.getString(map, "projectName"), nodes, totals, groups);
    }

    private static HierarchyNode readNode(Map<String, Object> node) {
        String id = Json.getString(node, "id");
        if (id == null) {
            throw new IllegalArgumentException("Hierarchy node needs an id");
        }
        List<String> levels = new ArrayList<>();
        List<Object> rawLevels = Json.getList(node, "levelPath");
        if (rawLevels != null) {
            for (Object level : rawLevels) {
                if (level != null) {
                    levels.add(level.toString());
                }
            }
        }
        return new HierarchyNode(id, Json.getString(node, "name"), Json.getString(node, "parentId"),
                Boolean.TRUE.equals(node.get("isRoot")), levels);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected a JSON object, got " + value);
        }
        return (Map<String, Object>) value;
    }

    // ========== WRITING ==========

    public static String write(NodeFormula formula) {
        return Json.toJson(toMap(formula));
    }

    public static Map<String, Object> toMap(NodeFormula formula) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (formula instanceof TotalFormula total) {
            putIfPresent(map, "mainHierarchyName", total.mainHierarchyName());
            map.put("aggregation", total.aggregation().name());
            List<Object> children = new ArrayList<>();
            for (HierarchyRef child : total.children()) {
                Map<String, Object> ref = new LinkedHashMap<>();
                ref.put("hierarchyId", child.hierarchyId());
                putIfPresent(ref, "hierarchyName", child.hierarchyName());
                children.add(ref);
            }
            map.put("children", children);
            return map;
        }

        FormulaGroup group = (FormulaGroup) formula;
        putIfPresent(map, "mainHierarchyName", group.mainHierarchyName());
        List<Object> rules = new ArrayList<>();
        for (FormulaRule rule : group.rules()) {
            Map<String, Object> r = new LinkedHashMap<>();
            putIfPresent(r, "hierarchyId", rule.hierarchyId());
            putIfPresent(r, "hierarchyName", rule.hierarchyName());
            r.put("operation", rule.operation().name());
            r.put("precedence", (long) rule.precedence());
            putIfPresent(r, "parameterReference", rule.parameterReference());
            putIfPresent(r, "constantNumber", rule.constantNumber());
            putIfPresent(r, "formulaRefSource", rule.formulaRefSource());
            putIfPresent(r, "formulaRefTable", rule.formulaRefTable());
            rules.add(r);
        }
        map.put("rules", rules);
        return map;
    }

    public static String writeProject(ProjectDocument document) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("projectId", document.projectId());
        map.put("projectName", document.projectName());
        List<Object> nodes = new ArrayList<>();
        for (HierarchyNode node : document.nodes()) {
            Map<String, Object> n = new LinkedHashMap<>();
            n.put("id", node.id());
            n.put("name", node.name());
            putIfPresent(n, "parentId", node.parentId());
            n.put("isRoot", node.root());
            n.put("levelPath", new ArrayList<Object>(node.levelPath()));
            nodes.add(n);
        }
        map.put("nodes", nodes);
        Map<String, Object> totals = new LinkedHashMap<>();
        document.totalFormulas().forEach((id, formula) -> totals.put(id, toMap(formula)));
        map.put("totalFormulas", totals);
        Map<String, Object> groups = new LinkedHashMap<>();
        document.formulaGroups().forEach((id, group) -> groups.put(id, toMap(group)));
        map.put("formulaGroups", groups);
        return Json.toJson(map);
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
