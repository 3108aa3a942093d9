package org.databridge.hierarchy.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node value defined as an aggregation over a fixed set of child nodes.
 *
 * @param mainHierarchyName Display label captured by the authoring surface (nullable)
 * @param aggregation       Aggregation applied to the children's values
 * @param children          Child references in authoring order
 */
public record TotalFormula(
        String mainHierarchyName,
        Aggregation aggregation,
        List<HierarchyRef> children) implements NodeFormula {

    public TotalFormula {
        Objects.requireNonNull(aggregation, "Aggregation cannot be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static TotalFormula of(Aggregation aggregation, String... childIds) {
        return new TotalFormula(null, aggregation,
                Arrays.stream(childIds).map(HierarchyRef::of).toList());
    }

    @Override
    public FormulaKind kind() {
        return FormulaKind.TOTAL_FORMULA;
    }

    @Override
    public List<String> referencedHierarchyIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (HierarchyRef child : children) {
            ids.add(child.hierarchyId());
        }
        return List.copyOf(ids);
    }
}
