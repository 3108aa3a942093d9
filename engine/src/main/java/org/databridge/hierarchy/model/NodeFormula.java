package org.databridge.hierarchy.model;

import java.util.List;

/**
 * Derivation attached to a hierarchy node.
 */
public sealed interface NodeFormula permits TotalFormula, FormulaGroup {

    FormulaKind kind();

    /**
     * Hierarchy ids this formula needs a value for, in authoring order, without duplicates.
     * Constants, parameter references and external table references are not included.
     */
    List<String> referencedHierarchyIds();
}
