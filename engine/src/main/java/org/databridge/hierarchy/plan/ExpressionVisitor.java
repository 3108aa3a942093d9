package org.databridge.hierarchy.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnRef);

    T visitLiteral(Literal literal);

    T visitArithmetic(ArithmeticExpression arithmetic);

    T visitCase(CaseExpression caseExpr);

    T visitComparison(ComparisonExpression comparison);

    /**
     * Visit a CAST to the dialect's exact decimal type.
     */
    T visitCast(CastExpression cast);

    /**
     * Visit an aggregate over a value stream (SUM, AVG, ...).
     */
    T visitAggregate(AggregateExpression aggregate);

    /**
     * Visit a single-value sub-select against an external table.
     */
    T visitScalarSubquery(ScalarSubquery subquery);

    T visitLayeredSubquery(LayeredSubquery subquery);
}
