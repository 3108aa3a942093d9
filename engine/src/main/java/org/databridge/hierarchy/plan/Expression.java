package org.databridge.hierarchy.plan;

/**
 * Sealed interface representing scalar expressions that compute a hierarchy node value.
 *
 * Includes:
 * - ColumnReference: a value read from the mapped source row or a previous layer
 * - Literal: constant value
 * - ArithmeticExpression: +, -, *, /
 * - CaseExpression / ComparisonExpression: the division guard
 * - AggregateExpression: aggregation over a stream of values
 * - ScalarSubquery: a single value pulled from an external table
 * - LayeredSubquery: a value computed through one derived table per dependency rank
 */
public sealed interface Expression
        permits ColumnReference, Literal, ArithmeticExpression, CaseExpression, ComparisonExpression,
        CastExpression, AggregateExpression, ScalarSubquery, LayeredSubquery {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
