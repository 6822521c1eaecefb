package com.sargasso.expression;

import java.util.List;

/**
 * Base type for all expressions handed to the planner.
 *
 * <p>The hierarchy is closed: every expression is one of the permitted variants,
 * and every {@link ExpressionVisitor} must declare a case for each of them.
 * Expressions are immutable; rewrites produce new trees.
 *
 * <p>Expression trees come from an external parser. The planner only reads them,
 * except for building derived predicates out of existing nodes.
 *
 * @see ExpressionVisitor
 * @see Expressions
 */
public sealed interface Expression
    permits Literal, Identifier, Parameter, Field, Element, Meta,
            Comparison, Arithmetic, And, Or, Not, Between, Like, In, Within,
            IsExpression, Quantified, CaseWhen, ArrayConstruct, ObjectConstruct,
            FunctionCall, Subquery {

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor the visitor
     * @param <R> the result type
     * @return the visitor's result
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Returns the direct sub-expressions of this expression, in evaluation order.
     *
     * @return an unmodifiable list of children
     */
    List<Expression> children();

    /**
     * Renders this expression in query-language syntax.
     *
     * @return the rendered text
     */
    String toSQL();
}
