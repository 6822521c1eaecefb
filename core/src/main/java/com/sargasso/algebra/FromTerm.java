package com.sargasso.algebra;

/**
 * A node of a FROM clause.
 *
 * <p>FROM clauses are left-deep: a join or unnest has an arbitrary FROM term
 * on its left and introduces exactly one new alias on its right.
 *
 * @see SimpleTerm
 * @see AnsiJoin
 * @see Unnest
 */
public sealed interface FromTerm permits SimpleTerm, AnsiJoin, Unnest {

    /**
     * Returns the alias this node introduces: the alias of a simple term, the
     * right-hand alias of a join, or the alias of an unnest.
     */
    String alias();

    /**
     * Returns the leftmost simple term of this subtree.
     */
    SimpleTerm primaryTerm();
}
