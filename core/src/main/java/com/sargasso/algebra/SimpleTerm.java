package com.sargasso.algebra;

/**
 * A FROM term that produces documents by itself rather than combining inputs.
 */
public sealed interface SimpleTerm extends FromTerm permits KeyspaceTerm, ExpressionTerm, SubqueryTerm {

    /**
     * Returns the join method hint attached to this term.
     */
    JoinHint joinHint();

    @Override
    default SimpleTerm primaryTerm() {
        return this;
    }
}
