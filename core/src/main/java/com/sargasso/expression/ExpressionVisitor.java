package com.sargasso.expression;

/**
 * Visitor over the closed set of expression variants.
 *
 * <p>There are no default methods: adding a variant forces every analysis
 * (classification, null rejection, sargability, rewriting) to handle it.
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Literal expr);

    R visitIdentifier(Identifier expr);

    R visitParameter(Parameter expr);

    R visitField(Field expr);

    R visitElement(Element expr);

    R visitMeta(Meta expr);

    R visitComparison(Comparison expr);

    R visitArithmetic(Arithmetic expr);

    R visitAnd(And expr);

    R visitOr(Or expr);

    R visitNot(Not expr);

    R visitBetween(Between expr);

    R visitLike(Like expr);

    R visitIn(In expr);

    R visitWithin(Within expr);

    R visitIs(IsExpression expr);

    R visitQuantified(Quantified expr);

    R visitCaseWhen(CaseWhen expr);

    R visitArrayConstruct(ArrayConstruct expr);

    R visitObjectConstruct(ObjectConstruct expr);

    R visitFunctionCall(FunctionCall expr);

    R visitSubquery(Subquery expr);
}
