package com.sargasso.expression;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects the free names an expression refers to.
 *
 * <p>Quantifier variables are bound in the scope of their quantifier and are
 * not reported there. Aliases of correlated subqueries are reported as references.
 */
final class ReferenceCollector implements ExpressionVisitor<Void> {

    private final Set<String> names = new LinkedHashSet<>();
    private final Set<String> bound = new HashSet<>();
    private boolean hasSubquery;
    private boolean hasParameter;

    Set<String> names() {
        return names;
    }

    boolean hasSubquery() {
        return hasSubquery;
    }

    boolean hasParameter() {
        return hasParameter;
    }

    ReferenceCollector collect(Expression expr) {
        expr.accept(this);
        return this;
    }

    private Void children(Expression expr) {
        for (Expression child : expr.children()) {
            child.accept(this);
        }
        return null;
    }

    private void reference(String name) {
        if (!bound.contains(name)) {
            names.add(name);
        }
    }

    @Override
    public Void visitLiteral(Literal expr) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier expr) {
        reference(expr.name());
        return null;
    }

    @Override
    public Void visitParameter(Parameter expr) {
        hasParameter = true;
        return null;
    }

    @Override
    public Void visitField(Field expr) {
        return children(expr);
    }

    @Override
    public Void visitElement(Element expr) {
        return children(expr);
    }

    @Override
    public Void visitMeta(Meta expr) {
        reference(expr.alias());
        return null;
    }

    @Override
    public Void visitComparison(Comparison expr) {
        return children(expr);
    }

    @Override
    public Void visitArithmetic(Arithmetic expr) {
        return children(expr);
    }

    @Override
    public Void visitAnd(And expr) {
        return children(expr);
    }

    @Override
    public Void visitOr(Or expr) {
        return children(expr);
    }

    @Override
    public Void visitNot(Not expr) {
        return children(expr);
    }

    @Override
    public Void visitBetween(Between expr) {
        return children(expr);
    }

    @Override
    public Void visitLike(Like expr) {
        return children(expr);
    }

    @Override
    public Void visitIn(In expr) {
        return children(expr);
    }

    @Override
    public Void visitWithin(Within expr) {
        return children(expr);
    }

    @Override
    public Void visitIs(IsExpression expr) {
        return children(expr);
    }

    @Override
    public Void visitQuantified(Quantified expr) {
        Set<String> introduced = new HashSet<>();
        for (Quantified.Binding binding : expr.bindings()) {
            binding.expression().accept(this);
            if (bound.add(binding.variable())) {
                introduced.add(binding.variable());
            }
        }
        expr.satisfies().accept(this);
        bound.removeAll(introduced);
        return null;
    }

    @Override
    public Void visitCaseWhen(CaseWhen expr) {
        return children(expr);
    }

    @Override
    public Void visitArrayConstruct(ArrayConstruct expr) {
        return children(expr);
    }

    @Override
    public Void visitObjectConstruct(ObjectConstruct expr) {
        for (Map.Entry<String, Expression> entry : expr.fields().entrySet()) {
            entry.getValue().accept(this);
        }
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall expr) {
        return children(expr);
    }

    @Override
    public Void visitSubquery(Subquery expr) {
        hasSubquery = true;
        for (String alias : expr.correlatedAliases()) {
            reference(alias);
        }
        return null;
    }
}
