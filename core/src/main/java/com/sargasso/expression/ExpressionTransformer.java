package com.sargasso.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bottom-up rewriting visitor.
 *
 * <p>Every method rebuilds its node from transformed children and returns the
 * original instance when nothing changed. Subclasses override the variants
 * they rewrite.
 */
public class ExpressionTransformer implements ExpressionVisitor<Expression> {

    /**
     * Transforms an expression (null passes through).
     *
     * @param expr the expression
     * @return the transformed expression
     */
    public Expression transform(Expression expr) {
        return expr == null ? null : expr.accept(this);
    }

    protected List<Expression> transformAll(List<Expression> exprs) {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            result.add(transform(expr));
        }
        return result;
    }

    @Override
    public Expression visitLiteral(Literal expr) {
        return expr;
    }

    @Override
    public Expression visitIdentifier(Identifier expr) {
        return expr;
    }

    @Override
    public Expression visitParameter(Parameter expr) {
        return expr;
    }

    @Override
    public Expression visitField(Field expr) {
        Expression base = transform(expr.base());
        return base == expr.base() ? expr : new Field(base, expr.name());
    }

    @Override
    public Expression visitElement(Element expr) {
        Expression base = transform(expr.base());
        Expression index = transform(expr.index());
        return base == expr.base() && index == expr.index() ? expr : new Element(base, index);
    }

    @Override
    public Expression visitMeta(Meta expr) {
        return expr;
    }

    @Override
    public Expression visitComparison(Comparison expr) {
        Expression left = transform(expr.left());
        Expression right = transform(expr.right());
        if (left == expr.left() && right == expr.right()) {
            return expr;
        }
        return new Comparison(expr.operator(), left, right);
    }

    @Override
    public Expression visitArithmetic(Arithmetic expr) {
        Expression left = transform(expr.left());
        Expression right = transform(expr.right());
        if (left == expr.left() && right == expr.right()) {
            return expr;
        }
        return new Arithmetic(expr.operator(), left, right);
    }

    @Override
    public Expression visitAnd(And expr) {
        List<Expression> operands = transformAll(expr.operands());
        return sameInstances(operands, expr.operands()) ? expr : Expressions.and(operands);
    }

    @Override
    public Expression visitOr(Or expr) {
        List<Expression> operands = transformAll(expr.operands());
        return sameInstances(operands, expr.operands()) ? expr : Expressions.or(operands);
    }

    @Override
    public Expression visitNot(Not expr) {
        Expression operand = transform(expr.operand());
        return operand == expr.operand() ? expr : new Not(operand);
    }

    @Override
    public Expression visitBetween(Between expr) {
        Expression operand = transform(expr.operand());
        Expression low = transform(expr.low());
        Expression high = transform(expr.high());
        if (operand == expr.operand() && low == expr.low() && high == expr.high()) {
            return expr;
        }
        return new Between(operand, low, high);
    }

    @Override
    public Expression visitLike(Like expr) {
        Expression operand = transform(expr.operand());
        Expression pattern = transform(expr.pattern());
        if (operand == expr.operand() && pattern == expr.pattern()) {
            return expr;
        }
        return new Like(operand, pattern, expr.isRegex());
    }

    @Override
    public Expression visitIn(In expr) {
        Expression operand = transform(expr.operand());
        Expression collection = transform(expr.collection());
        if (operand == expr.operand() && collection == expr.collection()) {
            return expr;
        }
        return new In(operand, collection);
    }

    @Override
    public Expression visitWithin(Within expr) {
        Expression operand = transform(expr.operand());
        Expression collection = transform(expr.collection());
        if (operand == expr.operand() && collection == expr.collection()) {
            return expr;
        }
        return new Within(operand, collection);
    }

    @Override
    public Expression visitIs(IsExpression expr) {
        Expression operand = transform(expr.operand());
        return operand == expr.operand() ? expr : new IsExpression(expr.kind(), operand);
    }

    @Override
    public Expression visitQuantified(Quantified expr) {
        boolean changed = false;
        List<Quantified.Binding> bindings = new ArrayList<>();
        for (Quantified.Binding binding : expr.bindings()) {
            Expression collection = transform(binding.expression());
            changed |= collection != binding.expression();
            bindings.add(new Quantified.Binding(binding.variable(), collection));
        }
        Expression satisfies = transform(expr.satisfies());
        changed |= satisfies != expr.satisfies();
        return changed ? new Quantified(expr.kind(), bindings, satisfies) : expr;
    }

    @Override
    public Expression visitCaseWhen(CaseWhen expr) {
        boolean changed = false;
        List<CaseWhen.WhenClause> clauses = new ArrayList<>();
        for (CaseWhen.WhenClause clause : expr.whenClauses()) {
            Expression condition = transform(clause.condition());
            Expression result = transform(clause.result());
            changed |= condition != clause.condition() || result != clause.result();
            clauses.add(new CaseWhen.WhenClause(condition, result));
        }
        Expression elseExpr = transform(expr.elseExpr());
        changed |= elseExpr != expr.elseExpr();
        return changed ? new CaseWhen(clauses, elseExpr) : expr;
    }

    @Override
    public Expression visitArrayConstruct(ArrayConstruct expr) {
        List<Expression> elements = transformAll(expr.elements());
        return sameInstances(elements, expr.elements()) ? expr : new ArrayConstruct(elements);
    }

    @Override
    public Expression visitObjectConstruct(ObjectConstruct expr) {
        boolean changed = false;
        Map<String, Expression> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : expr.fields().entrySet()) {
            Expression value = transform(entry.getValue());
            changed |= value != entry.getValue();
            fields.put(entry.getKey(), value);
        }
        return changed ? new ObjectConstruct(fields) : expr;
    }

    @Override
    public Expression visitFunctionCall(FunctionCall expr) {
        List<Expression> arguments = transformAll(expr.arguments());
        return sameInstances(arguments, expr.arguments()) ? expr : new FunctionCall(expr.name(), arguments);
    }

    @Override
    public Expression visitSubquery(Subquery expr) {
        return expr;
    }

    private static boolean sameInstances(List<Expression> a, List<Expression> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }
}
