package com.sargasso.expression;

import com.sargasso.value.Value;
import com.sargasso.value.ValueType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pushes negation down to the leaves and flattens AND/OR, optionally expanding
 * into disjunctive normal form.
 *
 * <p>Negation rewrites:
 * <ul>
 *   <li>{@code NOT NOT e} to {@code e}</li>
 *   <li>{@code NOT (a AND b)} to {@code NOT a OR NOT b} and dually for OR</li>
 *   <li>{@code NOT a = b} to {@code a != b}, {@code NOT a < b} to {@code a >= b}, and so on</li>
 *   <li>{@code NOT e IS NULL} to {@code e IS NOT NULL}, and so on</li>
 *   <li>{@code NOT e IN [x, y]} to {@code e != x AND e != y}</li>
 * </ul>
 *
 * <p>Constant TRUE/FALSE operands of AND/OR are folded. BETWEEN is kept as is.
 *
 * <p>DNF expansion distributes AND over OR as long as the number of resulting
 * disjuncts stays within the configured complexity; larger conjunctions are left
 * in their NNF shape.
 */
public final class Normalizer extends ExpressionTransformer {

    private final boolean dnf;
    private final int maxComplexity;

    /**
     * Creates a normalizer.
     *
     * @param dnf whether to expand AND over OR
     * @param maxComplexity the largest number of disjuncts a DNF expansion may produce
     */
    public Normalizer(boolean dnf, int maxComplexity) {
        this.dnf = dnf;
        this.maxComplexity = maxComplexity;
    }

    /**
     * Rewrites an expression to negation normal form without DNF expansion.
     *
     * @param expr the expression
     * @return the normalized expression
     */
    public static Expression nnf(Expression expr) {
        return new Normalizer(false, 0).transform(expr);
    }

    /**
     * Rewrites an expression to bounded disjunctive normal form.
     *
     * @param expr the expression
     * @param maxComplexity the largest number of disjuncts to produce
     * @return the normalized expression
     */
    public static Expression dnf(Expression expr, int maxComplexity) {
        return new Normalizer(true, maxComplexity).transform(expr);
    }

    @Override
    public Expression visitNot(Not expr) {
        Expression operand = expr.operand();
        if (operand instanceof Not) {
            return transform(((Not) operand).operand());
        }
        if (operand instanceof And) {
            List<Expression> negated = new ArrayList<>();
            for (Expression child : ((And) operand).operands()) {
                negated.add(new Not(child));
            }
            return transform(new Or(negated));
        }
        if (operand instanceof Or) {
            List<Expression> negated = new ArrayList<>();
            for (Expression child : ((Or) operand).operands()) {
                negated.add(new Not(child));
            }
            return transform(new And(negated));
        }
        if (operand instanceof Comparison) {
            Comparison cmp = (Comparison) operand;
            return new Comparison(cmp.operator().negate(), transform(cmp.left()), transform(cmp.right()));
        }
        if (operand instanceof IsExpression) {
            IsExpression is = (IsExpression) operand;
            return new IsExpression(is.kind().negate(), transform(is.operand()));
        }
        if (operand instanceof In && ((In) operand).collection() instanceof ArrayConstruct) {
            In in = (In) operand;
            List<Expression> elements = ((ArrayConstruct) in.collection()).elements();
            if (!elements.isEmpty()) {
                Expression lhs = transform(in.operand());
                List<Expression> conjuncts = new ArrayList<>();
                for (Expression element : elements) {
                    conjuncts.add(Comparison.ne(lhs, transform(element)));
                }
                return Expressions.and(conjuncts);
            }
        }
        if (operand instanceof Literal) {
            Value v = ((Literal) operand).value();
            if (v.type() == ValueType.BOOLEAN) {
                return v.truth() ? Literal.FALSE : Literal.TRUE;
            }
            return operand;
        }
        Expression inner = transform(operand);
        return inner == operand ? expr : new Not(inner);
    }

    @Override
    public Expression visitAnd(And expr) {
        List<Expression> operands = new ArrayList<>();
        for (Expression operand : expr.operands()) {
            for (Expression conjunct : Expressions.flattenAnd(transform(operand))) {
                Optional<Boolean> constant = booleanConstant(conjunct);
                if (constant.isPresent()) {
                    if (!constant.get()) {
                        return Literal.FALSE;
                    }
                    continue;
                }
                if (!operands.contains(conjunct)) {
                    operands.add(conjunct);
                }
            }
        }
        Expression result = Expressions.and(operands);
        if (dnf && result instanceof And) {
            return distribute((And) result);
        }
        return result;
    }

    @Override
    public Expression visitOr(Or expr) {
        List<Expression> operands = new ArrayList<>();
        for (Expression operand : expr.operands()) {
            for (Expression disjunct : Expressions.flattenOr(transform(operand))) {
                Optional<Boolean> constant = booleanConstant(disjunct);
                if (constant.isPresent()) {
                    if (constant.get()) {
                        return Literal.TRUE;
                    }
                    continue;
                }
                if (!operands.contains(disjunct)) {
                    operands.add(disjunct);
                }
            }
        }
        return Expressions.or(operands);
    }

    private Expression distribute(And and) {
        long complexity = 1;
        for (Expression operand : and.operands()) {
            if (operand instanceof Or) {
                complexity *= ((Or) operand).operands().size();
                if (complexity > maxComplexity) {
                    return and;
                }
            }
        }
        if (complexity == 1) {
            return and;
        }
        List<List<Expression>> products = new ArrayList<>();
        products.add(new ArrayList<>());
        for (Expression operand : and.operands()) {
            List<Expression> choices = Expressions.flattenOr(operand);
            List<List<Expression>> next = new ArrayList<>();
            for (List<Expression> prefix : products) {
                for (Expression choice : choices) {
                    List<Expression> extended = new ArrayList<>(prefix);
                    extended.add(choice);
                    next.add(extended);
                }
            }
            products = next;
        }
        List<Expression> disjuncts = new ArrayList<>();
        for (List<Expression> product : products) {
            disjuncts.add(Expressions.and(product));
        }
        return Expressions.or(disjuncts);
    }

    private static Optional<Boolean> booleanConstant(Expression expr) {
        if (expr instanceof Literal && ((Literal) expr).value().type() == ValueType.BOOLEAN) {
            return Optional.of(((Literal) expr).value().truth());
        }
        return Optional.empty();
    }
}
