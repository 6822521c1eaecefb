package com.sargasso.expression;

import com.sargasso.value.Value;
import java.util.List;
import java.util.Optional;

/**
 * Conservative test of whether one predicate implies another.
 *
 * <p>Used to decide whether a partial index (an index with a WHERE condition)
 * can answer a query: the query predicate must imply the index condition.
 * A false answer only means the implication could not be shown.
 */
public final class Implication {

    private Implication() {} // Utility class

    /**
     * Returns whether {@code pred} implies {@code cond}.
     *
     * @param pred the predicate known to hold
     * @param cond the condition to establish
     * @return true if every row satisfying pred is shown to satisfy cond
     */
    public static boolean implies(Expression pred, Expression cond) {
        if (pred.equals(cond)) {
            return true;
        }
        if (cond instanceof Literal) {
            return ((Literal) cond).value().truth();
        }
        if (cond instanceof And) {
            for (Expression conjunct : ((And) cond).operands()) {
                if (!implies(pred, conjunct)) {
                    return false;
                }
            }
            return true;
        }
        if (pred instanceof Or) {
            for (Expression disjunct : ((Or) pred).operands()) {
                if (!implies(disjunct, cond)) {
                    return false;
                }
            }
            return true;
        }
        if (pred instanceof And) {
            for (Expression conjunct : ((And) pred).operands()) {
                if (implies(conjunct, cond)) {
                    return true;
                }
            }
        }
        if (cond instanceof Or) {
            for (Expression disjunct : ((Or) cond).operands()) {
                if (implies(pred, disjunct)) {
                    return true;
                }
            }
            return false;
        }
        if (cond instanceof IsExpression) {
            return impliesIs(pred, (IsExpression) cond);
        }
        if (cond instanceof Comparison && pred instanceof Comparison) {
            return impliesComparison((Comparison) pred, (Comparison) cond);
        }
        return false;
    }

    private static boolean impliesIs(Expression pred, IsExpression cond) {
        Expression operand = cond.operand();
        switch (cond.kind()) {
            case NOT_MISSING:
            case NOT_NULL:
            case VALUED:
                break;
            default:
                return pred instanceof IsExpression && pred.equals(cond);
        }
        if (pred instanceof IsExpression) {
            IsExpression is = (IsExpression) pred;
            if (!is.operand().equals(operand)) {
                return false;
            }
            switch (is.kind()) {
                case NOT_NULL:
                case VALUED:
                    return true;
                case NOT_MISSING:
                    return cond.kind() == IsExpression.Kind.NOT_MISSING;
                case NULL:
                    return cond.kind() == IsExpression.Kind.NOT_MISSING;
                default:
                    return false;
            }
        }
        // a comparison with a known value is satisfied only by valued operands
        for (Expression compared : comparedOperands(pred)) {
            if (compared.equals(operand)) {
                return true;
            }
        }
        return false;
    }

    private static List<Expression> comparedOperands(Expression pred) {
        if (pred instanceof Comparison) {
            Comparison cmp = (Comparison) pred;
            return List.of(cmp.left(), cmp.right());
        }
        if (pred instanceof Between) {
            return List.of(((Between) pred).operand());
        }
        if (pred instanceof Like) {
            return List.of(((Like) pred).operand());
        }
        if (pred instanceof In) {
            return List.of(((In) pred).operand());
        }
        if (pred instanceof Within) {
            return List.of(((Within) pred).operand());
        }
        return List.of();
    }

    private static boolean impliesComparison(Comparison pred, Comparison cond) {
        Comparison p = keyOnLeft(pred);
        Comparison c = keyOnLeft(cond);
        if (p == null || c == null || !p.left().equals(c.left())) {
            return false;
        }
        Optional<Value> pv = Expressions.staticValue(p.right());
        Optional<Value> cv = Expressions.staticValue(c.right());
        if (pv.isEmpty() || cv.isEmpty() || !pv.get().isKnown() || !cv.get().isKnown()) {
            return false;
        }
        int d = pv.get().compareTo(cv.get());
        switch (c.operator()) {
            case EQ:
                return p.operator() == Comparison.Operator.EQ && d == 0;
            case NE:
                switch (p.operator()) {
                    case EQ: return d != 0;
                    case LT: return d <= 0;
                    case LE: return d < 0;
                    case GT: return d >= 0;
                    case GE: return d > 0;
                    default: return d == 0;
                }
            case LT:
                return (p.operator() == Comparison.Operator.EQ && d < 0)
                    || (p.operator() == Comparison.Operator.LT && d <= 0)
                    || (p.operator() == Comparison.Operator.LE && d < 0);
            case LE:
                return (p.operator() == Comparison.Operator.EQ && d <= 0)
                    || (p.operator() == Comparison.Operator.LT && d <= 0)
                    || (p.operator() == Comparison.Operator.LE && d <= 0);
            case GT:
                return (p.operator() == Comparison.Operator.EQ && d > 0)
                    || (p.operator() == Comparison.Operator.GT && d >= 0)
                    || (p.operator() == Comparison.Operator.GE && d > 0);
            case GE:
                return (p.operator() == Comparison.Operator.EQ && d >= 0)
                    || (p.operator() == Comparison.Operator.GT && d >= 0)
                    || (p.operator() == Comparison.Operator.GE && d >= 0);
            default:
                return false;
        }
    }

    private static Comparison keyOnLeft(Comparison cmp) {
        boolean leftStatic = Expressions.isStatic(cmp.left());
        boolean rightStatic = Expressions.isStatic(cmp.right());
        if (!leftStatic && rightStatic) {
            return cmp;
        }
        if (leftStatic && !rightStatic) {
            return new Comparison(cmp.operator().mirror(), cmp.right(), cmp.left());
        }
        return null;
    }
}
