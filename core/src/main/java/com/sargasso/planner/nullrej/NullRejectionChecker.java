package com.sargasso.planner.nullrej;

import com.sargasso.expression.And;
import com.sargasso.expression.Arithmetic;
import com.sargasso.expression.ArrayConstruct;
import com.sargasso.expression.Between;
import com.sargasso.expression.CaseWhen;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Element;
import com.sargasso.expression.Expression;
import com.sargasso.expression.ExpressionVisitor;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Field;
import com.sargasso.expression.FunctionCall;
import com.sargasso.expression.Identifier;
import com.sargasso.expression.In;
import com.sargasso.expression.IsExpression;
import com.sargasso.expression.Like;
import com.sargasso.expression.Literal;
import com.sargasso.expression.Meta;
import com.sargasso.expression.Not;
import com.sargasso.expression.ObjectConstruct;
import com.sargasso.expression.Or;
import com.sargasso.expression.Parameter;
import com.sargasso.expression.Quantified;
import com.sargasso.expression.Subquery;
import com.sargasso.expression.Within;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a predicate is null-rejecting for a set of aliases.
 *
 * <p>A predicate is null-rejecting when it cannot be TRUE for a row in which
 * the aliases produced no document, i.e. when every reference to them is
 * MISSING. Such a predicate in the WHERE clause (or in a later inner join)
 * removes exactly the rows an outer join would have preserved, so the outer
 * join can be planned as an inner join.
 *
 * <p>The analysis is conservative and purely structural: any shape not known to
 * propagate MISSING is treated as not null-rejecting.
 */
public final class NullRejectionChecker implements ExpressionVisitor<Boolean> {

    private final Set<String> aliases;
    private final Strictness strictness;

    private NullRejectionChecker(Set<String> aliases) {
        this.aliases = Collections.unmodifiableSet(new HashSet<>(aliases));
        this.strictness = new Strictness();
    }

    /**
     * Returns whether a predicate is null-rejecting for an alias.
     *
     * @param expr the predicate
     * @param alias the alias
     * @return true if the predicate cannot hold when the alias is MISSING
     */
    public static boolean isNullRejecting(Expression expr, String alias) {
        return isNullRejecting(expr, Set.of(alias));
    }

    /**
     * Returns whether a predicate is null-rejecting for a set of aliases that are
     * all MISSING together (an outer-joined alias and the unnests depending on it).
     *
     * @param expr the predicate
     * @param aliases the aliases
     * @return true if the predicate cannot hold when the aliases are MISSING
     */
    public static boolean isNullRejecting(Expression expr, Set<String> aliases) {
        Objects.requireNonNull(expr, "expr must not be null");
        return expr.accept(new NullRejectionChecker(aliases));
    }

    private boolean refers(Expression expr) {
        return Expressions.references(expr, aliases);
    }

    /**
     * Null-rejecting if some operand refers to the aliases and every operand that
     * does is strict (MISSING whenever the aliases are).
     */
    private boolean visitOperands(List<Expression> operands) {
        boolean referenced = false;
        for (Expression operand : operands) {
            if (refers(operand)) {
                if (!operand.accept(strictness)) {
                    return false;
                }
                referenced = true;
            }
        }
        return referenced;
    }

    // ==================== Connectives ====================

    @Override
    public Boolean visitAnd(And expr) {
        for (Expression operand : expr.operands()) {
            if (refers(operand) && operand.accept(this)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitOr(Or expr) {
        for (Expression operand : expr.operands()) {
            if (!refers(operand) || !operand.accept(this)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Boolean visitNot(Not expr) {
        Expression operand = expr.operand();
        boolean preserving = (operand instanceof Comparison
                && ((Comparison) operand).operator() == Comparison.Operator.EQ)
            || operand instanceof In
            || operand instanceof Within
            || operand instanceof Like
            || operand instanceof Between
            || operand instanceof And
            || operand instanceof Or;
        return preserving && operand.accept(this);
    }

    // ==================== Comparisons ====================

    @Override
    public Boolean visitComparison(Comparison expr) {
        return visitOperands(expr.children());
    }

    @Override
    public Boolean visitBetween(Between expr) {
        return visitOperands(expr.children());
    }

    @Override
    public Boolean visitLike(Like expr) {
        return visitOperands(expr.children());
    }

    @Override
    public Boolean visitIn(In expr) {
        return visitOperands(expr.children());
    }

    @Override
    public Boolean visitWithin(Within expr) {
        return visitOperands(expr.children());
    }

    @Override
    public Boolean visitIs(IsExpression expr) {
        switch (expr.kind()) {
            case NOT_MISSING:
            case NOT_NULL:
            case VALUED:
                return visitOperands(expr.children());
            default:
                return false;
        }
    }

    @Override
    public Boolean visitQuantified(Quantified expr) {
        Set<String> extended = new HashSet<>(aliases);
        boolean dependent = false;
        for (Quantified.Binding binding : expr.bindings()) {
            if (Expressions.references(binding.expression(), extended)) {
                extended.add(binding.variable());
                dependent = true;
            } else {
                extended.remove(binding.variable());
            }
        }
        if (!dependent) {
            return false;
        }
        return expr.satisfies().accept(new NullRejectionChecker(extended));
    }

    // ==================== Values used as predicates ====================

    @Override
    public Boolean visitIdentifier(Identifier expr) {
        return aliases.contains(expr.name());
    }

    @Override
    public Boolean visitField(Field expr) {
        return expr.accept(strictness);
    }

    @Override
    public Boolean visitMeta(Meta expr) {
        return aliases.contains(expr.alias());
    }

    @Override
    public Boolean visitLiteral(Literal expr) {
        return false;
    }

    @Override
    public Boolean visitParameter(Parameter expr) {
        return false;
    }

    @Override
    public Boolean visitElement(Element expr) {
        return false;
    }

    @Override
    public Boolean visitArithmetic(Arithmetic expr) {
        return false;
    }

    @Override
    public Boolean visitCaseWhen(CaseWhen expr) {
        return false;
    }

    @Override
    public Boolean visitArrayConstruct(ArrayConstruct expr) {
        return false;
    }

    @Override
    public Boolean visitObjectConstruct(ObjectConstruct expr) {
        return false;
    }

    @Override
    public Boolean visitFunctionCall(FunctionCall expr) {
        return false;
    }

    @Override
    public Boolean visitSubquery(Subquery expr) {
        return false;
    }

    /**
     * Whether a value expression is MISSING whenever the aliases are.
     *
     * <p>Identifiers and metadata of the aliases are strict, field access on a
     * strict base is strict, and arithmetic is strict when its operands that
     * refer to the aliases are. Everything else may turn MISSING into a value.
     */
    private final class Strictness implements ExpressionVisitor<Boolean> {

        private boolean strictOperands(List<Expression> operands) {
            boolean referenced = false;
            for (Expression operand : operands) {
                if (refers(operand)) {
                    if (!operand.accept(this)) {
                        return false;
                    }
                    referenced = true;
                }
            }
            return referenced;
        }

        @Override
        public Boolean visitIdentifier(Identifier expr) {
            return aliases.contains(expr.name());
        }

        @Override
        public Boolean visitMeta(Meta expr) {
            return aliases.contains(expr.alias());
        }

        @Override
        public Boolean visitField(Field expr) {
            return expr.base().accept(this);
        }

        @Override
        public Boolean visitArithmetic(Arithmetic expr) {
            return strictOperands(Arrays.asList(expr.left(), expr.right()));
        }

        @Override
        public Boolean visitLiteral(Literal expr) {
            return false;
        }

        @Override
        public Boolean visitParameter(Parameter expr) {
            return false;
        }

        @Override
        public Boolean visitElement(Element expr) {
            return false;
        }

        @Override
        public Boolean visitComparison(Comparison expr) {
            return false;
        }

        @Override
        public Boolean visitAnd(And expr) {
            return false;
        }

        @Override
        public Boolean visitOr(Or expr) {
            return false;
        }

        @Override
        public Boolean visitNot(Not expr) {
            return false;
        }

        @Override
        public Boolean visitBetween(Between expr) {
            return false;
        }

        @Override
        public Boolean visitLike(Like expr) {
            return false;
        }

        @Override
        public Boolean visitIn(In expr) {
            return false;
        }

        @Override
        public Boolean visitWithin(Within expr) {
            return false;
        }

        @Override
        public Boolean visitIs(IsExpression expr) {
            return false;
        }

        @Override
        public Boolean visitQuantified(Quantified expr) {
            return false;
        }

        @Override
        public Boolean visitCaseWhen(CaseWhen expr) {
            return false;
        }

        @Override
        public Boolean visitArrayConstruct(ArrayConstruct expr) {
            return false;
        }

        @Override
        public Boolean visitObjectConstruct(ObjectConstruct expr) {
            return false;
        }

        @Override
        public Boolean visitFunctionCall(FunctionCall expr) {
            return false;
        }

        @Override
        public Boolean visitSubquery(Subquery expr) {
            return false;
        }
    }
}
