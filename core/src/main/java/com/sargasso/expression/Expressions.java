package com.sargasso.expression;

import com.sargasso.value.Value;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Utility methods for building and inspecting expression trees.
 */
public final class Expressions {

    private Expressions() {} // Utility class

    // ==================== Factory Methods ====================

    /**
     * Creates a path expression rooted at an alias.
     *
     * @param alias the root alias
     * @param path the field names
     * @return {@code alias.path[0].path[1]...}
     */
    public static Expression path(String alias, String... path) {
        Expression expr = new Identifier(alias);
        for (String name : path) {
            expr = new Field(expr, name);
        }
        return expr;
    }

    /**
     * Returns the document key of an alias, {@code META(alias).id}.
     *
     * @param alias the alias
     * @return the key expression
     */
    public static Expression documentKey(String alias) {
        return new Field(new Meta(alias), "id");
    }

    /**
     * Returns whether an expression is the document key of the alias.
     */
    public static boolean isDocumentKey(Expression expr, String alias) {
        return documentKey(alias).equals(expr);
    }

    /**
     * Combines conjuncts: TRUE for none, the conjunct itself for one, a flat AND otherwise.
     *
     * @param conjuncts the conjuncts
     * @return the conjunction
     */
    public static Expression and(List<Expression> conjuncts) {
        List<Expression> flat = new ArrayList<>();
        for (Expression conjunct : conjuncts) {
            flat.addAll(flattenAnd(conjunct));
        }
        if (flat.isEmpty()) {
            return Literal.TRUE;
        }
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }

    public static Expression and(Expression... conjuncts) {
        return and(Arrays.asList(conjuncts));
    }

    /**
     * Combines disjuncts: FALSE for none, the disjunct itself for one, a flat OR otherwise.
     *
     * @param disjuncts the disjuncts
     * @return the disjunction
     */
    public static Expression or(List<Expression> disjuncts) {
        List<Expression> flat = new ArrayList<>();
        for (Expression disjunct : disjuncts) {
            flat.addAll(flattenOr(disjunct));
        }
        if (flat.isEmpty()) {
            return Literal.FALSE;
        }
        return flat.size() == 1 ? flat.get(0) : new Or(flat);
    }

    public static Expression or(Expression... disjuncts) {
        return or(Arrays.asList(disjuncts));
    }

    // ==================== Structure ====================

    /**
     * Flattens nested ANDs into one list of conjuncts.
     *
     * @param expr the expression
     * @return the conjuncts, or a single-element list if expr is not an AND
     */
    public static List<Expression> flattenAnd(Expression expr) {
        List<Expression> result = new ArrayList<>();
        flattenAndInto(expr, result);
        return result;
    }

    private static void flattenAndInto(Expression expr, List<Expression> into) {
        if (expr instanceof And) {
            for (Expression operand : ((And) expr).operands()) {
                flattenAndInto(operand, into);
            }
        } else {
            into.add(expr);
        }
    }

    /**
     * Flattens nested ORs into one list of disjuncts.
     *
     * @param expr the expression
     * @return the disjuncts, or a single-element list if expr is not an OR
     */
    public static List<Expression> flattenOr(Expression expr) {
        List<Expression> result = new ArrayList<>();
        flattenOrInto(expr, result);
        return result;
    }

    private static void flattenOrInto(Expression expr, List<Expression> into) {
        if (expr instanceof Or) {
            for (Expression operand : ((Or) expr).operands()) {
                flattenOrInto(operand, into);
            }
        } else {
            into.add(expr);
        }
    }

    /**
     * Returns whether a sub-expression structurally equal to target occurs in expr.
     */
    public static boolean contains(Expression expr, Expression target) {
        if (expr.equals(target)) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (contains(child, target)) {
                return true;
            }
        }
        return false;
    }

    // ==================== References ====================

    /**
     * Returns the free names (aliases, variables) an expression refers to.
     *
     * @param expr the expression
     * @return the names in encounter order
     */
    public static Set<String> freeNames(Expression expr) {
        return new ReferenceCollector().collect(expr).names();
    }

    /**
     * Returns the known aliases an expression refers to.
     *
     * @param expr the expression
     * @param aliases the aliases of interest
     * @return the referenced aliases, in encounter order
     */
    public static Set<String> referencedAliases(Expression expr, Set<String> aliases) {
        Set<String> result = new LinkedHashSet<>();
        for (String name : freeNames(expr)) {
            if (aliases.contains(name)) {
                result.add(name);
            }
        }
        return result;
    }

    /**
     * Returns whether an expression refers to any of the given aliases.
     */
    public static boolean references(Expression expr, Set<String> aliases) {
        for (String name : freeNames(expr)) {
            if (aliases.contains(name)) {
                return true;
            }
        }
        return false;
    }

    public static boolean references(Expression expr, String alias) {
        return freeNames(expr).contains(alias);
    }

    public static boolean containsSubquery(Expression expr) {
        return new ReferenceCollector().collect(expr).hasSubquery();
    }

    /**
     * Returns whether an expression has the same value for every row: it refers to
     * no alias, no variable and no subquery. Parameters are static.
     */
    public static boolean isStatic(Expression expr) {
        ReferenceCollector collector = new ReferenceCollector().collect(expr);
        return collector.names().isEmpty() && !collector.hasSubquery();
    }

    /**
     * Returns the value of a static expression when it can be computed while planning.
     *
     * @param expr the expression
     * @return the value, or empty if the expression is not static or not foldable
     */
    public static Optional<Value> staticValue(Expression expr) {
        if (expr instanceof Literal) {
            return Optional.of(((Literal) expr).value());
        }
        if (!isStatic(expr)) {
            return Optional.empty();
        }
        return ConstantEvaluator.evaluate(expr);
    }

    static String join(List<Expression> exprs, String separator) {
        StringBuilder sb = new StringBuilder();
        boolean parenthesize = !", ".equals(separator);
        if (parenthesize) sb.append('(');
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(exprs.get(i).toSQL());
        }
        if (parenthesize) sb.append(')');
        return sb.toString();
    }
}
