package com.sargasso.expression;

import java.util.Objects;

/**
 * Binds catalog expressions to a query alias.
 *
 * <p>Index keys and index conditions are stored relative to the indexed
 * document, which they name with the reserved identifier {@value #DOCUMENT}.
 * Before matching them against a query predicate the planner replaces that
 * identifier with the alias of the keyspace being scanned.
 *
 * <p>Examples:
 * <pre>
 *   Formalizer.key("x")                      // #doc.x
 *   formalize(#doc.x, "a")                   // a.x
 *   formalize(META(#doc).id, "a")            // META(a).id
 * </pre>
 */
public final class Formalizer extends ExpressionTransformer {

    /** Reserved name of the indexed document in catalog expressions. */
    public static final String DOCUMENT = "#doc";

    private final String alias;

    private Formalizer(String alias) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    /**
     * Creates a catalog key path over the indexed document.
     *
     * @param path the field names
     * @return {@code #doc.path[0].path[1]...}
     */
    public static Expression key(String... path) {
        return Expressions.path(DOCUMENT, path);
    }

    /**
     * Returns the catalog form of the document key, {@code META(#doc).id}.
     */
    public static Expression documentKey() {
        return Expressions.documentKey(DOCUMENT);
    }

    /**
     * Rewrites a catalog expression in terms of a query alias.
     *
     * @param expr the catalog expression (may be null)
     * @param alias the alias of the scanned keyspace
     * @return the bound expression, or null if expr is null
     */
    public static Expression formalize(Expression expr, String alias) {
        return new Formalizer(alias).transform(expr);
    }

    @Override
    public Expression visitIdentifier(Identifier expr) {
        return DOCUMENT.equals(expr.name()) ? new Identifier(alias) : expr;
    }

    @Override
    public Expression visitMeta(Meta expr) {
        return DOCUMENT.equals(expr.alias()) ? new Meta(alias) : expr;
    }
}
