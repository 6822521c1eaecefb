package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * Produces document keys directly from an expression, as for {@code USE KEYS}
 * or an equality on {@code META(alias).id}.
 */
public final class KeyScan extends PlanOperator {

    private final String alias;
    private final Expression keys;

    public KeyScan(String alias, Expression keys) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
    }

    public String alias() {
        return alias;
    }

    public Expression keys() {
        return keys;
    }

    @Override
    public String describe() {
        return String.format("KeyScan(%s, keys=%s)", alias, keys.toSQL());
    }
}
