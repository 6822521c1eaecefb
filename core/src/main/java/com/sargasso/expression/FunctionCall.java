package com.sargasso.expression;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Call of a named scalar function. Function names are case-insensitive and
 * stored upper case.
 */
public final class FunctionCall implements Expression {

    private final String name;
    private final List<Expression> arguments;

    public FunctionCall(String name, List<Expression> arguments) {
        this.name = Objects.requireNonNull(name, "name must not be null").toUpperCase(Locale.ROOT);
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public FunctionCall(String name, Expression... arguments) {
        this(name, List.of(arguments));
    }

    public String name() {
        return name;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public String toSQL() {
        return name + "(" + Expressions.join(arguments, ", ") + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall other = (FunctionCall) obj;
        return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }
}
