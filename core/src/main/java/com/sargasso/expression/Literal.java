package com.sargasso.expression;

import com.sargasso.value.Value;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>Examples:
 * <pre>
 *   Literal.of(42)        // 42
 *   Literal.of("abc")     // "abc"
 *   Literal.TRUE          // TRUE
 *   Literal.MISSING       // MISSING
 * </pre>
 */
public final class Literal implements Expression {

    public static final Literal TRUE = new Literal(Value.TRUE);
    public static final Literal FALSE = new Literal(Value.FALSE);
    public static final Literal NULL = new Literal(Value.NULL);
    public static final Literal MISSING = new Literal(Value.MISSING);

    private final Value value;

    /**
     * Creates a literal.
     *
     * @param value the constant value
     */
    public Literal(Value value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Creates a literal from a plain Java object.
     *
     * @param object the object, converted with {@link Value#of(Object)}
     * @return the literal
     */
    public static Literal of(Object object) {
        return new Literal(Value.of(object));
    }

    public Value value() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSQL() {
        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        return value.equals(((Literal) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
