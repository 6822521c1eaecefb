package com.sargasso.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Object constructor ({@code {"name": expr, ...}}). Field order is preserved.
 */
public final class ObjectConstruct implements Expression {

    private final Map<String, Expression> fields;

    public ObjectConstruct(Map<String, Expression> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, Expression> fields() {
        return fields;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitObjectConstruct(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(new ArrayList<>(fields.values()));
    }

    @Override
    public String toSQL() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Expression> entry : fields.entrySet()) {
            if (!first) sb.append(", ");
            sb.append('"').append(entry.getKey()).append("\": ").append(entry.getValue().toSQL());
            first = false;
        }
        return sb.append("}").toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ObjectConstruct)) return false;
        return fields.equals(((ObjectConstruct) obj).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash("{}", fields);
    }
}
