package com.sargasso.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * An immutable JSON-like document value.
 *
 * <p>Values carry a {@link ValueType} and are totally ordered by the collation
 * order of the document engine: first by type, then by content. Numbers are
 * held as doubles, arrays as lists and objects as maps sorted by field name.
 *
 * <p>Examples:
 * <pre>
 *   Value.of(1)                     // NUMBER
 *   Value.of("abc")                 // STRING
 *   Value.of(List.of(1, 2, 3))      // ARRAY
 *   Value.MISSING                   // absent field
 * </pre>
 */
public final class Value implements Comparable<Value> {

    public static final Value MISSING = new Value(ValueType.MISSING, null);
    public static final Value NULL = new Value(ValueType.NULL, null);
    public static final Value TRUE = new Value(ValueType.BOOLEAN, Boolean.TRUE);
    public static final Value FALSE = new Value(ValueType.BOOLEAN, Boolean.FALSE);

    private final ValueType type;
    private final Object actual;

    private Value(ValueType type, Object actual) {
        this.type = type;
        this.actual = actual;
    }

    // ==================== Factory Methods ====================

    /**
     * Converts a plain Java object into a value.
     *
     * <p>Accepts {@code null}, booleans, numbers, strings, byte arrays, lists,
     * maps with string keys and existing values.
     *
     * @param object the object to convert
     * @return the value
     * @throws IllegalArgumentException if the object has no value representation
     */
    public static Value of(Object object) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof Boolean) {
            return ((Boolean) object) ? TRUE : FALSE;
        }
        if (object instanceof Number) {
            double d = ((Number) object).doubleValue();
            // fold -0.0 so equal numbers hash alike
            return new Value(ValueType.NUMBER, d == 0.0 ? 0.0 : d);
        }
        if (object instanceof String) {
            return new Value(ValueType.STRING, object);
        }
        if (object instanceof byte[]) {
            return new Value(ValueType.BINARY, ((byte[]) object).clone());
        }
        if (object instanceof List<?>) {
            List<Value> elements = new ArrayList<>();
            for (Object element : (List<?>) object) {
                elements.add(of(element));
            }
            return new Value(ValueType.ARRAY, Collections.unmodifiableList(elements));
        }
        if (object instanceof Map<?, ?>) {
            Map<String, Value> fields = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) object).entrySet()) {
                fields.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return new Value(ValueType.OBJECT, Collections.unmodifiableMap(fields));
        }
        throw new IllegalArgumentException(
            "Cannot convert " + object.getClass().getName() + " to a document value");
    }

    /**
     * Creates an array value from values.
     *
     * @param elements the elements
     * @return the array value
     */
    public static Value array(List<Value> elements) {
        return new Value(ValueType.ARRAY, List.copyOf(elements));
    }

    /**
     * Creates a boolean value.
     *
     * @param b the boolean
     * @return TRUE or FALSE
     */
    public static Value of(boolean b) {
        return b ? TRUE : FALSE;
    }

    // ==================== Accessors ====================

    public ValueType type() {
        return type;
    }

    /**
     * Returns the underlying Java object.
     *
     * @return a Boolean, Double, String, byte[], List of values, Map of values or null
     */
    public Object actual() {
        return actual;
    }

    /**
     * Returns the truth of this value in a WHERE clause: only boolean TRUE passes.
     *
     * @return true if this value is boolean true
     */
    public boolean truth() {
        return type == ValueType.BOOLEAN && (Boolean) actual;
    }

    public boolean isKnown() {
        return type.isKnown();
    }

    public double number() {
        if (type != ValueType.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return (Double) actual;
    }

    public String string() {
        if (type != ValueType.STRING) {
            throw new IllegalStateException("Not a string: " + this);
        }
        return (String) actual;
    }

    @SuppressWarnings("unchecked")
    public List<Value> elements() {
        if (type != ValueType.ARRAY) {
            throw new IllegalStateException("Not an array: " + this);
        }
        return (List<Value>) actual;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> fields() {
        if (type != ValueType.OBJECT) {
            throw new IllegalStateException("Not an object: " + this);
        }
        return (Map<String, Value>) actual;
    }

    /**
     * Returns every value nested inside this one, depth first, without duplicates.
     *
     * <p>Used by WITHIN, which matches a value against all descendants of a collection.
     *
     * @return the distinct descendants in encounter order
     */
    public Set<Value> descendants() {
        Set<Value> result = new LinkedHashSet<>();
        collectDescendants(this, result);
        return result;
    }

    private static void collectDescendants(Value value, Set<Value> into) {
        Iterable<Value> nested;
        if (value.type == ValueType.ARRAY) {
            nested = value.elements();
        } else if (value.type == ValueType.OBJECT) {
            nested = value.fields().values();
        } else {
            return;
        }
        for (Value child : nested) {
            into.add(child);
            collectDescendants(child, into);
        }
    }

    // ==================== Collation ====================

    @Override
    public int compareTo(Value other) {
        int byType = type.compareTo(other.type);
        if (byType != 0) {
            return byType;
        }
        switch (type) {
            case MISSING:
            case NULL:
                return 0;
            case BOOLEAN:
                return Boolean.compare((Boolean) actual, (Boolean) other.actual);
            case NUMBER:
                return Double.compare((Double) actual, (Double) other.actual);
            case STRING:
                return ((String) actual).compareTo((String) other.actual);
            case ARRAY:
                return compareArrays(elements(), other.elements());
            case OBJECT:
                return compareObjects(fields(), other.fields());
            case BINARY:
                return compareBytes((byte[]) actual, (byte[]) other.actual);
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    private static int compareArrays(List<Value> left, List<Value> right) {
        int n = Math.min(left.size(), right.size());
        for (int i = 0; i < n; i++) {
            int c = left.get(i).compareTo(right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareObjects(Map<String, Value> left, Map<String, Value> right) {
        int bySize = Integer.compare(left.size(), right.size());
        if (bySize != 0) {
            return bySize;
        }
        Iterator<Map.Entry<String, Value>> li = left.entrySet().iterator();
        Iterator<Map.Entry<String, Value>> ri = right.entrySet().iterator();
        while (li.hasNext()) {
            Map.Entry<String, Value> l = li.next();
            Map.Entry<String, Value> r = ri.next();
            int c = l.getKey().compareTo(r.getKey());
            if (c == 0) {
                c = l.getValue().compareTo(r.getValue());
            }
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    private static int compareBytes(byte[] left, byte[] right) {
        int n = Math.min(left.length, right.length);
        for (int i = 0; i < n; i++) {
            int c = Byte.compare(left[i], right[i]);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.length, right.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Value)) return false;
        Value other = (Value) obj;
        return type == other.type && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        if (type == ValueType.BINARY) {
            return java.util.Arrays.hashCode((byte[]) actual);
        }
        return Objects.hash(type, actual);
    }

    @Override
    public String toString() {
        switch (type) {
            case MISSING:
                return "MISSING";
            case NULL:
                return "NULL";
            case BOOLEAN:
                return ((Boolean) actual) ? "TRUE" : "FALSE";
            case NUMBER: {
                double d = (Double) actual;
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                return Double.toString(d);
            }
            case STRING:
                return "\"" + ((String) actual).replace("\"", "\\\"") + "\"";
            case ARRAY: {
                StringBuilder sb = new StringBuilder("[");
                List<Value> elements = elements();
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(elements.get(i));
                }
                return sb.append("]").toString();
            }
            case OBJECT: {
                StringBuilder sb = new StringBuilder("{");
                boolean first = true;
                for (Map.Entry<String, Value> entry : fields().entrySet()) {
                    if (!first) sb.append(", ");
                    sb.append('"').append(entry.getKey()).append("\": ").append(entry.getValue());
                    first = false;
                }
                return sb.append("}").toString();
            }
            case BINARY:
                return "<binary " + ((byte[]) actual).length + " bytes>";
            default:
                return type.name();
        }
    }
}
