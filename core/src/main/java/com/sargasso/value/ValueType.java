package com.sargasso.value;

/**
 * Types of document values, declared in collation order.
 *
 * <p>Values of different types compare by the ordinal of their type, so every
 * MISSING sorts before every NULL, every NULL before every boolean, and so on.
 */
public enum ValueType {
    MISSING,
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    BINARY;

    /**
     * Returns whether values of this type are scalars.
     *
     * @return true unless this is ARRAY or OBJECT
     */
    public boolean isScalar() {
        return this != ARRAY && this != OBJECT;
    }

    /**
     * Returns whether values of this type are known (neither MISSING nor NULL).
     *
     * @return true for every type except MISSING and NULL
     */
    public boolean isKnown() {
        return this != MISSING && this != NULL;
    }
}
