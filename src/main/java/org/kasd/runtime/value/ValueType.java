package org.kasd.runtime.value;

/**
 * The type tags of the value model. A tag doubles as the declared type of a variable.
 */
public enum ValueType {
    /** The type of the {@code null} literal. */
    NULL("null"),
    /** 64-bit signed integers. */
    INT("int"),
    /** 64-bit IEEE 754 floating point numbers. */
    FLOAT("float"),
    /** {@code true} or {@code false}. */
    BOOL("bool"),
    /** Character strings. */
    STRING("string");

    private final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the name of this type as written in source code.
     * @return The source-level type name, e.g. {@code "int"}.
     */
    public String typeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
