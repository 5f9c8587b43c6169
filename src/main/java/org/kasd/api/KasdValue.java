package org.kasd.api;

import org.kasd.runtime.value.Value;

/**
 * Host-facing value type mirroring the interpreter's Null/Int/Float/Bool/String values.
 * Only the payload field matching {@link #type()} is meaningful.
 *
 * @param type The value's type.
 * @param intValue The payload of an INT value.
 * @param floatValue The payload of a FLOAT value.
 * @param boolValue The payload of a BOOL value.
 * @param stringValue The payload of a STRING value, {@code null} for other types.
 */
public record KasdValue(Type type, long intValue, double floatValue, boolean boolValue, String stringValue) {

    public KasdValue {
        if (type == null) {
            throw new IllegalArgumentException("Value type must not be null.");
        }
        if ((type == Type.STRING) != (stringValue != null)) {
            throw new IllegalArgumentException("A string payload is required for STRING values and only for them.");
        }
    }

    /**
     * The type of a host value.
     */
    public enum Type {
        /** The null value. */
        NULL,
        /** A 64-bit integer. */
        INT,
        /** A 64-bit floating point number. */
        FLOAT,
        /** A boolean. */
        BOOL,
        /** A string. */
        STRING
    }

    private static final KasdValue NULL_VALUE = new KasdValue(Type.NULL, 0L, 0.0d, false, null);

    /** @return The null value. */
    public static KasdValue ofNull() {
        return NULL_VALUE;
    }

    /**
     * @param value The integer.
     * @return An INT value.
     */
    public static KasdValue ofInt(long value) {
        return new KasdValue(Type.INT, value, 0.0d, false, null);
    }

    /**
     * @param value The number.
     * @return A FLOAT value.
     */
    public static KasdValue ofFloat(double value) {
        return new KasdValue(Type.FLOAT, 0L, value, false, null);
    }

    /**
     * @param value The boolean.
     * @return A BOOL value.
     */
    public static KasdValue ofBool(boolean value) {
        return new KasdValue(Type.BOOL, 0L, 0.0d, value, null);
    }

    /**
     * @param value The text; {@code null} yields the null value.
     * @return A STRING value.
     */
    public static KasdValue ofString(String value) {
        if (value == null) {
            return NULL_VALUE;
        }
        return new KasdValue(Type.STRING, 0L, 0.0d, false, value);
    }

    /**
     * Converts an interpreter value.
     * @param value The interpreter value.
     * @return The host value.
     */
    public static KasdValue fromValue(Value value) {
        if (value instanceof Value.Int64 i) return ofInt(i.value());
        if (value instanceof Value.Float64 f) return ofFloat(f.value());
        if (value instanceof Value.Bool b) return ofBool(b.value());
        if (value instanceof Value.Str s) return ofString(s.value());
        return NULL_VALUE;
    }

    /**
     * Converts this host value to an interpreter value.
     * @return The interpreter value.
     */
    public Value toValue() {
        return switch (type) {
            case INT -> Value.ofInt(intValue);
            case FLOAT -> Value.ofFloat(floatValue);
            case BOOL -> Value.ofBool(boolValue);
            case STRING -> Value.ofString(stringValue);
            case NULL -> Value.NULL;
        };
    }

    @Override
    public String toString() {
        return toValue().render();
    }
}
