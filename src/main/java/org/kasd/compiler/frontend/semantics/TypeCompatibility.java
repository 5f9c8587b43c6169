package org.kasd.compiler.frontend.semantics;

import org.kasd.runtime.value.ValueType;

/**
 * Assignment compatibility between a declared type and the type of an initializer.
 */
public final class TypeCompatibility {

    // Rows: declared type, columns: initializer type, both in ValueType order
    // (NULL, INT, FLOAT, BOOL, STRING). The null column is handled separately.
    private static final boolean[][] TABLE = {
            { true,  false, false, false, false }, // null
            { false, true,  false, false, false }, // int
            { false, true,  true,  false, false }, // float: int widens
            { false, false, false, true,  false }, // bool
            { false, false, false, false, true  }, // string
    };

    private TypeCompatibility() {}

    /**
     * Checks whether a value of type {@code actual} may initialize a variable of type {@code declared}.
     * Identical types are compatible, {@code null} is compatible with every type and an
     * {@code int} is compatible with {@code float}.
     *
     * @param declared The declared type of the variable.
     * @param actual The type of the initializer.
     * @return {@code true} if the assignment is allowed.
     */
    public static boolean isAssignable(ValueType declared, ValueType actual) {
        if (declared == actual || actual == ValueType.NULL) {
            return true;
        }
        return TABLE[declared.ordinal()][actual.ordinal()];
    }
}
