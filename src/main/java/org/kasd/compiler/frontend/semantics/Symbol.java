package org.kasd.compiler.frontend.semantics;

import org.kasd.runtime.value.ValueType;

/**
 * Represents a declared variable in the symbol table.
 *
 * @param name The variable name.
 * @param declaredType The type the variable was declared with.
 * @param line The line of the declaration.
 * @param column The column of the declaration.
 */
public record Symbol(String name, ValueType declaredType, int line, int column) {
}
