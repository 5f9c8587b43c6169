package org.kasd.compiler.frontend.parser.ast;

import org.kasd.runtime.value.ValueType;

import java.util.List;

/**
 * An AST node that represents a <code>let name: type = initializer;</code> declaration.
 *
 * @param name The name of the declared variable.
 * @param declaredType The type written after the colon.
 * @param initializer The node producing the initial value.
 * @param line The line of the variable name.
 * @param column The column of the variable name.
 */
public record VariableDeclarationNode(
        String name,
        ValueType declaredType,
        AstNode initializer,
        int line,
        int column
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer);
    }
}
