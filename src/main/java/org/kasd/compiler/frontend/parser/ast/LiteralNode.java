package org.kasd.compiler.frontend.parser.ast;

import org.kasd.runtime.value.Value;

/**
 * An AST node that represents a literal value.
 *
 * @param value The literal's value.
 * @param line The line of the literal token.
 * @param column The column of the literal token.
 */
public record LiteralNode(
        Value value,
        int line,
        int column
) implements AstNode {

    // This node has no children and inherits the empty list from getChildren().
}
