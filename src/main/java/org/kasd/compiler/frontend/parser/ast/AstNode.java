package org.kasd.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable; a node is the only owner of its children.
 */
public interface AstNode {

    /**
     * Returns the line on which the construct starts.
     * @return The 1-based line number.
     */
    int line();

    /**
     * Returns the column at which the construct starts.
     * @return The 1-based column number.
     */
    int column();

    /**
     * Returns a list of the direct child nodes.
     * This allows generic traversal of the tree without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
