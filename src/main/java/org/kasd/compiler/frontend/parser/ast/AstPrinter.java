package org.kasd.compiler.frontend.parser.ast;

/**
 * Renders an AST as an indented tree for debug output, two spaces per level.
 */
public final class AstPrinter {

    private AstPrinter() {}

    /**
     * Prints a tree.
     * @param node The root, may be {@code null}.
     * @return The rendered tree, one node per line; empty for {@code null}.
     */
    public static String print(AstNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(AstNode node, int indent, StringBuilder sb) {
        if (node == null) {
            return;
        }
        sb.append("  ".repeat(indent));
        if (node instanceof VariableDeclarationNode decl) {
            sb.append("VariableDeclaration: ").append(decl.name())
                    .append(" (type: ").append(decl.declaredType().typeName()).append(")\n");
        } else if (node instanceof LiteralNode literal) {
            sb.append("Literal: ").append(literal.value().render())
                    .append(" (type: ").append(literal.value().type().typeName()).append(")\n");
        } else {
            sb.append(node.getClass().getSimpleName()).append('\n');
        }
        for (AstNode child : node.getChildren()) {
            print(child, indent + 1, sb);
        }
    }
}
