package org.kasd.compiler.frontend.semantics.analysis;

import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.semantics.SymbolTable;

/**
 * Handles {@link org.kasd.compiler.frontend.parser.ast.LiteralNode}s, which are always valid on their own.
 */
public class LiteralAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     * <p>
     * This implementation accepts every literal.
     */
    @Override
    public boolean analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        return true;
    }
}
