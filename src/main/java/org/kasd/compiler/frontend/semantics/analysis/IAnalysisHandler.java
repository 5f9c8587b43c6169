package org.kasd.compiler.frontend.semantics.analysis;

import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of AST node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node.
     * @param node The node to analyze.
     * @param symbolTable The symbol table of the current pass.
     * @param diagnostics The engine for reporting errors.
     * @return {@code true} if the node is valid.
     */
    boolean analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
