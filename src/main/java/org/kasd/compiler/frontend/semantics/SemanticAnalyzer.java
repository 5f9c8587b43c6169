package org.kasd.compiler.frontend.semantics;

import org.kasd.compiler.PhaseResult;
import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.parser.ast.LiteralNode;
import org.kasd.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.kasd.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.kasd.compiler.frontend.semantics.analysis.LiteralAnalysisHandler;
import org.kasd.compiler.frontend.semantics.analysis.VariableDeclarationAnalysisHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Performs semantic analysis on the AST: duplicate-declaration detection and type checking.
 * It visits the top-level nodes once and dispatches each to the handler registered for its class.
 * Every call to {@code analyze} starts with a fresh {@link SymbolTable}.
 */
public class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private SymbolTable symbolTable = new SymbolTable();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(VariableDeclarationNode.class, new VariableDeclarationAnalysisHandler());
        handlers.put(LiteralNode.class, new LiteralAnalysisHandler());
    }

    /**
     * Analyzes one compilation unit.
     * @param root The declaration to analyze, or {@code null} if nothing was parsed.
     * @return The analyzed node on success, or the diagnostic that was raised.
     */
    public PhaseResult<AstNode> analyze(AstNode root) {
        PhaseResult<List<AstNode>> result = analyze(root == null ? List.of() : List.of(root));
        return result.then(nodes -> PhaseResult.success(root));
    }

    /**
     * Analyzes several top-level nodes in one pass, sharing one symbol table.
     * @param statements The top-level nodes.
     * @return The same nodes on success, or the diagnostic that was raised.
     */
    public PhaseResult<List<AstNode>> analyze(List<AstNode> statements) {
        LOG.debug("Starting semantic analysis");
        symbolTable = new SymbolTable();

        for (AstNode node : statements) {
            if (!analyzeNode(node)) {
                break;
            }
        }
        if (diagnostics.hasErrors()) {
            return PhaseResult.failure(diagnostics.current().orElseThrow());
        }
        return PhaseResult.success(statements);
    }

    /**
     * Returns the symbol table of the most recent pass.
     * @return The symbol table.
     */
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    private boolean analyzeNode(AstNode node) {
        if (node == null) {
            return true;
        }
        IAnalysisHandler handler = handlers.get(node.getClass());
        if (handler == null) {
            LOG.error("Unknown node type in semantic analysis: {}", node.getClass().getName());
            diagnostics.report(Diagnostic.Kind.INTERNAL, node.line(), node.column(),
                    "Unknown node type in semantic analysis: " + node.getClass().getSimpleName());
            return false;
        }
        return handler.analyze(node, symbolTable, diagnostics);
    }
}
