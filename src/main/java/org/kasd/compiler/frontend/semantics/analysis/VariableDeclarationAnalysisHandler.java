package org.kasd.compiler.frontend.semantics.analysis;

import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.parser.ast.LiteralNode;
import org.kasd.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.kasd.compiler.frontend.semantics.Symbol;
import org.kasd.compiler.frontend.semantics.SymbolTable;
import org.kasd.compiler.frontend.semantics.TypeCompatibility;
import org.kasd.runtime.value.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the semantic analysis of {@link VariableDeclarationNode}s:
 * rejects redeclarations, defines the variable and checks the initializer's type.
 */
public class VariableDeclarationAnalysisHandler implements IAnalysisHandler {

    private static final Logger LOG = LoggerFactory.getLogger(VariableDeclarationAnalysisHandler.class);

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!(node instanceof VariableDeclarationNode decl)) {
            return true;
        }
        LOG.debug("Analyzing variable declaration: {}", decl.name());

        if (!symbolTable.define(new Symbol(decl.name(), decl.declaredType(), decl.line(), decl.column()))) {
            diagnostics.report(Diagnostic.Kind.NAME, decl.line(), decl.column(), "Variable already declared");
            return false;
        }
        LOG.debug("Added symbol: {} (type: {})", decl.name(), decl.declaredType());

        AstNode initializer = decl.initializer();
        ValueType initType = typeOf(initializer);
        if (!TypeCompatibility.isAssignable(decl.declaredType(), initType)) {
            diagnostics.report(Diagnostic.Kind.TYPE, initializer.line(), initializer.column(),
                    "Type mismatch: cannot assign " + initType + " to variable of type " + decl.declaredType());
            return false;
        }
        return true;
    }

    private static ValueType typeOf(AstNode node) {
        if (node instanceof LiteralNode literal) {
            return literal.value().type();
        }
        if (node instanceof VariableDeclarationNode decl) {
            return decl.declaredType();
        }
        return ValueType.NULL;
    }
}
