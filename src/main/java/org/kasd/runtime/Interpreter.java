package org.kasd.runtime;

import org.kasd.compiler.PhaseResult;
import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.parser.ast.LiteralNode;
import org.kasd.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.kasd.runtime.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Tree-walking evaluator. Each declaration binds its value in the interpreter's
 * {@link Environment}; in interactive mode the binding is also echoed as
 * {@code name: type = value}.
 * <p>
 * The interpreter trusts the semantic analysis: a variable initialized with {@code null}
 * keeps the null value whatever its declared type. It is not thread-safe.
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final Environment environment = new Environment();
    private final boolean interactive;
    private final PrintStream out;
    private final DiagnosticsEngine diagnostics;

    /**
     * Creates an interpreter.
     * @param interactive Whether bindings are echoed to {@code out}.
     * @param out The primary output.
     * @param diagnostics The engine for reporting errors.
     */
    public Interpreter(boolean interactive, PrintStream out, DiagnosticsEngine diagnostics) {
        this.interactive = interactive;
        this.out = out;
        this.diagnostics = diagnostics;
    }

    /**
     * Executes an analyzed AST.
     * @param node The root node, or {@code null} if nothing was parsed.
     * @return The value of the statement; the null value for an absent tree.
     */
    public PhaseResult<Value> interpret(AstNode node) {
        LOG.debug("Starting interpretation");
        if (node == null) {
            return PhaseResult.success(Value.NULL);
        }
        Value result = evaluate(node);
        if (diagnostics.hasErrors()) {
            return PhaseResult.failure(diagnostics.current().orElseThrow());
        }
        return PhaseResult.success(result);
    }

    /**
     * @return The environment holding this interpreter's bindings.
     */
    public Environment getEnvironment() {
        return environment;
    }

    private Value evaluate(AstNode node) {
        if (node instanceof VariableDeclarationNode decl) {
            return evaluateVariableDeclaration(decl);
        }
        if (node instanceof LiteralNode literal) {
            return literal.value();
        }
        LOG.error("Unknown node type in interpreter: {}", node.getClass().getName());
        diagnostics.report(Diagnostic.Kind.INTERNAL, node.line(), node.column(),
                "Unknown node type in interpreter: " + node.getClass().getSimpleName());
        return Value.NULL;
    }

    private Value evaluateVariableDeclaration(VariableDeclarationNode decl) {
        LOG.debug("Evaluating variable declaration: {}", decl.name());
        Value value = evaluate(decl.initializer());
        environment.define(decl.name(), value);
        LOG.debug("Defined variable: {}", decl.name());

        if (interactive) {
            out.println(decl.name() + ": " + decl.declaredType().typeName() + " = " + value.render());
        }
        return value;
    }
}
