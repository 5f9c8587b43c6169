package org.kasd.compiler;

import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.diagnostics.LogLevel;
import org.kasd.compiler.frontend.lexer.Lexer;
import org.kasd.compiler.frontend.parser.Parser;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.parser.ast.AstPrinter;
import org.kasd.compiler.frontend.semantics.SemanticAnalyzer;
import org.kasd.runtime.Interpreter;
import org.kasd.runtime.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one compilation unit through lexing and parsing, semantic analysis and
 * interpretation. Each stage runs only if the previous one finished without a diagnostic.
 * <p>
 * Every run gets a fresh interpreter, so bindings do not survive from one run to the next.
 * This class holds no state and is safe to share; the {@link DiagnosticsEngine} passed to
 * {@link #run(String, RunConfiguration, DiagnosticsEngine)} must not be.
 */
public class Pipeline {

    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    /**
     * Runs a compilation unit with its own diagnostics engine.
     * @param source The source text.
     * @param config The run settings.
     * @return The outcome.
     */
    public ExecutionResult run(String source, RunConfiguration config) {
        return run(source, config, new DiagnosticsEngine());
    }

    /**
     * Runs a compilation unit, recording problems in the given engine. A diagnostic that is
     * already pending in the engine makes the run fail; callers clear it between units.
     *
     * @param source The source text.
     * @param config The run settings.
     * @param diagnostics The engine receiving the diagnostic, left uncleared for the caller.
     * @return The outcome.
     */
    public ExecutionResult run(String source, RunConfiguration config, DiagnosticsEngine diagnostics) {
        // Phase 1+2: Lexing and parsing (tokens are pulled on demand)
        Lexer lexer = new Lexer(source, diagnostics);
        Parser parser = new Parser(lexer, diagnostics);
        PhaseResult<AstNode> parsed = parser.parse();
        if (!parsed.isSuccess()) {
            LOG.debug("Parsing failed: {}", parsed.diagnostic());
            return ExecutionResult.failure(parsed.diagnostic());
        }

        // Phase 3: Semantic analysis
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics);
        PhaseResult<AstNode> analyzed = analyzer.analyze(parsed.value());
        if (!analyzed.isSuccess()) {
            LOG.debug("Semantic analysis failed: {}", analyzed.diagnostic());
            return ExecutionResult.failure(analyzed.diagnostic());
        }

        if (config.logLevel().includes(LogLevel.DEBUG)) {
            LOG.debug("AST:\n{}", AstPrinter.print(analyzed.value()));
        }

        // Phase 4: Interpretation
        Interpreter interpreter = new Interpreter(config.interactive(), config.out(), diagnostics);
        PhaseResult<Value> executed = interpreter.interpret(analyzed.value());
        if (!executed.isSuccess()) {
            return ExecutionResult.failure(executed.diagnostic());
        }
        return ExecutionResult.success(executed.value(), interpreter.getEnvironment().snapshot());
    }
}
