package org.kasd.api;

import org.kasd.compiler.ExecutionResult;
import org.kasd.compiler.Pipeline;
import org.kasd.compiler.RunConfiguration;
import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.diagnostics.LogLevel;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Execution context for hosts embedding the interpreter. A context runs source texts through
 * the {@link Pipeline} and remembers the outcome of the last run.
 * <pre>
 * try (KasdContext ctx = KasdContext.create(1)) {
 *     if (!ctx.execute("let x: int = 42;")) {
 *         System.err.println(ctx.lastError().orElse(""));
 *     }
 * }
 * </pre>
 * Each execution is an independent compilation unit; bindings are not carried over.
 * A context is not thread-safe.
 * <p>
 * The context does not configure logging. The log level only decides what the interpreter
 * hands to SLF4J: at level 4 the analyzed tree is logged at debug level on the
 * {@code org.kasd.compiler.Pipeline} logger. Whether that output appears is up to the host's
 * logging configuration; the bundled {@code logback.xml} keeps {@code org.kasd} at ERROR.
 */
public final class KasdContext implements AutoCloseable {

    private final LogLevel logLevel;
    private final PrintStream out;
    private final Pipeline pipeline = new Pipeline();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private ExecutionResult lastResult;
    private boolean closed;

    private KasdContext(LogLevel logLevel, PrintStream out) {
        this.logLevel = logLevel;
        this.out = out;
    }

    /**
     * Creates a context that echoes interactive bindings to {@code System.out}.
     * @param logLevel The log level, 0 (none) to 4 (debug). Level 4 only produces debug
     *                 output if the host enables debug logging for {@code org.kasd}.
     * @return The new context.
     * @throws KasdException if the log level is out of range.
     */
    public static KasdContext create(int logLevel) {
        return create(logLevel, System.out);
    }

    /**
     * Creates a context with an explicit output stream for interactive echoes.
     * @param logLevel The log level, 0 (none) to 4 (debug); see {@link #create(int)}.
     * @param out The stream receiving echoed bindings.
     * @return The new context.
     * @throws KasdException if the log level is out of range.
     */
    public static KasdContext create(int logLevel, PrintStream out) {
        try {
            return new KasdContext(LogLevel.fromNumber(logLevel), out);
        } catch (IllegalArgumentException e) {
            throw new KasdException(e.getMessage(), e);
        }
    }

    /**
     * Executes a source text.
     * @param source The source text.
     * @return {@code true} on success; on failure the message is available from {@link #lastError()}.
     */
    public boolean execute(String source) {
        return run(source, false);
    }

    /**
     * Executes a source text in interactive mode, echoing each binding.
     * @param source The source text.
     * @return {@code true} on success.
     */
    public boolean executeInteractive(String source) {
        return run(source, true);
    }

    /**
     * Returns the message of the last run's diagnostic.
     * @return The message, or empty if the last run succeeded or nothing ran yet.
     */
    public Optional<String> lastError() {
        ensureOpen();
        return diagnostics.current().map(Diagnostic::toString);
    }

    /**
     * Returns the value of the last successfully executed statement.
     * @return The value, or the null value if the last run failed or nothing ran yet.
     */
    public KasdValue lastValue() {
        ensureOpen();
        return lastResult == null ? KasdValue.ofNull() : KasdValue.fromValue(lastResult.value());
    }

    /**
     * Returns the bindings produced by the last run.
     * @return The variable names and their values, in declaration order.
     */
    public Map<String, KasdValue> lastBindings() {
        ensureOpen();
        if (lastResult == null) {
            return Map.of();
        }
        return lastResult.bindings().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> KasdValue.fromValue(e.getValue()),
                        (a, b) -> b, LinkedHashMap::new));
    }

    /**
     * Releases the context. Further calls fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        closed = true;
        lastResult = null;
        diagnostics.clear();
    }

    private boolean run(String source, boolean interactive) {
        ensureOpen();
        if (source == null) {
            throw new KasdException("Source text must not be null.");
        }
        diagnostics.clear();
        lastResult = pipeline.run(source, new RunConfiguration(logLevel, interactive, out), diagnostics);
        return lastResult.isSuccess();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("KasdContext has been closed.");
        }
    }
}
