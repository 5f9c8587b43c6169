package org.kasd.compiler.diagnostics;

import java.io.PrintStream;
import java.util.Optional;

/**
 * Holds the diagnostic of one compilation unit. Only the first reported problem is kept:
 * further reports are dropped until {@link #clear()} is called.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, parser, etc.).
 * Instances are not thread-safe; each compilation unit uses its own engine.
 */
public class DiagnosticsEngine {

    private final DiagnosticRenderer renderer;
    private Diagnostic current;

    /**
     * Creates an engine that renders without colour.
     */
    public DiagnosticsEngine() {
        this(new DiagnosticRenderer(false));
    }

    /**
     * Creates an engine with an explicit renderer.
     * @param renderer The renderer used by {@link #render()} and {@link #print(PrintStream)}.
     */
    public DiagnosticsEngine(DiagnosticRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Reports an error with a source line for caret rendering.
     *
     * @param kind         The category of the error.
     * @param line         The line number of the error.
     * @param column       The column number of the error.
     * @param message      The error message.
     * @param sourceLine   The text of the offending line, may be {@code null}.
     * @param sourcePos    The offset of the offending span within {@code sourceLine}.
     * @param sourceLength The length of the offending span.
     * @return {@code true} if the error was recorded, {@code false} if another one was already pending.
     */
    public boolean report(Diagnostic.Kind kind, int line, int column, String message,
                          String sourceLine, int sourcePos, int sourceLength) {
        return report(new Diagnostic(kind, line, column, message, sourceLine, sourcePos, sourceLength));
    }

    /**
     * Reports an error without source context.
     *
     * @param kind    The category of the error.
     * @param line    The line number of the error.
     * @param column  The column number of the error.
     * @param message The error message.
     * @return {@code true} if the error was recorded.
     */
    public boolean report(Diagnostic.Kind kind, int line, int column, String message) {
        return report(Diagnostic.withoutSource(kind, line, column, message));
    }

    /**
     * Records the given diagnostic unless one is already pending.
     * @param diagnostic The diagnostic to record.
     * @return {@code true} if it was recorded.
     */
    public boolean report(Diagnostic diagnostic) {
        if (current != null) {
            return false;
        }
        current = diagnostic;
        return true;
    }

    /**
     * Checks if an error is pending.
     *
     * @return {@code true} if a diagnostic has been recorded and not cleared.
     */
    public boolean hasErrors() {
        return current != null;
    }

    /**
     * Returns the pending diagnostic.
     * @return The diagnostic, or empty if none is pending.
     */
    public Optional<Diagnostic> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Renders the pending diagnostic.
     * @return The rendered text, or an empty string if nothing is pending.
     */
    public String render() {
        return current == null ? "" : renderer.render(current);
    }

    /**
     * Writes the pending diagnostic to the given stream. Does nothing if none is pending.
     * @param err The diagnostic output stream.
     */
    public void print(PrintStream err) {
        if (current != null) {
            err.print(renderer.render(current));
            err.flush();
        }
    }

    /**
     * Discards the pending diagnostic.
     */
    public void clear() {
        current = null;
    }
}
