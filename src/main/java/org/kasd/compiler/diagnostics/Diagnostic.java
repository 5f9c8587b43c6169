package org.kasd.compiler.diagnostics;

/**
 * Represents the single diagnostic recorded for a compilation unit.
 *
 * @param kind The category of the problem.
 * @param line The line number of the problem (1-based).
 * @param column The column number of the problem (1-based).
 * @param message The diagnostic message.
 * @param sourceLine The source line the problem occurred on, or {@code null} if no caret context is attached.
 * @param sourcePos The 0-based offset of the offending span within {@code sourceLine}.
 * @param sourceLength The length of the offending span.
 */
public record Diagnostic(
        Kind kind,
        int line,
        int column,
        String message,
        String sourceLine,
        int sourcePos,
        int sourceLength
) {
    /**
     * The category of a diagnostic.
     */
    public enum Kind {
        /** A lexical or grammatical violation. */
        SYNTAX("Syntax Error"),
        /** A mismatch between a declared type and its initializer. */
        TYPE("Type Error"),
        /** A duplicate declaration. */
        NAME("Name Error"),
        /** Reserved for errors during evaluation. */
        RUNTIME("Runtime Error"),
        /** A defect in the interpreter itself, e.g. an unknown node kind. */
        INTERNAL("Internal Error");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        /**
         * Returns the human readable name used when rendering.
         * @return The display name, e.g. "Syntax Error".
         */
        public String displayName() {
            return displayName;
        }
    }

    /**
     * Creates a diagnostic without source context.
     * @param kind The category.
     * @param line The line number.
     * @param column The column number.
     * @param message The message.
     * @return The diagnostic.
     */
    public static Diagnostic withoutSource(Kind kind, int line, int column, String message) {
        return new Diagnostic(kind, line, column, message, null, -1, 0);
    }

    /**
     * Checks whether a source line is attached for caret rendering.
     * @return {@code true} if a caret block can be rendered.
     */
    public boolean hasSourceContext() {
        return sourceLine != null && sourcePos >= 0;
    }

    @Override
    public String toString() {
        return String.format("%s at line %d, column %d: %s", kind.displayName(), line, column, message);
    }
}
