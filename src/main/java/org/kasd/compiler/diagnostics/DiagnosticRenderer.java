package org.kasd.compiler.diagnostics;

/**
 * Formats a {@link Diagnostic} for the diagnostic output: a header line with the kind,
 * location and message, followed by the source line and a caret underline when the
 * diagnostic carries source context.
 */
public class DiagnosticRenderer {

    private final boolean color;

    /**
     * @param color Whether to wrap the header and carets in ANSI colour codes.
     */
    public DiagnosticRenderer(boolean color) {
        this.color = color;
    }

    /**
     * Renders a diagnostic. The result always ends with a line separator.
     * @param diagnostic The diagnostic to render.
     * @return The rendered text.
     */
    public String render(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(colored(diagnostic.toString())).append('\n');

        if (diagnostic.sourceLine() != null) {
            sb.append(diagnostic.sourceLine()).append('\n');
            if (diagnostic.sourcePos() >= 0) {
                sb.append(" ".repeat(diagnostic.sourcePos()));
                sb.append(colored("^".repeat(Math.max(1, diagnostic.sourceLength()))));
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private String colored(String text) {
        return color ? AnsiColor.RED.wrap(text) : text;
    }
}
