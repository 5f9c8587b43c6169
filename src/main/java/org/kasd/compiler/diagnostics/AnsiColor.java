package org.kasd.compiler.diagnostics;

/**
 * The ANSI foreground colours used on the terminal, for rendered diagnostics and log levels.
 */
public enum AnsiColor {
    RED(31),
    GREEN(32),
    YELLOW(33),
    BLUE(34),
    GRAY(90);

    private static final String RESET = "\u001B[0m";

    private final String start;

    AnsiColor(int code) {
        this.start = "\u001B[" + code + "m";
    }

    /**
     * Wraps text in this colour, resetting the terminal afterwards.
     * @param text The text to colour.
     * @return The coloured text.
     */
    public String wrap(String text) {
        return start + text + RESET;
    }
}
