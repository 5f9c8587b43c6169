package org.kasd.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code (the lexeme).
 * @param value The processed value of the token: a {@link Long} for INT, a {@link Double} for FLOAT,
 *              the unquoted content for STRING, {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param offset The 0-based offset of the lexeme in the source text.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        int offset
) {
    /**
     * Checks whether this token ends the token stream, either regularly or because of a lexical error.
     * @return {@code true} for END_OF_FILE and ERROR tokens.
     */
    public boolean isEndOfInput() {
        return type == TokenType.END_OF_FILE || type == TokenType.ERROR;
    }

    /**
     * Describes the token for debug output.
     * @return A one-line description of type, position and lexeme.
     */
    public String describe() {
        return String.format("Token: %s, Line: %d, Column: %d, Lexeme: '%s'", type, line, column, text);
    }
}
