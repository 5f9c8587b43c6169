package org.kasd.compiler.frontend.lexer;

import java.util.Map;

/**
 * The fixed keyword table of the language.
 */
final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "let", TokenType.LET,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "null", TokenType.NULL,
            "int", TokenType.TYPE_INT,
            "float", TokenType.TYPE_FLOAT,
            "bool", TokenType.TYPE_BOOL,
            "string", TokenType.TYPE_STRING
    );

    private Keywords() {}

    /**
     * Looks up an identifier lexeme.
     * @param text The lexeme.
     * @return The keyword's token type, or {@link TokenType#IDENTIFIER} if it is not a keyword.
     */
    static TokenType lookup(String text) {
        return KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
    }
}
