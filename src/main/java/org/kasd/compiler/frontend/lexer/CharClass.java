package org.kasd.compiler.frontend.lexer;

/**
 * Character classes used by the {@link Lexer} for dispatch. The ASCII classification
 * table is computed once when the class is initialized; every other character is {@link #SPECIAL}.
 */
public enum CharClass {
    /** Blanks other than the newline. */
    WHITESPACE,
    /** Letters and the underscore. */
    ALPHA,
    /** Decimal digits. */
    DIGIT,
    /** Punctuation and anything not covered by another class. */
    SPECIAL,
    /** The double quote. */
    QUOTE,
    /** The line feed. */
    NEWLINE,
    /** The NUL sentinel returned when peeking past the end of the source. */
    END_OF_INPUT;

    private static final CharClass[] TABLE = new CharClass[128];

    static {
        for (int c = 0; c < TABLE.length; c++) {
            TABLE[c] = SPECIAL;
            if (c == ' ' || c == '\t' || c == '\r' || c == 0x0B || c == '\f') TABLE[c] = WHITESPACE;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') TABLE[c] = ALPHA;
            if (c >= '0' && c <= '9') TABLE[c] = DIGIT;
            if (c == '"') TABLE[c] = QUOTE;
            if (c == '\n') TABLE[c] = NEWLINE;
            if (c == '\0') TABLE[c] = END_OF_INPUT;
        }
    }

    /**
     * Classifies a character.
     * @param c The character.
     * @return Its class.
     */
    public static CharClass of(char c) {
        return c < TABLE.length ? TABLE[c] : SPECIAL;
    }
}
