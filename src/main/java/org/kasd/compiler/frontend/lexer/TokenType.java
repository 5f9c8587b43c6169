package org.kasd.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The ':' character, separating a variable name from its type. */
    COLON,
    /** The '=' character, introducing the initializer. */
    EQUAL,
    /** The ';' character, terminating a declaration. */
    SEMICOLON,

    // Literals.
    /** An identifier, such as a variable name. */
    IDENTIFIER,
    /** An integer literal. */
    INT,
    /** A floating point literal. */
    FLOAT,
    /** A string literal. */
    STRING,

    // Keywords.
    /** The {@code let} keyword. */
    LET,
    /** The {@code true} literal. */
    TRUE,
    /** The {@code false} literal. */
    FALSE,
    /** The {@code null} literal, also accepted as a type name. */
    NULL,
    /** The {@code int} type name. */
    TYPE_INT,
    /** The {@code float} type name. */
    TYPE_FLOAT,
    /** The {@code bool} type name. */
    TYPE_BOOL,
    /** The {@code string} type name. */
    TYPE_STRING,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE,
    /** A lexical error. The diagnostic has already been reported; parsers treat it like end of input. */
    ERROR
}
