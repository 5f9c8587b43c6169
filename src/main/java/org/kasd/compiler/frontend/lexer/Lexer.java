package org.kasd.compiler.frontend.lexer;

import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into tokens. Tokens are produced on demand
 * through {@link #scanToken()}; the lexer never builds a token list itself.
 * <p>
 * Lexical errors are reported to the {@link DiagnosticsEngine} and answered with an
 * {@link TokenType#ERROR} token, which parsers treat like the end of input.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the next token. Once the end of the source is reached, every further call
     * returns an END_OF_FILE token.
     * @return The next token.
     */
    public Token scanToken() {
        Token token = nextToken();
        if (LOG.isDebugEnabled()) {
            LOG.debug(token.describe());
        }
        return token;
    }

    private Token nextToken() {
        skipWhitespace();
        start = current;
        startLine = line;
        startColumn = column;

        if (isAtEnd()) {
            return makeToken(TokenType.END_OF_FILE);
        }

        char c = advance();
        switch (CharClass.of(c)) {
            case ALPHA:
                return identifier();
            case DIGIT:
                return number();
            case QUOTE:
                return string();
            default:
                break;
        }

        switch (c) {
            case ':': return makeToken(TokenType.COLON);
            case '=': return makeToken(TokenType.EQUAL);
            case ';': return makeToken(TokenType.SEMICOLON);
            default: return errorToken("Unexpected character: '" + c + "'.");
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            switch (CharClass.of(peek())) {
                case WHITESPACE:
                    advance();
                    break;
                case NEWLINE:
                    advance();
                    newLine();
                    break;
                default:
                    return;
            }
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        return makeToken(Keywords.lookup(source.substring(start, current)));
    }

    private Token number() {
        TokenType type = TokenType.INT;
        while (CharClass.of(peek()) == CharClass.DIGIT) advance();

        if (peek() == '.' && CharClass.of(peekNext()) == CharClass.DIGIT) {
            type = TokenType.FLOAT;
            advance(); // consume the '.'
            while (CharClass.of(peek()) == CharClass.DIGIT) advance();
        }

        String numberString = source.substring(start, current);
        if (type == TokenType.FLOAT) {
            return makeToken(type, Double.parseDouble(numberString));
        }
        try {
            return makeToken(type, Long.parseLong(numberString, 10));
        } catch (NumberFormatException e) {
            return errorToken("Integer literal out of range.");
        }
    }

    private Token string() {
        int contentStart = current;
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                newLine();
            }
        }

        if (isAtEnd()) {
            return errorToken("Unterminated string.");
        }

        String value = source.substring(contentStart, current);
        // The closing "
        advance();
        return makeToken(TokenType.STRING, value);
    }

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Object value) {
        return new Token(type, source.substring(start, current), value, startLine, startColumn, start);
    }

    private Token errorToken(String message) {
        int lineStart = lineStart(start);
        int lineEnd = lineEnd(start);
        int length = Math.max(0, Math.min(current, lineEnd) - start);
        diagnostics.report(Diagnostic.Kind.SYNTAX, startLine, startColumn, message,
                source.substring(lineStart, lineEnd), start - lineStart, length);
        return new Token(TokenType.ERROR, source.substring(start, current), message, startLine, startColumn, start);
    }

    /**
     * Returns the text of the source line containing the given offset, without its line terminator.
     * @param offset A 0-based offset into the source.
     * @return The line text.
     */
    public String lineContaining(int offset) {
        return source.substring(lineStart(offset), lineEnd(offset));
    }

    /**
     * Returns the offset of the first character of the line containing the given offset.
     * @param offset A 0-based offset into the source.
     * @return The offset at which that line starts.
     */
    public int lineStart(int offset) {
        int bounded = Math.min(offset, source.length());
        int newline = bounded == 0 ? -1 : source.lastIndexOf('\n', bounded - 1);
        return newline + 1;
    }

    private int lineEnd(int offset) {
        int newline = source.indexOf('\n', Math.min(offset, source.length()));
        int end = newline < 0 ? source.length() : newline;
        if (end > lineStart(offset) && source.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isAlphaNumeric(char c) {
        CharClass charClass = CharClass.of(c);
        return charClass == CharClass.ALPHA || charClass == CharClass.DIGIT;
    }
}
