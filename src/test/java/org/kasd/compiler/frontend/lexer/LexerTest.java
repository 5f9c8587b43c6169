package org.kasd.compiler.frontend.lexer;

import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is correctly broken down into tokens and that
 * lexical errors are reported with the right span.
 */
public class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scanAll(String source) {
        Lexer lexer = new Lexer(source, diagnostics);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.scanToken();
            tokens.add(token);
        } while (!token.isEndOfInput());
        return tokens;
    }

    private List<TokenType> typesOf(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    /**
     * Verifies the token sequence and positions of a complete declaration.
     */
    @Test
    @Tag("unit")
    void testDeclarationTokens() {
        // Act
        List<Token> tokens = scanAll("let x: int = 42;");

        // Assert
        assertThat(typesOf(tokens)).containsExactly(
                TokenType.LET, TokenType.IDENTIFIER, TokenType.COLON, TokenType.TYPE_INT,
                TokenType.EQUAL, TokenType.INT, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).text()).isEqualTo("x");
        assertThat(tokens.get(1).column()).isEqualTo(5);
        assertThat(tokens.get(5).value()).isEqualTo(42L);
        assertThat(tokens.get(5).column()).isEqualTo(14);
        assertThat(tokens.get(7).column()).isEqualTo(17);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    /**
     * Verifies that every keyword is recognized and that other words are identifiers.
     */
    @Test
    @Tag("unit")
    void testKeywordsAndIdentifiers() {
        List<Token> tokens = scanAll("let true false null int float bool string letter _tmp x1");

        assertThat(typesOf(tokens)).containsExactly(
                TokenType.LET, TokenType.TRUE, TokenType.FALSE, TokenType.NULL,
                TokenType.TYPE_INT, TokenType.TYPE_FLOAT, TokenType.TYPE_BOOL, TokenType.TYPE_STRING,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a number is a float only when the dot is followed by a digit.
     */
    @Test
    @Tag("unit")
    void testIntegerAndFloatLiterals() {
        List<Token> tokens = scanAll("0 3.14 007");

        assertThat(typesOf(tokens)).containsExactly(
                TokenType.INT, TokenType.FLOAT, TokenType.INT, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).value()).isEqualTo(3.14d);
        assertThat(tokens.get(2).value()).isEqualTo(7L);
    }

    /**
     * Verifies that a trailing dot is not part of a number.
     */
    @Test
    @Tag("unit")
    void testTrailingDotIsUnexpected() {
        List<Token> tokens = scanAll("1.");

        assertThat(typesOf(tokens)).containsExactly(TokenType.INT, TokenType.ERROR);
        assertThat(diagnostics.current()).get()
                .extracting(Diagnostic::message)
                .isEqualTo("Unexpected character: '.'.");
    }

    /**
     * Verifies that a string literal keeps its raw content, including newlines, and advances the line counter.
     */
    @Test
    @Tag("unit")
    void testStringLiteral() {
        List<Token> tokens = scanAll("\"a\nb\" x");

        assertThat(typesOf(tokens)).containsExactly(TokenType.STRING, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo("a\nb");
        assertThat(tokens.get(0).text()).isEqualTo("\"a\nb\"");
        assertThat(tokens.get(1).line()).isEqualTo(2);
        assertThat(tokens.get(1).column()).isEqualTo(4);
    }

    /**
     * Verifies that an unterminated string is reported from its opening quote to the end of its line.
     */
    @Test
    @Tag("unit")
    void testUnterminatedString() {
        // Act
        List<Token> tokens = scanAll("let s: string = \"abc");

        // Assert
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.ERROR);
        Diagnostic diagnostic = diagnostics.current().orElseThrow();
        assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.SYNTAX);
        assertThat(diagnostic.message()).isEqualTo("Unterminated string.");
        assertThat(diagnostic.line()).isEqualTo(1);
        assertThat(diagnostic.column()).isEqualTo(17);
        assertThat(diagnostic.sourceLine()).isEqualTo("let s: string = \"abc");
        assertThat(diagnostic.sourcePos()).isEqualTo(16);
        assertThat(diagnostic.sourceLength()).isEqualTo(4);
    }

    /**
     * Verifies that the span of an unterminated multi-line string is clipped to its first line.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringSpanningLines() {
        scanAll("let s: string = \"ab\ncd");

        Diagnostic diagnostic = diagnostics.current().orElseThrow();
        assertThat(diagnostic.sourceLine()).isEqualTo("let s: string = \"ab");
        assertThat(diagnostic.sourcePos()).isEqualTo(16);
        assertThat(diagnostic.sourceLength()).isEqualTo(3);
    }

    /**
     * Verifies the report for a character outside the language.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        List<Token> tokens = scanAll("let @");

        assertThat(typesOf(tokens)).containsExactly(TokenType.LET, TokenType.ERROR);
        Diagnostic diagnostic = diagnostics.current().orElseThrow();
        assertThat(diagnostic.message()).isEqualTo("Unexpected character: '@'.");
        assertThat(diagnostic.column()).isEqualTo(5);
        assertThat(diagnostic.sourcePos()).isEqualTo(4);
        assertThat(diagnostic.sourceLength()).isEqualTo(1);
    }

    /**
     * Verifies that only the first lexical error is kept when scanning continues past it.
     */
    @Test
    @Tag("unit")
    void testFirstLexicalErrorWins() {
        Lexer lexer = new Lexer("@ #", diagnostics);

        lexer.scanToken();
        lexer.scanToken();

        assertThat(diagnostics.current()).get()
                .extracting(Diagnostic::message)
                .isEqualTo("Unexpected character: '@'.");
    }

    /**
     * Verifies that integer literals beyond the 64-bit range are rejected.
     */
    @Test
    @Tag("unit")
    void testIntegerOverflow() {
        List<Token> tokens = scanAll("99999999999999999999");

        assertThat(typesOf(tokens)).containsExactly(TokenType.ERROR);
        assertThat(diagnostics.current()).get()
                .extracting(Diagnostic::message)
                .isEqualTo("Integer literal out of range.");
    }

    /**
     * Verifies that the lexer keeps answering END_OF_FILE once the input is exhausted.
     */
    @Test
    @Tag("unit")
    void testEndOfFileIsRepeated() {
        Lexer lexer = new Lexer("  \n\t", diagnostics);

        Token first = lexer.scanToken();
        Token second = lexer.scanToken();

        assertThat(first.type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(second.type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(first.line()).isEqualTo(2);
    }

    /**
     * Verifies line and column tracking across lines, and the line lookup used for diagnostics.
     */
    @Test
    @Tag("unit")
    void testPositionsAcrossLines() {
        String source = "let y: float =\r\n    3.14;";
        Lexer lexer = new Lexer(source, diagnostics);
        List<Token> tokens = scanAll(source);

        Token number = tokens.get(5);
        assertThat(number.type()).isEqualTo(TokenType.FLOAT);
        assertThat(number.line()).isEqualTo(2);
        assertThat(number.column()).isEqualTo(5);
        assertThat(lexer.lineContaining(number.offset())).isEqualTo("    3.14;");
        assertThat(lexer.lineContaining(0)).isEqualTo("let y: float =");
        assertThat(lexer.lineStart(number.offset())).isEqualTo(16);
    }

    /**
     * Verifies that the canonical text of non-string values lexes back to a literal of the same value.
     */
    @Test
    @Tag("unit")
    void testCanonicalTextRelexes() {
        List<Token> tokens = scanAll("123 1.5 true null");

        assertThat(typesOf(tokens)).containsExactly(
                TokenType.INT, TokenType.FLOAT, TokenType.TRUE, TokenType.NULL, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo(123L);
        assertThat(tokens.get(1).value()).isEqualTo(1.5d);
    }

    /**
     * Verifies the character classification table.
     */
    @Test
    @Tag("unit")
    void testCharClass() {
        assertThat(CharClass.of('a')).isEqualTo(CharClass.ALPHA);
        assertThat(CharClass.of('_')).isEqualTo(CharClass.ALPHA);
        assertThat(CharClass.of('7')).isEqualTo(CharClass.DIGIT);
        assertThat(CharClass.of('"')).isEqualTo(CharClass.QUOTE);
        assertThat(CharClass.of('\n')).isEqualTo(CharClass.NEWLINE);
        assertThat(CharClass.of('\t')).isEqualTo(CharClass.WHITESPACE);
        assertThat(CharClass.of('é')).isNotIn(CharClass.ALPHA, CharClass.DIGIT);
    }
}
