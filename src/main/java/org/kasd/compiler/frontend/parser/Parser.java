package org.kasd.compiler.frontend.parser;

import org.kasd.compiler.PhaseResult;
import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.lexer.Lexer;
import org.kasd.compiler.frontend.lexer.Token;
import org.kasd.compiler.frontend.lexer.TokenType;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.parser.ast.LiteralNode;
import org.kasd.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.kasd.runtime.value.Value;
import org.kasd.runtime.value.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The recursive-descent parser. It pulls tokens from the {@link Lexer} one at a time,
 * keeping one token of lookahead ({@code current}) and the last consumed token ({@code previous}),
 * and produces the AST of exactly one declaration:
 * <pre>
 * program     := declaration EOF
 * declaration := varDecl
 * varDecl     := 'let' IDENT ':' type '=' literal ';'
 * type        := 'int' | 'float' | 'bool' | 'string' | 'null'
 * literal     := INT | FLOAT | STRING | 'true' | 'false' | 'null'
 * </pre>
 * Parsing does not recover: the first error aborts the parse.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Map<TokenType, ValueType> TYPE_NAMES = Map.of(
            TokenType.TYPE_INT, ValueType.INT,
            TokenType.TYPE_FLOAT, ValueType.FLOAT,
            TokenType.TYPE_BOOL, ValueType.BOOL,
            TokenType.TYPE_STRING, ValueType.STRING,
            TokenType.NULL, ValueType.NULL
    );

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private Token current;
    private Token previous;

    /**
     * Constructs a new Parser and primes it with the first token.
     * @param lexer The token source.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        advance();
    }

    /**
     * Parses the whole compilation unit.
     * @return The declaration node on success, or the diagnostic that stopped the parse.
     */
    public PhaseResult<AstNode> parse() {
        LOG.debug("Starting parsing");
        AstNode node = declaration();

        if (node != null && !current.isEndOfInput()) {
            error(current, "Expected end of file.");
            node = null;
        }
        if (node == null || diagnostics.hasErrors()) {
            return PhaseResult.failure(diagnostics.current()
                    .orElseGet(() -> Diagnostic.withoutSource(Diagnostic.Kind.INTERNAL, current.line(), current.column(),
                            "Parser stopped without a diagnostic.")));
        }
        return PhaseResult.success(node);
    }

    private AstNode declaration() {
        LOG.debug("Parsing declaration");
        return variableDeclaration();
    }

    private AstNode variableDeclaration() {
        if (!consume(TokenType.LET, "Expected 'let' keyword.")) return null;
        if (!consume(TokenType.IDENTIFIER, "Expected variable name.")) return null;
        Token name = previous;
        if (!consume(TokenType.COLON, "Expected ':' after variable name.")) return null;

        ValueType declaredType = TYPE_NAMES.get(current.type());
        if (declaredType == null) {
            error(current, "Expected type (int, float, bool, string, or null).");
            return null;
        }
        advance();

        if (!consume(TokenType.EQUAL, "Expected '=' after type.")) return null;

        AstNode initializer = expression();
        if (initializer == null) return null;

        if (!consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.")) return null;

        return new VariableDeclarationNode(name.text(), declaredType, initializer, name.line(), name.column());
    }

    private AstNode expression() {
        return literal();
    }

    private AstNode literal() {
        Token token = current;
        Value value;
        switch (token.type()) {
            case INT -> value = Value.ofInt((Long) token.value());
            case FLOAT -> value = Value.ofFloat((Double) token.value());
            case STRING -> value = Value.ofString((String) token.value());
            case TRUE -> value = Value.ofBool(true);
            case FALSE -> value = Value.ofBool(false);
            case NULL -> value = Value.NULL;
            default -> {
                error(token, "Expected literal value.");
                return null;
            }
        }
        advance();
        return new LiteralNode(value, token.line(), token.column());
    }

    private void advance() {
        previous = current;
        current = lexer.scanToken();
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private boolean consume(TokenType type, String message) {
        if (check(type)) {
            advance();
            return true;
        }
        error(current, message);
        return false;
    }

    private void error(Token token, String message) {
        String sourceLine = lexer.lineContaining(token.offset());
        int pos = token.offset() - lexer.lineStart(token.offset());
        int length = Math.max(0, Math.min(token.text().length(), sourceLine.length() - pos));
        diagnostics.report(Diagnostic.Kind.SYNTAX, token.line(), token.column(), message, sourceLine, pos, length);
    }
}
