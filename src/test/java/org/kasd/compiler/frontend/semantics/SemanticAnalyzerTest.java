package org.kasd.compiler.frontend.semantics;

import org.kasd.compiler.PhaseResult;
import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.frontend.parser.ast.AstNode;
import org.kasd.compiler.frontend.parser.ast.LiteralNode;
import org.kasd.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.kasd.runtime.value.Value;
import org.kasd.runtime.value.ValueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}.
 * These tests build declaration trees directly and check the verdict of the type and name checks.
 */
public class SemanticAnalyzerTest {

    private static final List<Value> SAMPLE_LITERALS = List.of(
            Value.ofInt(42), Value.ofFloat(3.14), Value.ofBool(true), Value.ofString("s"), Value.NULL);

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics);

    private static VariableDeclarationNode declaration(String name, ValueType type, Value literal) {
        return new VariableDeclarationNode(name, type, new LiteralNode(literal, 1, 14), 1, 5);
    }

    static Stream<Arguments> declaredTypesAndLiterals() {
        return Stream.of(ValueType.values())
                .flatMap(type -> SAMPLE_LITERALS.stream().map(literal -> Arguments.of(type, literal)));
    }

    /**
     * Verifies every combination of declared type and literal: the declaration is accepted exactly
     * when the types match, the literal is {@code null}, or an int initializes a float.
     * @param declared The declared type.
     * @param literal The initializer.
     */
    @ParameterizedTest
    @Tag("unit")
    @MethodSource("declaredTypesAndLiterals")
    void testCompatibilityGrid(ValueType declared, Value literal) {
        // Arrange
        boolean expected = declared == literal.type()
                || literal.type() == ValueType.NULL
                || (declared == ValueType.FLOAT && literal.type() == ValueType.INT);

        // Act
        PhaseResult<AstNode> result = analyzer.analyze(declaration("x", declared, literal));

        // Assert
        assertThat(result.isSuccess()).isEqualTo(expected);
        assertThat(TypeCompatibility.isAssignable(declared, literal.type())).isEqualTo(expected);
        if (!expected) {
            assertThat(result.diagnostic().kind()).isEqualTo(Diagnostic.Kind.TYPE);
            assertThat(result.diagnostic().message()).isEqualTo("Type mismatch: cannot assign "
                    + literal.type().typeName() + " to variable of type " + declared.typeName());
        }
    }

    /**
     * Verifies that a type error is reported at the initializer without a source line.
     */
    @Test
    @Tag("unit")
    void testTypeErrorPosition() {
        PhaseResult<AstNode> result = analyzer.analyze(declaration("b", ValueType.BOOL, Value.ofInt(42)));

        Diagnostic diagnostic = result.diagnostic();
        assertThat(diagnostic.line()).isEqualTo(1);
        assertThat(diagnostic.column()).isEqualTo(14);
        assertThat(diagnostic.hasSourceContext()).isFalse();
        assertThat(diagnostic.toString())
                .isEqualTo("Type Error at line 1, column 14: Type mismatch: cannot assign int to variable of type bool");
    }

    /**
     * Verifies that declaring the same name twice in one pass is a name error.
     */
    @Test
    @Tag("unit")
    void testDuplicateDeclaration() {
        // Arrange
        List<AstNode> statements = List.of(
                declaration("x", ValueType.INT, Value.ofInt(1)),
                declaration("x", ValueType.INT, Value.ofInt(2)));

        // Act
        PhaseResult<List<AstNode>> result = analyzer.analyze(statements);

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostic().kind()).isEqualTo(Diagnostic.Kind.NAME);
        assertThat(result.diagnostic().message()).isEqualTo("Variable already declared");
        assertThat(analyzer.getSymbolTable().symbols()).hasSize(1);
    }

    /**
     * Verifies that every pass starts with an empty symbol table.
     */
    @Test
    @Tag("unit")
    void testSymbolTableIsFreshForEachPass() {
        analyzer.analyze(declaration("x", ValueType.INT, Value.ofInt(1)));
        PhaseResult<AstNode> second = analyzer.analyze(declaration("x", ValueType.INT, Value.ofInt(2)));

        assertThat(second.isSuccess()).isTrue();
        assertThat(analyzer.getSymbolTable().resolve("x")).get()
                .extracting(Symbol::declaredType)
                .isEqualTo(ValueType.INT);
    }

    /**
     * Verifies that an absent tree is accepted.
     */
    @Test
    @Tag("unit")
    void testAbsentTree() {
        PhaseResult<AstNode> result = analyzer.analyze((AstNode) null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isNull();
    }

    /**
     * Verifies that a node kind without a handler is an internal error.
     */
    @Test
    @Tag("unit")
    void testUnknownNodeIsInternalError() {
        AstNode unknown = new AstNode() {
            @Override
            public int line() {
                return 3;
            }

            @Override
            public int column() {
                return 7;
            }
        };

        PhaseResult<AstNode> result = analyzer.analyze(unknown);

        assertThat(result.diagnostic().kind()).isEqualTo(Diagnostic.Kind.INTERNAL);
        assertThat(result.diagnostic().line()).isEqualTo(3);
    }

    /**
     * Verifies that the symbol table refuses to redefine a name.
     */
    @Test
    @Tag("unit")
    void testSymbolTableRejectsRedefinition() {
        SymbolTable table = new SymbolTable();

        assertThat(table.define(new Symbol("x", ValueType.INT, 1, 5))).isTrue();
        assertThat(table.define(new Symbol("x", ValueType.STRING, 2, 5))).isFalse();
        assertThat(table.resolve("x")).get().extracting(Symbol::declaredType).isEqualTo(ValueType.INT);
        assertThat(table.contains("y")).isFalse();
    }
}
