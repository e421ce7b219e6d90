package org.shellsafe.compiler.frontend.lexer;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is converted into the expected token stream, including
 * literal decoding, comments and the error reporting for malformed input.
 */
public class LexerTest {

    private static List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics, "test.rs").scanTokens();
    }

    /**
     * Verifies a small function header: keywords, identifiers, punctuation and the end marker,
     * with line and column of each token.
     */
    @Test
    @Tag("unit")
    void testFunctionHeaderTokenization() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("fn add(a: u32) -> u32 {\n    a\n}", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.FN, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.COLON,
                TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.LEFT_BRACE,
                TokenType.IDENTIFIER, TokenType.RIGHT_BRACE, TokenType.END_OF_FILE);
        assertThat(tokens.get(1)).extracting(Token::text, Token::line, Token::column).containsExactly("add", 1, 4);
        assertThat(tokens.get(10)).extracting(Token::text, Token::line, Token::column).containsExactly("a", 2, 5);
        assertThat(tokens.get(10).fileName()).isEqualTo("test.rs");
    }

    /**
     * Verifies that multi-character operators are matched greedily.
     */
    @Test
    @Tag("unit")
    void testCompoundOperators() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("== != <= >= && || += -= << >> ..= .. => ::", diagnostics);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.AND_AND, TokenType.OR_OR, TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.SHL,
                TokenType.SHR, TokenType.DOT_DOT_EQ, TokenType.DOT_DOT, TokenType.FAT_ARROW, TokenType.DOUBLE_COLON,
                TokenType.END_OF_FILE);
    }

    /**
     * Verifies integer decoding: radix prefixes, digit separators and type suffixes.
     */
    @Test
    @Tag("unit")
    void testIntegerLiterals() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("42 0x1F 0o17 0b101 1_000 7u8 9i64", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.subList(0, 7)).extracting(Token::value)
                .containsExactly(42L, 31L, 15L, 5L, 1000L, 7L, 9L);
    }

    /**
     * Verifies that an integer literal beyond 64 bits is rejected.
     */
    @Test
    @Tag("unit")
    void testIntegerOverflowIsReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("99999999999999999999", diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.INVALID_NUMBER);
    }

    /**
     * Verifies that floating-point literals are refused as an unsupported construct.
     */
    @Test
    @Tag("unit")
    void testFloatIsUnsupported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("let x = 1.5;", diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNSUPPORTED_CONSTRUCT);
    }

    /**
     * Verifies the escape sequences of normal string literals and the line continuation.
     */
    @Test
    @Tag("unit")
    void testStringEscapes() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("\"a\\tb\\n\\\\\\\"q\\\" x\\\n      y\"", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).value()).isEqualTo("a\tb\n\\\"q\" xy");
    }

    /**
     * Verifies that shell metacharacters pass through a string literal unchanged.
     */
    @Test
    @Tag("unit")
    void testShellMetacharactersStayLiteral() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("\"$(rm -rf /); `id` ${HOME} *\"", diagnostics);

        // Assert
        assertThat(tokens.get(0).value()).isEqualTo("$(rm -rf /); `id` ${HOME} *");
    }

    /**
     * Verifies raw strings with and without hashes: no escapes are processed and quotes may appear
     * inside the hashed form.
     */
    @Test
    @Tag("unit")
    void testRawStrings() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("r\"C:\\dir\" r#\"say \"hi\"\"#", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.subList(0, 2)).extracting(Token::type, Token::value).containsExactly(
                tuple(TokenType.STRING, "C:\\dir"),
                tuple(TokenType.STRING, "say \"hi\""));
    }

    /**
     * Verifies that unknown escapes and unterminated strings are reported with their codes.
     */
    @Test
    @Tag("unit")
    void testMalformedStrings() {
        // Arrange
        DiagnosticsEngine escapes = new DiagnosticsEngine();
        DiagnosticsEngine unterminated = new DiagnosticsEngine();

        // Act
        scan("\"bad \\q\"", escapes);
        scan("\"never closed", unterminated);

        // Assert
        assertThat(escapes.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.INVALID_ESCAPE);
        assertThat(unterminated.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNTERMINATED_STRING);
    }

    /**
     * Verifies that line comments and nested block comments produce no tokens but keep line counting intact.
     */
    @Test
    @Tag("unit")
    void testCommentsAreSkipped() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("// head\n/* outer /* inner */\n still comment */ let", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.LET, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).line()).isEqualTo(3);
    }

    /**
     * Verifies that an unexpected character is reported at its position.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("let x = 1;\nlet $y = 2;", diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER);
        assertThat(error.span().line()).isEqualTo(2);
        assertThat(error.span().column()).isEqualTo(5);
    }

    /**
     * Verifies that keywords outside the subset are still recognised, so the parser can name them.
     */
    @Test
    @Tag("unit")
    void testUnsupportedKeywordsAreRecognised() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("loop unsafe impl 'c'", diagnostics);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LOOP, TokenType.UNSAFE, TokenType.IMPL, TokenType.CHAR, TokenType.END_OF_FILE);
    }
}
