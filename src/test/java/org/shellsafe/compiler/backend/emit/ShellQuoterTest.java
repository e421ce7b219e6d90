package org.shellsafe.compiler.backend.emit;

import org.shellsafe.compiler.ir.ArithmeticOp;
import org.shellsafe.compiler.ir.ComparisonOp;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ShellQuoter}.
 * Every rendered word is compared character by character, since a single missing quote would
 * open the script to word splitting or injection.
 */
public class ShellQuoterTest {

    private final ShellQuoter quoter = new ShellQuoter(ir -> "cmd");

    private static ShellValue lit(String text) {
        return new ShellValue.Literal(text);
    }

    private static ShellValue ref(String name) {
        return new ShellValue.VariableRef(name);
    }

    /**
     * Verifies that safe literals stay bare and everything else is single-quoted.
     */
    @Test
    @Tag("unit")
    void testQuoteLiteral() {
        // Act & Assert
        assertThat(ShellQuoter.quoteLiteral("hello")).isEqualTo("hello");
        assertThat(ShellQuoter.quoteLiteral("/usr/bin:x=1,y@2")).isEqualTo("/usr/bin:x=1,y@2");
        assertThat(ShellQuoter.quoteLiteral("a b")).isEqualTo("'a b'");
        assertThat(ShellQuoter.quoteLiteral("")).isEqualTo("''");
        assertThat(ShellQuoter.quoteLiteral("$(rm -rf /); `id`")).isEqualTo("'$(rm -rf /); `id`'");
        assertThat(ShellQuoter.quoteLiteral("*")).isEqualTo("'*'");
    }

    /**
     * Verifies that an embedded single quote closes, escapes and reopens the quoting.
     */
    @Test
    @Tag("unit")
    void testSingleQuoteEscaping() {
        // Act & Assert
        assertThat(ShellQuoter.singleQuote("it's")).isEqualTo("'it'\\''s'");
    }

    /**
     * Verifies that variables and positional parameters are braced and double-quoted.
     */
    @Test
    @Tag("unit")
    void testExpansionsAreQuoted() {
        // Act & Assert
        assertThat(quoter.word(ref("name"))).isEqualTo("\"${name}\"");
        assertThat(quoter.word(new ShellValue.Arg(2))).isEqualTo("\"${2}\"");
        assertThat(quoter.word(new ShellValue.ArgCount())).isEqualTo("\"${#}\"");
        assertThat(quoter.word(ShellValue.Bool.TRUE)).isEqualTo("true");
        assertThat(quoter.word(new ShellValue.CommandSubst(new ShellIr.Noop()))).isEqualTo("\"$(cmd)\"");
    }

    /**
     * Verifies that constant parts of a concatenation are escaped for double quotes.
     */
    @Test
    @Tag("unit")
    void testConcatenation() {
        // Arrange
        ShellValue value = new ShellValue.Concat(List.of(lit("Hello, "), ref("name"), lit("! $HOME `x` \"q\" \\")));

        // Act
        String word = quoter.word(value);

        // Assert
        assertThat(word).isEqualTo("\"Hello, ${name}! \\$HOME \\`x\\` \\\"q\\\" \\\\\"");
        assertThat(quoter.word(new ShellValue.Concat(List.of()))).isEqualTo("''");
    }

    /**
     * Verifies environment reads with and without defaults, including the characters that need
     * special care inside the braces.
     */
    @Test
    @Tag("unit")
    void testEnvironmentVariables() {
        // Act & Assert
        assertThat(quoter.word(new ShellValue.EnvVar("HOME"))).isEqualTo("\"${HOME}\"");
        assertThat(quoter.word(new ShellValue.EnvVar("HOME", Optional.of(lit("/tmp"))))).isEqualTo("\"${HOME:-/tmp}\"");
        assertThat(quoter.word(new ShellValue.EnvVar("X", Optional.of(lit("a}b$c")))))
                .isEqualTo("\"${X:-a\\}b\\$c}\"");
        assertThat(quoter.word(new ShellValue.EnvVar("X", Optional.of(lit("it's")))))
                .isEqualTo("\"${X:-$(printf '%s' 'it'\\''s')}\"");
    }

    /**
     * Verifies arithmetic rendering: unquoted braced operands, parenthesized nesting and negative literals.
     */
    @Test
    @Tag("unit")
    void testArithmetic() {
        // Arrange
        ShellValue sum = new ShellValue.Arithmetic(ArithmeticOp.ADD, ref("a"), ref("b"));
        ShellValue product = new ShellValue.Arithmetic(ArithmeticOp.MUL, sum, lit("-2"));

        // Act & Assert
        assertThat(quoter.assignmentValue(product)).isEqualTo("$(( (${a} + ${b}) * (-2) ))");
        assertThat(quoter.word(sum)).isEqualTo("\"$(( ${a} + ${b} ))\"");
        assertThat(quoter.arithmetic(new ShellValue.Arithmetic(ArithmeticOp.REM, new ShellValue.Arg(1), lit("3"))))
                .isEqualTo("${1} % 3");
        assertThat(quoter.assignmentValue(lit("plain"))).isEqualTo("plain");
    }

    /**
     * Verifies that values without a rendering in a context are refused instead of emitted loosely.
     */
    @Test
    @Tag("unit")
    void testRefusesValuesWithoutRendering() {
        // Arrange
        ShellValue comparison = new ShellValue.Comparison(ComparisonOp.EQ, lit("1"), lit("1"), true);

        // Act & Assert
        assertThatThrownBy(() -> quoter.word(comparison))
                .isInstanceOf(EmissionException.class)
                .hasMessageContaining("cannot be rendered as a word");
        assertThatThrownBy(() -> quoter.arithmetic(lit("abc")))
                .isInstanceOf(EmissionException.class)
                .hasMessageContaining("Not an integer operand");
        assertThatThrownBy(() -> quoter.arithmetic(new ShellValue.EnvVar("N")))
                .isInstanceOf(EmissionException.class);
    }
}
