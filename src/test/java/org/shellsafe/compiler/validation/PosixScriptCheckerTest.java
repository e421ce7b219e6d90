package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.backend.emit.PosixEmitter;
import org.shellsafe.compiler.ir.ArithmeticOp;
import org.shellsafe.compiler.ir.ComparisonOp;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link PosixScriptChecker}.
 */
public class PosixScriptCheckerTest {

    private final PosixScriptChecker checker = new PosixScriptChecker();

    private ValidationException rejection(String script) {
        ValidationException e = catchThrowableOfType(() -> checker.check(script), ValidationException.class);
        assertThat(e).as("check error for: " + script).isNotNull();
        return e;
    }

    /**
     * Verifies that everything the emitter produces passes: header, helpers, every compound
     * statement and the trickiest quoting the quoter uses.
     */
    @Test
    @Tag("unit")
    void testEmittedScriptPasses() {
        // Arrange
        ShellIr body = new ShellIr.Sequence(List.of(
                new ShellIr.Assign("s", new ShellValue.EnvVar("X", Optional.of(new ShellValue.Literal("it's } $x")))),
                new ShellIr.Assign("t", new ShellValue.CommandSubst(new ShellIr.Call("rash_string_trim", List.of(new ShellValue.VariableRef("s"))))),
                new ShellIr.Assign("n", new ShellValue.Arithmetic(ArithmeticOp.MUL,
                        new ShellValue.Arithmetic(ArithmeticOp.ADD, new ShellValue.ArgCount(), new ShellValue.Literal("1")), new ShellValue.Literal("-2"))),
                new ShellIr.If(new ShellValue.LogicalNot(new ShellValue.LogicalAnd(
                        new ShellValue.Predicate(new ShellIr.Call("rash_string_contains", List.of(new ShellValue.VariableRef("t"), new ShellValue.Literal("[[")))),
                        new ShellValue.Comparison(ComparisonOp.NE, new ShellValue.VariableRef("t"), new ShellValue.Literal("<<<"), false))),
                        new ShellIr.Echo(new ShellValue.Literal("function local $'x' `id`"), true, true),
                        Optional.of(new ShellIr.Exit(new ShellValue.Literal("1")))),
                new ShellIr.Case(new ShellValue.Arg(1), List.of(
                        new ShellIr.CaseArm(List.of("a)b", "*"), false, new ShellIr.Noop()),
                        new ShellIr.CaseArm(List.of(), true, new ShellIr.Sequence(List.of())))),
                new ShellIr.For("i", new ShellValue.Literal("1"), new ShellValue.VariableRef("n"),
                        new ShellIr.While(ShellValue.Bool.FALSE, new ShellIr.Break())),
                new ShellIr.ForEach("v", List.of(new ShellValue.Literal("a b"), new ShellValue.Literal("((x))")), new ShellIr.Continue())));
        IrProgram program = new IrProgram("demo.rs", "00",
                List.of(new ShellIr.FunctionDef("main", List.of(), body, false)));
        String script = new PosixEmitter("test").emit(program);

        // Act & Assert
        assertThatCode(() -> checker.check(script)).doesNotThrowAnyException();
    }

    /**
     * Verifies that quoted text and comments cannot trigger a finding.
     */
    @Test
    @Tag("unit")
    void testQuotedTextIsIgnored() {
        // Arrange
        String script = String.join("\n",
                "#!/bin/sh",
                "# function local [[ <<< $'x'",
                "printf '%s\\n' '[[ <<< $(( local'",
                "x=\"a [[ b <(c) \\\"q\\\"\"",
                "");

        // Act & Assert
        assertThatCode(() -> checker.check(script)).doesNotThrowAnyException();
    }

    /**
     * Verifies the constructs of extended shells that must never appear in the output.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
            "f() {\\n    local x=1\\n}|2|'local'",
            "function f {\\n}|1|'function'",
            "if [[ -n x ]]; then :; fi|1|'[['",
            "cat <<< x|1|here-string",
            "diff <(ls) <(ls)|1|process substitution",
            "printf '%s' $'a'|1|ANSI-C quoting",
            "x=`id`|1|backquote command substitution",
            "((i = i + 1))|1|arithmetic command",
            "a=(1 2)|1|array assignment",
            "echo -n x|1|echo with options",
            ":\\nprintf '%s' \"${a[0]}\"|2|array subscript",
            "printf '%s' \"${x/a/b}\"|1|pattern substitution",
            "printf '%s' \"${x:1}\"|1|substring expansion",
            "printf '%s' \"${!x}\"|1|indirect expansion",
            "ls &> out|1|combined output redirection",
            "[ x == y ]|1|'==' in test"
    })
    void testNonPosixConstructs(String script, int line, String construct) {
        // Act
        ValidationException e = rejection(script.replace("\\n", "\n") + "\n");

        // Assert
        assertThat(e.diagnostic().code()).isEqualTo(CompilerErrorCode.NON_POSIX_CONSTRUCT);
        assertThat(e).hasMessage("Generated script line " + line + " uses a non-POSIX construct: " + construct + ".");
        assertThat(e.diagnostic().span().fileName()).isEqualTo(PosixScriptChecker.OUTPUT_NAME);
    }

    /**
     * Verifies unbalanced quoting and compound commands with the line of the offending construct.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
            "printf \"abc|1|unterminated double-quoted string",
            "printf 'abc|1|unterminated single-quoted string",
            "x=$(ls|1|unterminated command substitution",
            "if true; then\\n    :|1|missing 'fi'",
            "x=1\\ny=2\\nfi|3|unexpected 'fi'",
            "while true; do\\n    :\\nfi|3|unexpected 'fi'",
            "then|1|'then' outside of 'if'",
            "x)|1|unbalanced ')'",
            "printf '%s' \"${}\"|1|bad parameter expansion"
    })
    void testGrammarViolations(String script, int line, String problem) {
        // Act
        ValidationException e = rejection(script.replace("\\n", "\n") + "\n");

        // Assert
        assertThat(e.diagnostic().code()).isEqualTo(CompilerErrorCode.POSIX_GRAMMAR_VIOLATION);
        assertThat(e).hasMessage("Generated script line " + line + ": " + problem + ".");
        assertThat(e.diagnostic().span().line()).isEqualTo(line);
    }
}
