package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DeadCodeEliminationRule}.
 */
public class DeadCodeEliminationRuleTest {

    private final DeadCodeEliminationRule rule = new DeadCodeEliminationRule();

    private static ShellIr echo(String text) {
        return new ShellIr.Echo(new ShellValue.Literal(text), false, true);
    }

    private static ShellIr.FunctionDef function(String name, ShellIr body) {
        return new ShellIr.FunctionDef(name, List.of(), body, false);
    }

    private ShellIr optimizedMain(ShellIr body) {
        IrProgram program = new IrProgram("test.rs", "00", List.of(function("main", body)));
        return rule.apply(program, CompilerConfig.defaults()).function("main").orElseThrow().body();
    }

    /**
     * Verifies that an if with a constant condition is replaced by the branch that runs.
     */
    @Test
    @Tag("unit")
    void testConstantConditionKeepsTakenBranch() {
        // Arrange
        ShellIr body = new ShellIr.Sequence(List.of(
                new ShellIr.If(ShellValue.Bool.TRUE, echo("yes"), Optional.of(echo("no"))),
                new ShellIr.If(ShellValue.Bool.FALSE, echo("never"), Optional.empty()),
                echo("after")));

        // Act
        ShellIr result = optimizedMain(body);

        // Assert
        assertThat(result).isEqualTo(new ShellIr.Sequence(List.of(echo("yes"), echo("after"))));
    }

    /**
     * Verifies that a body left without statements becomes a no-op.
     */
    @Test
    @Tag("unit")
    void testEmptiedBodyBecomesNoop() {
        // Arrange
        ShellIr body = new ShellIr.Sequence(List.of(
                new ShellIr.While(ShellValue.Bool.FALSE, echo("never")),
                new ShellIr.If(ShellValue.Bool.FALSE, echo("never"), Optional.empty())));

        // Act
        ShellIr result = optimizedMain(body);

        // Assert
        assertThat(result).isEqualTo(new ShellIr.Noop());
    }

    /**
     * Verifies that statements after return, exit, break or continue are dropped, also in nested blocks.
     */
    @Test
    @Tag("unit")
    void testDropsStatementsAfterJump() {
        // Arrange
        ShellIr loopBody = new ShellIr.Sequence(List.of(new ShellIr.Break(), echo("dead in loop")));
        ShellIr body = new ShellIr.Sequence(List.of(
                new ShellIr.While(new ShellValue.VariableRef("go"), loopBody),
                new ShellIr.Exit(new ShellValue.Literal("3")),
                echo("dead")));

        // Act
        ShellIr result = optimizedMain(body);

        // Assert
        assertThat(result).isEqualTo(new ShellIr.Sequence(List.of(
                new ShellIr.While(new ShellValue.VariableRef("go"), new ShellIr.Break()),
                new ShellIr.Exit(new ShellValue.Literal("3")))));
    }

    /**
     * Verifies that a loop with a constantly true condition is kept.
     */
    @Test
    @Tag("unit")
    void testKeepsInfiniteLoop() {
        // Arrange
        ShellIr loop = new ShellIr.While(ShellValue.Bool.TRUE, new ShellIr.Break());

        // Act & Assert
        assertThat(optimizedMain(loop)).isEqualTo(loop);
    }

    /**
     * Verifies that only functions reachable from main survive, through statements and through
     * command substitutions, in their original order.
     */
    @Test
    @Tag("unit")
    void testRemovesUnreachableFunctions() {
        // Arrange
        ShellIr.FunctionDef unused = function("unused", new ShellIr.Call("used", List.of()));
        ShellIr.FunctionDef used = function("used", new ShellIr.Call("deep", List.of()));
        ShellIr.FunctionDef deep = function("deep", echo("deep"));
        ShellIr.FunctionDef value = new ShellIr.FunctionDef("value", List.of(), echo("42"), true);
        ShellIr.FunctionDef skipped = function("skipped", echo("skipped"));
        ShellIr.FunctionDef main = function("main", new ShellIr.Sequence(List.of(
                new ShellIr.Call("used", List.of()),
                new ShellIr.Assign("x", new ShellValue.CommandSubst(new ShellIr.Call("value", List.of()))),
                new ShellIr.If(ShellValue.Bool.FALSE, new ShellIr.Call("skipped", List.of()), Optional.empty()))));
        IrProgram program = new IrProgram("test.rs", "00", List.of(unused, used, deep, value, skipped, main));

        // Act
        IrProgram result = rule.apply(program, CompilerConfig.defaults());

        // Assert
        assertThat(result.functions()).extracting(ShellIr.FunctionDef::name)
                .containsExactly("used", "deep", "value", "main");
    }
}
