package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.ir.ComparisonOp;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link Optimizer} and its rule ordering.
 */
public class OptimizerTest {

    private static IrProgram branchingProgram() {
        ShellIr.FunctionDef used = new ShellIr.FunctionDef("used", List.of(), new ShellIr.Echo(new ShellValue.Literal("used"), false, true), false);
        ShellIr.FunctionDef unused = new ShellIr.FunctionDef("unused", List.of(), new ShellIr.Echo(new ShellValue.Literal("unused"), false, true), false);
        ShellIr.FunctionDef main = new ShellIr.FunctionDef("main", List.of(), new ShellIr.If(
                new ShellValue.Comparison(ComparisonOp.GT, new ShellValue.Literal("3"), new ShellValue.Literal("2"), true),
                new ShellIr.Call("used", List.of()),
                Optional.of(new ShellIr.Call("unused", List.of()))), false);
        return new IrProgram("test.rs", "00", List.of(used, unused, main));
    }

    /**
     * Verifies that folding runs before dead code elimination: the folded condition selects a branch
     * and the function only the other branch called is removed.
     */
    @Test
    @Tag("unit")
    void testDefaultRulesCooperate() {
        // Act
        IrProgram result = new Optimizer().optimize(branchingProgram(), CompilerConfig.defaults());

        // Assert
        assertThat(result.functions()).extracting(ShellIr.FunctionDef::name).containsExactly("used", "main");
        assertThat(result.function("main").orElseThrow().body()).isEqualTo(new ShellIr.Call("used", List.of()));
    }

    /**
     * Verifies that the program is returned unchanged when every rule is switched off.
     */
    @Test
    @Tag("unit")
    void testNoRuleEnabled() {
        // Arrange
        IrProgram program = branchingProgram();

        // Act
        IrProgram result = new Optimizer().optimize(program, CompilerConfig.defaults().withOptimizations(false));

        // Assert
        assertThat(result).isSameAs(program);
    }

    /**
     * Verifies that only enabled rules of a custom registry are applied, in registration order.
     */
    @Test
    @Tag("unit")
    void testAppliesOnlyEnabledRules() {
        // Arrange
        IrProgram input = branchingProgram();
        IrProgram rewritten = input.withFunctions(List.of());
        IOptimizationRule enabled = mock(IOptimizationRule.class);
        IOptimizationRule disabled = mock(IOptimizationRule.class);
        when(enabled.isEnabled(any())).thenReturn(true);
        when(enabled.name()).thenReturn("enabled");
        when(enabled.apply(any(), any())).thenReturn(rewritten);
        when(disabled.isEnabled(any())).thenReturn(false);
        OptimizationRegistry registry = new OptimizationRegistry();
        registry.register(disabled);
        registry.register(enabled);

        // Act
        IrProgram result = new Optimizer(registry).optimize(input, CompilerConfig.defaults());

        // Assert
        assertThat(result).isSameAs(rewritten);
        verify(enabled).apply(input, CompilerConfig.defaults());
        verify(disabled, never()).apply(any(), any());
    }

    /**
     * Verifies the default rule order.
     */
    @Test
    @Tag("unit")
    void testDefaultRegistryOrder() {
        // Act
        List<IOptimizationRule> rules = OptimizationRegistry.initializeWithDefaults().rules();

        // Assert
        assertThat(rules).extracting(IOptimizationRule::name)
                .containsExactly("constant-folding", "inlining", "dead-code-elimination");
    }
}
