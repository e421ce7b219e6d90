package org.shellsafe.compiler.frontend.semantics;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.lexer.Lexer;
import org.shellsafe.compiler.frontend.parser.Parser;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}.
 * Every test parses a small program without syntax errors and checks the diagnostics the analysis reports.
 */
public class SemanticAnalyzerTest {

    private static List<Diagnostic> analyze(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ProgramNode program = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        assertThat(diagnostics.getDiagnostics()).as("parse diagnostics").isEmpty();
        new SemanticAnalyzer(diagnostics).analyze(program);
        return diagnostics.getDiagnostics();
    }

    private static List<CompilerErrorCode> codes(String source) {
        return analyze(source).stream().map(Diagnostic::code).toList();
    }

    /**
     * Verifies that a well-formed program with parameters, locals and calls is accepted silently.
     */
    @Test
    @Tag("unit")
    void testValidProgramHasNoDiagnostics() {
        // Arrange
        String source = String.join("\n",
                "fn greet(name: &str, times: u32) {",
                "    for i in 0..times {",
                "        println!(\"{} {}\", i, name);",
                "    }",
                "}",
                "fn main() {",
                "    let who = env_var_or(\"USER\", \"world\");",
                "    let mut n = 1;",
                "    n += 1;",
                "    greet(who, n);",
                "}");

        // Act
        List<Diagnostic> diagnostics = analyze(source);

        // Assert
        assertThat(diagnostics).isEmpty();
    }

    /**
     * Verifies that a program needs a parameterless main function.
     */
    @Test
    @Tag("unit")
    void testMainIsRequired() {
        // Act
        List<CompilerErrorCode> missing = codes("fn helper() {}");
        List<CompilerErrorCode> withParameter = codes("fn main(x: u32) { println!(\"{}\", x); }");

        // Assert
        assertThat(missing).contains(CompilerErrorCode.MISSING_MAIN);
        assertThat(withParameter).containsExactly(CompilerErrorCode.MISSING_MAIN);
    }

    /**
     * Verifies that duplicate functions and duplicate parameters are rejected.
     */
    @Test
    @Tag("unit")
    void testDuplicates() {
        // Act
        List<CompilerErrorCode> functions = codes("fn main() {}\nfn main() {}");
        List<CompilerErrorCode> parameters = codes("fn f(a: u32, a: u32) { println!(\"{}\", a); }\nfn main() { f(1, 2); }");

        // Assert
        assertThat(functions).containsExactly(CompilerErrorCode.DUPLICATE_FUNCTION);
        assertThat(parameters).containsExactly(CompilerErrorCode.DUPLICATE_PARAMETER);
    }

    /**
     * Verifies that functions may not shadow shell builtins, allow-listed functions or the runtime prefix.
     */
    @Test
    @Tag("unit")
    void testReservedFunctionNames() {
        // Act
        List<CompilerErrorCode> builtin = codes("fn echo() {}\nfn main() { echo(); }");
        List<CompilerErrorCode> stdlib = codes("fn env(x: &str) {}\nfn main() {}");
        List<CompilerErrorCode> prefix = codes("fn rash_helper() {}\nfn main() { rash_helper(); }");

        // Assert
        assertThat(builtin).containsExactly(CompilerErrorCode.RESERVED_FUNCTION_NAME);
        assertThat(stdlib).contains(CompilerErrorCode.RESERVED_FUNCTION_NAME);
        assertThat(prefix).containsExactly(CompilerErrorCode.RESERVED_FUNCTION_NAME);
    }

    /**
     * Verifies that calls resolve to a user function or an allow-listed function with a fitting arity.
     */
    @Test
    @Tag("unit")
    void testCallResolutionAndArity() {
        // Act
        List<CompilerErrorCode> unknown = codes("fn main() { frobnicate(); }");
        List<CompilerErrorCode> userArity = codes("fn f(a: u32) { println!(\"{}\", a); }\nfn main() { f(1, 2); }");
        List<CompilerErrorCode> stdlibArity = codes("fn main() { let x = env(); println!(\"{}\", x); }");

        // Assert
        assertThat(unknown).containsExactly(CompilerErrorCode.UNKNOWN_FUNCTION);
        assertThat(userArity).containsExactly(CompilerErrorCode.ARITY_MISMATCH);
        assertThat(stdlibArity).containsExactly(CompilerErrorCode.ARITY_MISMATCH);
    }

    /**
     * Verifies variable resolution: use before declaration, the loop variable outside its loop and
     * a binding visible only after its own initializer.
     */
    @Test
    @Tag("unit")
    void testVariableResolution() {
        // Act
        List<CompilerErrorCode> undeclared = codes("fn main() { println!(\"{}\", ghost); }");
        List<CompilerErrorCode> loopVariable = codes("fn main() { for i in 0..3 { println!(\"{}\", i); } println!(\"{}\", i); }");
        List<CompilerErrorCode> selfReference = codes("fn main() { let x = x + 1; println!(\"{}\", x); }");

        // Assert
        assertThat(undeclared).containsExactly(CompilerErrorCode.UNDEFINED_VARIABLE);
        assertThat(loopVariable).containsExactly(CompilerErrorCode.UNDEFINED_VARIABLE);
        assertThat(selfReference).containsExactly(CompilerErrorCode.UNDEFINED_VARIABLE);
    }

    /**
     * Verifies that only mutable bindings may be assigned.
     */
    @Test
    @Tag("unit")
    void testImmutableAssignment() {
        // Act
        List<Diagnostic> diagnostics = analyze("fn main() { let x = 1; x = 2; println!(\"{}\", x); }");

        // Assert
        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.IMMUTABLE_ASSIGNMENT);
        assertThat(diagnostics.get(0).fixIt()).isEqualTo("declare it with 'mut'");
    }

    /**
     * Verifies that break and continue are only accepted inside a loop.
     */
    @Test
    @Tag("unit")
    void testLoopControlOutsideLoop() {
        // Act
        List<CompilerErrorCode> outside = codes("fn main() { break; }");
        List<CompilerErrorCode> inside = codes("fn main() { while true { if arg_count() > 0 { continue; } break; } }");

        // Assert
        assertThat(outside).containsExactly(CompilerErrorCode.LOOP_CONTROL_OUTSIDE_LOOP);
        assertThat(inside).isEmpty();
    }

    /**
     * Verifies that direct and mutual recursion are reported with the call path.
     */
    @Test
    @Tag("unit")
    void testRecursionIsRejected() {
        // Act
        List<Diagnostic> direct = analyze("fn f() { f(); }\nfn main() { f(); }");
        List<Diagnostic> mutual = analyze("fn a() { b(); }\nfn b() { a(); }\nfn main() { a(); }");

        // Assert
        assertThat(direct).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.RECURSION_NOT_SUPPORTED);
        assertThat(direct.get(0).message()).contains("f -> f");
        assertThat(mutual).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.RECURSION_NOT_SUPPORTED);
        assertThat(mutual.get(0).message()).contains("a -> b -> a");
    }

    /**
     * Verifies the three warnings: unused bindings (except underscore names), unreachable
     * statements and functions that main never reaches.
     */
    @Test
    @Tag("unit")
    void testWarnings() {
        // Arrange
        String source = String.join("\n",
                "fn helper() {}",
                "fn main() {",
                "    let unused = 1;",
                "    let _ignored = 2;",
                "    return;",
                "    println!(\"never\");",
                "}");

        // Act
        List<Diagnostic> diagnostics = analyze(source);

        // Assert
        assertThat(diagnostics).allMatch(d -> d.severity() == Diagnostic.Severity.WARNING);
        assertThat(diagnostics).extracting(Diagnostic::code).containsExactlyInAnyOrder(
                CompilerErrorCode.UNUSED_VARIABLE, CompilerErrorCode.UNREACHABLE_CODE, CompilerErrorCode.UNUSED_FUNCTION);
        assertThat(diagnostics).filteredOn(d -> d.code() == CompilerErrorCode.UNREACHABLE_CODE)
                .extracting(d -> d.span().line()).containsExactly(6);
    }

    /**
     * Verifies that an exit() call also ends the control flow of its block.
     */
    @Test
    @Tag("unit")
    void testExitEndsControlFlow() {
        // Act
        List<CompilerErrorCode> codes = codes("fn main() { exit(3); println!(\"after\"); }");

        // Assert
        assertThat(codes).containsExactly(CompilerErrorCode.UNREACHABLE_CODE);
    }
}
