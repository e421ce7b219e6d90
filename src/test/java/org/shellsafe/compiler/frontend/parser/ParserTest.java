package org.shellsafe.compiler.frontend.parser;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.lexer.Lexer;
import org.shellsafe.compiler.frontend.parser.ast.AssignNode;
import org.shellsafe.compiler.frontend.parser.ast.BinaryExpr;
import org.shellsafe.compiler.frontend.parser.ast.ExprStmtNode;
import org.shellsafe.compiler.frontend.parser.ast.ForNode;
import org.shellsafe.compiler.frontend.parser.ast.FormatMacroExpr;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.IntLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.LetNode;
import org.shellsafe.compiler.frontend.parser.ast.LiteralPatternNode;
import org.shellsafe.compiler.frontend.parser.ast.MatchNode;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.shellsafe.compiler.frontend.parser.ast.RangeExpr;
import org.shellsafe.compiler.frontend.parser.ast.RangePatternNode;
import org.shellsafe.compiler.frontend.parser.ast.ReturnNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.VariableExpr;
import org.shellsafe.compiler.frontend.parser.ast.WildcardPatternNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * The tests cover the AST shapes of the accepted subset, the desugaring done while parsing and
 * the reporting of constructs outside of the subset.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private ProgramNode parse(String source) {
        diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics, "test.rs");
        return new Parser(lexer.scanTokens(), diagnostics).parse();
    }

    /**
     * Verifies that the tail expression of a value-returning function becomes a return statement.
     */
    @Test
    @Tag("unit")
    void testTailExpressionBecomesReturn() {
        // Arrange
        String source = "fn add(a: u32, b: u32) -> u32 {\n    a + b\n}\nfn main() {}";

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.functions()).extracting(FunctionNode::name).containsExactly("add", "main");
        FunctionNode add = program.functions().get(0);
        assertThat(add.returnType()).isEqualTo(SourceType.INTEGER);
        assertThat(add.parameters()).hasSize(2);
        assertThat(add.body().statements()).hasSize(1);
        ReturnNode ret = (ReturnNode) add.body().statements().get(0);
        assertThat(ret.value()).isInstanceOf(BinaryExpr.class);
        assertThat(((BinaryExpr) ret.value()).operator()).isEqualTo(BinaryExpr.Operator.ADD);
    }

    /**
     * Verifies that multiplication binds tighter than addition.
     */
    @Test
    @Tag("unit")
    void testOperatorPrecedence() {
        // Arrange
        String source = "fn main() { let x = 1 + 2 * 3; }";

        // Act
        ProgramNode program = parse(source);

        // Assert
        LetNode let = (LetNode) program.functions().get(0).body().statements().get(0);
        BinaryExpr sum = (BinaryExpr) let.initializer();
        assertThat(sum.operator()).isEqualTo(BinaryExpr.Operator.ADD);
        assertThat(sum.left()).isInstanceOf(IntLiteralExpr.class);
        assertThat(((BinaryExpr) sum.right()).operator()).isEqualTo(BinaryExpr.Operator.MUL);
    }

    /**
     * Verifies that the smallest 64-bit integer can be written as a negated literal, in expressions
     * and in patterns, while its magnitude alone is out of range.
     */
    @Test
    @Tag("unit")
    void testMinimumIntegerLiteral() {
        // Act
        ProgramNode program = parse(String.join("\n",
                "fn main() {",
                "    let x = -9223372036854775808;",
                "    match x {",
                "        -9223372036854775808 => println!(\"min\"),",
                "        _ => println!(\"other\"),",
                "    }",
                "}"));
        DiagnosticsEngine valid = diagnostics;
        parse("fn main() { let y = 9223372036854775808; }");
        DiagnosticsEngine tooLarge = diagnostics;

        // Assert
        assertThat(valid.getDiagnostics()).isEmpty();
        LetNode let = (LetNode) program.functions().get(0).body().statements().get(0);
        assertThat(((IntLiteralExpr) let.initializer()).value()).isEqualTo(Long.MIN_VALUE);
        MatchNode match = (MatchNode) program.functions().get(0).body().statements().get(1);
        assertThat(((LiteralPatternNode) match.arms().get(0).patterns().get(0)).value()).isEqualTo(Long.MIN_VALUE);
        assertThat(tooLarge.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.INVALID_NUMBER);
        assertThat(tooLarge.getDiagnostics().get(0).message()).contains("out of range");
    }

    /**
     * Verifies that compound assignments are desugared into a plain assignment of a binary expression.
     */
    @Test
    @Tag("unit")
    void testCompoundAssignmentIsDesugared() {
        // Arrange
        String source = "fn main() { let mut x = 1; x += 2; }";

        // Act
        ProgramNode program = parse(source);

        // Assert
        AssignNode assign = (AssignNode) program.functions().get(0).body().statements().get(1);
        assertThat(assign.target()).isEqualTo("x");
        BinaryExpr value = (BinaryExpr) assign.value();
        assertThat(value.operator()).isEqualTo(BinaryExpr.Operator.ADD);
        assertThat(((VariableExpr) value.left()).name()).isEqualTo("x");
        assertThat(((IntLiteralExpr) value.right()).value()).isEqualTo(2L);
    }

    /**
     * Verifies that a format string is split into literal pieces around positional and inline placeholders,
     * with escaped braces kept as text.
     */
    @Test
    @Tag("unit")
    void testFormatStringIsSplit() {
        // Arrange
        String source = "fn main() { let name = \"x\"; println!(\"{{Hello}} {}, {name}!\", name); }";

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        ExprStmtNode statement = (ExprStmtNode) program.functions().get(0).body().statements().get(1);
        FormatMacroExpr println = (FormatMacroExpr) statement.expression();
        assertThat(println.kind()).isEqualTo(FormatMacroExpr.Kind.PRINTLN);
        assertThat(println.pieces()).containsExactly("{Hello} ", ", ", "!");
        assertThat(println.arguments()).extracting(a -> ((VariableExpr) a).name()).containsExactly("name", "name");
    }

    /**
     * Verifies that placeholders without arguments and unused arguments are both format errors.
     */
    @Test
    @Tag("unit")
    void testFormatArgumentMismatch() {
        // Act
        parse("fn main() { println!(\"{} {}\", 1); }");
        DiagnosticsEngine missing = diagnostics;
        parse("fn main() { println!(\"none\", 1); }");
        DiagnosticsEngine unused = diagnostics;

        // Assert
        assertThat(missing.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.INVALID_FORMAT_STRING);
        assertThat(unused.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.INVALID_FORMAT_STRING);
    }

    /**
     * Verifies that a positional index too large for an int is reported as an out-of-range argument.
     */
    @Test
    @Tag("unit")
    void testHugeFormatIndexIsReported() {
        // Act
        parse("fn main() { println!(\"{99999999999}\", 1); }");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.INVALID_FORMAT_STRING);
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("99999999999").contains("out of range");
    }

    /**
     * Verifies the three pattern kinds of a match arm and alternatives joined with '|'.
     */
    @Test
    @Tag("unit")
    void testMatchPatterns() {
        // Arrange
        String source = String.join("\n",
                "fn main() {",
                "    let n = 3;",
                "    match n {",
                "        1 | 2 => println!(\"small\"),",
                "        3..=9 => { println!(\"digit\"); }",
                "        _ => println!(\"big\"),",
                "    }",
                "}");

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        MatchNode match = (MatchNode) program.functions().get(0).body().statements().get(1);
        assertThat(match.arms()).hasSize(3);
        assertThat(match.arms().get(0).patterns()).extracting(p -> ((LiteralPatternNode) p).value()).containsExactly(1L, 2L);
        RangePatternNode range = (RangePatternNode) match.arms().get(1).patterns().get(0);
        assertThat(range.low()).isEqualTo(3L);
        assertThat(range.high()).isEqualTo(9L);
        assertThat(range.inclusive()).isTrue();
        assertThat(match.arms().get(2).patterns().get(0)).isInstanceOf(WildcardPatternNode.class);
    }

    /**
     * Verifies that a for loop over an inclusive range produces a range expression.
     */
    @Test
    @Tag("unit")
    void testForOverInclusiveRange() {
        // Act
        ProgramNode program = parse("fn main() { for i in 0..=3 { println!(\"{}\", i); } }");

        // Assert
        ForNode loop = (ForNode) program.functions().get(0).body().statements().get(0);
        assertThat(loop.variable()).isEqualTo("i");
        RangeExpr range = (RangeExpr) loop.iterable();
        assertThat(range.inclusive()).isTrue();
    }

    /**
     * Verifies that one run reports every unsupported construct of a body, each with its own diagnostic,
     * and that parsing continues after each of them.
     */
    @Test
    @Tag("unit")
    void testUnsupportedConstructsAreAllReported() {
        // Arrange
        String source = String.join("\n",
                "fn main() {",
                "    loop { break; }",
                "    let s = \"abc\".len();",
                "    let f = |x| x;",
                "    let ok = 1;",
                "}");

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsOnly(CompilerErrorCode.UNSUPPORTED_CONSTRUCT);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message).containsExactly(
                "Unsupported feature: loop.",
                "Unsupported feature: method calls.",
                "Unsupported feature: closures.");
        assertThat(diagnostics.getDiagnostics().get(0).fixIt()).contains("while true");
        assertThat(diagnostics.getDiagnostics().get(1).fixIt()).isEqualTo("use string_len(s) or array_len(v)");
        assertThat(diagnostics.getDiagnostics().get(0).span().line()).isEqualTo(2);
        assertThat(program.functions().get(0).body().statements())
                .filteredOn(s -> s instanceof LetNode let && let.name().equals("ok")).hasSize(1);
    }

    /**
     * Verifies that top-level items other than functions are reported and skipped.
     */
    @Test
    @Tag("unit")
    void testUnsupportedItems() {
        // Arrange
        String source = "struct Point { x: u32 }\nimpl Point { fn get(&self) -> u32 { 1 } }\nfn main() {}";

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("Unsupported feature: structs.", "Unsupported feature: impl blocks.");
        assertThat(program.functions()).extracting(FunctionNode::name).containsExactly("main");
    }

    /**
     * Verifies that macros outside of the allow-list are rejected with their own code.
     */
    @Test
    @Tag("unit")
    void testUnsupportedMacro() {
        // Act
        parse("fn main() { panic!(\"boom\"); }");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNSUPPORTED_MACRO);
    }

    /**
     * Verifies that a NUL escape in a string literal is rejected, since shell strings cannot hold it.
     */
    @Test
    @Tag("unit")
    void testNulInStringIsRejected() {
        // Act
        parse("fn main() { println!(\"a\\0b\"); }");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.NUL_IN_STRING);
    }

    /**
     * Verifies that a NUL is rejected in a format string, in a match pattern and in a raw string.
     */
    @Test
    @Tag("unit")
    void testNulIsRejectedInEveryStringPosition() {
        // Arrange
        String source = String.join("\n",
                "fn main() {",
                "    let s = format!(\"a\\0{}\", 1);",
                "    match s {",
                "        \"x\\0\" => println!(\"x\"),",
                "        _ => println!(\"{}\", r\"y\0\"),",
                "    }",
                "}");

        // Act
        parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(
                CompilerErrorCode.NUL_IN_STRING, CompilerErrorCode.NUL_IN_STRING, CompilerErrorCode.NUL_IN_STRING);
        assertThat(diagnostics.getDiagnostics()).extracting(d -> d.span().line()).containsExactly(2, 4, 5);
    }

    /**
     * Verifies that vectors cannot be declared as parameter types.
     */
    @Test
    @Tag("unit")
    void testVectorParameterIsRejected() {
        // Act
        parse("fn f(v: Vec<u32>) {}\nfn main() {}");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNSUPPORTED_TYPE);
    }

    /**
     * Verifies that pathologically nested expressions stop with a nesting error instead of overflowing the stack.
     */
    @Test
    @Tag("unit")
    void testExpressionNestingLimit() {
        // Arrange
        int depth = Parser.MAX_EXPRESSION_DEPTH + 10;
        String source = "fn main() { let x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "; }";

        // Act
        parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).contains(CompilerErrorCode.NESTING_TOO_DEEP);
    }

    /**
     * Verifies that chained comparisons are rejected.
     */
    @Test
    @Tag("unit")
    void testChainedComparisonIsRejected() {
        // Act
        parse("fn main() { let b = 1 < 2 < 3; }");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNEXPECTED_TOKEN);
    }
}
