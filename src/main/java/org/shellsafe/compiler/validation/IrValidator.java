package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.ir.CommandPolicy;
import org.shellsafe.compiler.ir.IdentifierMangler;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellIrScanner;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.regex.Pattern;

/**
 * Pre-emission checks on the final IR. Lowering already refuses everything checked here; this
 * pass runs again after the optimizer so that no rewrite can smuggle an unsafe shape into the
 * emitter.
 * <ul>
 *     <li>environment variable names and argument positions are valid;</li>
 *     <li>every name the script defines is a safe, mangled identifier;</li>
 *     <li>every command word passes the {@link CommandPolicy};</li>
 *     <li>arithmetic operands are integers by construction and conditions never appear as words;</li>
 *     <li>{@code break} and {@code continue} only appear inside loops.</li>
 * </ul>
 */
public class IrValidator {

    private static final Pattern INTEGER = Pattern.compile("^-?[0-9]+$");

    /**
     * Validates a program.
     * @param program The program about to be emitted.
     * @throws ValidationException at the first violation.
     */
    public void validate(IrProgram program) {
        if (program.function(IdentifierMangler.function("main")).isEmpty()) {
            throw unsafe("The program has no main function.");
        }
        for (ShellIr.FunctionDef function : program.functions()) {
            new Checker().scan(function);
        }
    }

    private static ValidationException unsafe(String message) {
        return new ValidationException(CompilerErrorCode.UNSAFE_IR, message);
    }

    private static void requireName(String name, String what) {
        if (name == null || !IdentifierMangler.isSafeScriptName(name)) {
            throw unsafe("Unsafe " + what + " name '" + name + "'.");
        }
    }

    private static void requireWord(ShellValue value) {
        if (value instanceof ShellValue.Comparison || value instanceof ShellValue.LogicalAnd
                || value instanceof ShellValue.LogicalOr || value instanceof ShellValue.LogicalNot
                || value instanceof ShellValue.Predicate) {
            throw unsafe("A condition is used as a value: " + value);
        }
    }

    private static void requireOperand(ShellValue operand) {
        if (operand instanceof ShellValue.Literal literal) {
            if (!INTEGER.matcher(literal.text()).matches()) {
                throw unsafe("Non-integer literal '" + literal.text() + "' in arithmetic.");
            }
        } else if (!(operand instanceof ShellValue.VariableRef || operand instanceof ShellValue.Arithmetic
                || operand instanceof ShellValue.CommandSubst || operand instanceof ShellValue.ArgCount)) {
            throw unsafe("Operand cannot be used in arithmetic: " + operand);
        }
    }

    private static final class Checker extends ShellIrScanner {
        private int loops;

        @Override
        public Void visitFunctionDef(ShellIr.FunctionDef ir) {
            requireName(ir.name(), "function");
            ir.parameters().forEach(p -> requireName(p, "parameter"));
            return super.visitFunctionDef(ir);
        }

        @Override
        public Void visitAssign(ShellIr.Assign ir) {
            requireName(ir.name(), "variable");
            requireWord(ir.value());
            return super.visitAssign(ir);
        }

        @Override
        public Void visitEcho(ShellIr.Echo ir) {
            requireWord(ir.value());
            return super.visitEcho(ir);
        }

        @Override
        public Void visitCase(ShellIr.Case ir) {
            requireWord(ir.scrutinee());
            return super.visitCase(ir);
        }

        @Override
        public Void visitCall(ShellIr.Call ir) {
            String refusal = CommandPolicy.refusal(ir.program(), ir.arguments());
            if (refusal != null) {
                throw unsafe("Refused command: " + refusal + ".");
            }
            ir.arguments().forEach(IrValidator::requireWord);
            return super.visitCall(ir);
        }

        @Override
        public Void visitExit(ShellIr.Exit ir) {
            requireWord(ir.code());
            return super.visitExit(ir);
        }

        @Override
        public Void visitFor(ShellIr.For ir) {
            requireName(ir.variable(), "loop variable");
            requireWord(ir.first());
            requireWord(ir.last());
            loops++;
            super.visitFor(ir);
            loops--;
            return null;
        }

        @Override
        public Void visitForEach(ShellIr.ForEach ir) {
            requireName(ir.variable(), "loop variable");
            ir.items().forEach(IrValidator::requireWord);
            loops++;
            super.visitForEach(ir);
            loops--;
            return null;
        }

        @Override
        public Void visitWhile(ShellIr.While ir) {
            loops++;
            super.visitWhile(ir);
            loops--;
            return null;
        }

        @Override
        public Void visitBreak(ShellIr.Break ir) {
            if (loops == 0) throw unsafe("'break' outside a loop.");
            return null;
        }

        @Override
        public Void visitContinue(ShellIr.Continue ir) {
            if (loops == 0) throw unsafe("'continue' outside a loop.");
            return null;
        }

        @Override
        public Void visitVariableRef(ShellValue.VariableRef value) {
            requireName(value.name(), "variable");
            return null;
        }

        @Override
        public Void visitConcat(ShellValue.Concat value) {
            value.parts().forEach(IrValidator::requireWord);
            return super.visitConcat(value);
        }

        @Override
        public Void visitEnvVar(ShellValue.EnvVar value) {
            if (!ShellValue.NAME_PATTERN.matcher(value.name()).matches()) {
                throw unsafe("Invalid environment variable name '" + value.name() + "'.");
            }
            value.defaultValue().ifPresent(IrValidator::requireWord);
            return super.visitEnvVar(value);
        }

        @Override
        public Void visitArithmetic(ShellValue.Arithmetic value) {
            requireOperand(value.lhs());
            requireOperand(value.rhs());
            return super.visitArithmetic(value);
        }

        @Override
        public Void visitComparison(ShellValue.Comparison value) {
            requireWord(value.lhs());
            requireWord(value.rhs());
            return super.visitComparison(value);
        }

        @Override
        public Void visitArg(ShellValue.Arg value) {
            if (value.position() < 1) throw unsafe("Invalid argument position " + value.position() + ".");
            return null;
        }
    }
}
