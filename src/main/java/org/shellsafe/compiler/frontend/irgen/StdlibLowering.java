package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.parser.ast.CallExpr;
import org.shellsafe.compiler.frontend.parser.ast.ExprNode;
import org.shellsafe.compiler.frontend.parser.ast.IntLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.StringLiteralExpr;
import org.shellsafe.compiler.frontend.semantics.SemanticAnalyzer;
import org.shellsafe.compiler.frontend.semantics.StdlibFunction;
import org.shellsafe.compiler.ir.CommandPolicy;
import org.shellsafe.compiler.ir.RuntimeHelper;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers calls of the allow-listed standard library. File system operations use the idempotent
 * flag of their command and end option parsing with {@code --}, so a path can never become an option.
 */
final class StdlibLowering {

	private static final ShellValue NO_VALUE = new ShellValue.Literal("");

	private final IrGenContext ctx;
	private final ExpressionLowering expressions;

	StdlibLowering(IrGenContext ctx, ExpressionLowering expressions) {
		this.ctx = ctx;
		this.expressions = expressions;
	}

	TypedValue lower(StdlibFunction function, CallExpr call) {
		List<ExprNode> args = call.arguments();
		switch (function) {
			case ENV:
				return new TypedValue(envVar(args.get(0), Optional.empty()), SourceType.STRING);
			case ENV_VAR_OR:
				return new TypedValue(envVar(args.get(0), Optional.of(expressions.word(args.get(1)))), SourceType.STRING);
			case ARG:
				requireMain(call);
				return new TypedValue(new ShellValue.Arg(position(args.get(0))), SourceType.STRING);
			case ARG_COUNT:
				requireMain(call);
				return new TypedValue(new ShellValue.ArgCount(), SourceType.INTEGER);
			case RUN:
				ctx.emit(command(call));
				return unit();
			case CAPTURE:
				return new TypedValue(new ShellValue.CommandSubst(command(call)), SourceType.STRING);
			case EXIT:
				ctx.emit(new ShellIr.Exit(expressions.integer(args.get(0))));
				return unit();
			case STRING_LEN:
				return helperValue(RuntimeHelper.STRING_LEN, args, SourceType.INTEGER);
			case STRING_TRIM:
				return helperValue(RuntimeHelper.STRING_TRIM, args, SourceType.STRING);
			case STRING_TO_UPPER:
				return helperValue(RuntimeHelper.STRING_TO_UPPER, args, SourceType.STRING);
			case STRING_TO_LOWER:
				return helperValue(RuntimeHelper.STRING_TO_LOWER, args, SourceType.STRING);
			case STRING_CONTAINS:
				return helperPredicate(RuntimeHelper.STRING_CONTAINS, args);
			case STRING_STARTS_WITH:
				return helperPredicate(RuntimeHelper.STRING_STARTS_WITH, args);
			case STRING_ENDS_WITH:
				return helperPredicate(RuntimeHelper.STRING_ENDS_WITH, args);
			case FS_EXISTS:
				return helperPredicate(RuntimeHelper.FS_EXISTS, args);
			case FS_IS_DIR:
				return helperPredicate(RuntimeHelper.FS_IS_DIR, args);
			case FS_IS_FILE:
				return helperPredicate(RuntimeHelper.FS_IS_FILE, args);
			case FS_MKDIR:
				return fileCommand("mkdir", "-p", args);
			case FS_REMOVE:
				return fileCommand("rm", "-f", args);
			case FS_COPY:
				return fileCommand("cp", "-f", args);
			case FS_SYMLINK:
				return fileCommand("ln", "-sf", args);
			case ARRAY_LEN:
				return new TypedValue(ShellValue.Literal.of(expressions.vector(args.get(0)).elements().size()),
						SourceType.INTEGER);
			case ARRAY_JOIN:
				return join(args);
			default:
				throw new LoweringException(CompilerErrorCode.MISSING_LOWERING_RULE,
						"No lowering rule for '" + function.sourceName() + "'.", call.span());
		}
	}

	private ShellValue envVar(ExprNode nameArgument, Optional<ShellValue> defaultValue) {
		if (!(nameArgument instanceof StringLiteralExpr literal)) {
			throw new LoweringException(CompilerErrorCode.LITERAL_REQUIRED,
					"The environment variable name must be a string literal.", nameArgument.span());
		}
		String name = literal.value();
		if (!ShellValue.NAME_PATTERN.matcher(name).matches()) {
			throw new LoweringException(CompilerErrorCode.INVALID_ENV_VAR_NAME,
					"Invalid environment variable name '" + name + "'.", nameArgument.span(),
					"use a name made of letters, digits and underscores that does not start with a digit");
		}
		return new ShellValue.EnvVar(name, defaultValue);
	}

	private int position(ExprNode argument) {
		if (!(argument instanceof IntLiteralExpr literal) || literal.value() < 1 || literal.value() > Integer.MAX_VALUE) {
			throw new LoweringException(CompilerErrorCode.LITERAL_REQUIRED,
					"Argument positions must be integer literals starting at 1.", argument.span(), "use arg(1)");
		}
		return (int) literal.value();
	}

	private void requireMain(CallExpr call) {
		if (!SemanticAnalyzer.ENTRY_POINT.equals(ctx.currentFunction().name())) {
			throw new LoweringException(CompilerErrorCode.ARGUMENT_ACCESS_OUTSIDE_MAIN,
					"'" + call.callee() + "' is only available in main.", call.span(),
					"read the argument in main and pass it as a parameter");
		}
	}

	private ShellIr.Call command(CallExpr call) {
		ExprNode programArgument = call.arguments().get(0);
		if (!(programArgument instanceof StringLiteralExpr program)) {
			throw new LoweringException(CompilerErrorCode.LITERAL_REQUIRED,
					"The program of '" + call.callee() + "' must be a string literal.", programArgument.span());
		}
		List<ShellValue> arguments = new ArrayList<>();
		for (ExprNode argument : call.arguments().subList(1, call.arguments().size())) {
			arguments.add(expressions.word(argument));
		}
		String refusal = CommandPolicy.refusal(program.value(), arguments);
		if (refusal != null || CommandPolicy.DISCARD.equals(program.value())) {
			throw new LoweringException(CompilerErrorCode.UNSAFE_COMMAND,
					"Refusing to run '" + program.value() + "': " + (refusal != null ? refusal : "not a program") + ".",
					programArgument.span(), "use the stdlib function for this task, or a fixed program with arguments");
		}
		return new ShellIr.Call(program.value(), arguments);
	}

	private TypedValue helperValue(RuntimeHelper helper, List<ExprNode> args, SourceType resultType) {
		return new TypedValue(new ShellValue.CommandSubst(helperCall(helper, args)), resultType);
	}

	private TypedValue helperPredicate(RuntimeHelper helper, List<ExprNode> args) {
		return new TypedValue(new ShellValue.Predicate(helperCall(helper, args)), SourceType.BOOLEAN);
	}

	private ShellIr.Call helperCall(RuntimeHelper helper, List<ExprNode> args) {
		List<ShellValue> arguments = new ArrayList<>();
		for (ExprNode argument : args) {
			arguments.add(expressions.word(argument));
		}
		return new ShellIr.Call(helper.functionName(), arguments);
	}

	private TypedValue fileCommand(String program, String flag, List<ExprNode> args) {
		List<ShellValue> arguments = new ArrayList<>();
		arguments.add(new ShellValue.Literal(flag));
		arguments.add(new ShellValue.Literal("--"));
		for (ExprNode argument : args) {
			arguments.add(expressions.word(argument));
		}
		ctx.emit(new ShellIr.Call(program, arguments));
		return unit();
	}

	private TypedValue join(List<ExprNode> args) {
		LocalVariable vector = expressions.vector(args.get(0));
		ShellValue separator = expressions.word(args.get(1));
		List<ShellValue> parts = new ArrayList<>();
		for (String element : vector.elements()) {
			if (!parts.isEmpty()) {
				parts.add(separator);
			}
			parts.add(new ShellValue.VariableRef(element));
		}
		return new TypedValue(new ShellValue.Concat(parts), SourceType.STRING);
	}

	private static TypedValue unit() {
		return new TypedValue(NO_VALUE, SourceType.UNIT);
	}
}
