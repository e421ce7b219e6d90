package org.shellsafe.compiler.ir;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which command words a {@link ShellIr.Call} may name. Lowering refuses unsafe commands
 * with a diagnostic and the IR validator checks the same rules again before emission.
 */
public final class CommandPolicy {

	private static final Pattern SAFE_WORD = Pattern.compile("^[A-Za-z0-9_./+][A-Za-z0-9_./+-]*$");

	/** Commands that evaluate their arguments as code or run another command line. */
	private static final Set<String> EVALUATING_COMMANDS = Set.of(
			"eval", "exec", "source", ".", "trap", "command", "builtin", "env", "xargs", "nohup", "timeout",
			"nice", "time", "sudo", "su", "doas", "find", "awk", "perl", "python", "python3", "ruby", "node");

	/** Shells; refused when given {@code -c} or any argument that is not a constant. */
	private static final Set<String> SHELLS = Set.of("sh", "bash", "dash", "ash", "ksh", "mksh", "zsh", "busybox");

	/** The no-op builtin used to evaluate and discard a value. */
	public static final String DISCARD = ":";

	private CommandPolicy() {}

	/**
	 * @param program A command word.
	 * @return {@code true} if the word can be emitted bare and names no forbidden command.
	 */
	public static boolean isSafeProgram(String program) {
		if (DISCARD.equals(program)) return true;
		if (program == null || !SAFE_WORD.matcher(program).matches()) return false;
		return !EVALUATING_COMMANDS.contains(baseName(program));
	}

	/**
	 * Checks a full command line.
	 * @param program The command word.
	 * @param arguments The arguments.
	 * @return A reason why the command is refused, or {@code null} if it is allowed.
	 */
	public static String refusal(String program, List<ShellValue> arguments) {
		if (program == null || !DISCARD.equals(program) && !SAFE_WORD.matcher(program).matches()) {
			return "'" + program + "' is not a plain command name";
		}
		String base = baseName(program);
		if (EVALUATING_COMMANDS.contains(base)) {
			return "'" + base + "' evaluates its arguments as code";
		}
		if (SHELLS.contains(base)) {
			for (ShellValue argument : arguments) {
				if (!(argument instanceof ShellValue.Literal literal) || literal.text().startsWith("-") && literal.text().contains("c")) {
					return "'" + base + "' may run dynamic code through -c";
				}
			}
		}
		return null;
	}

	private static String baseName(String program) {
		int slash = program.lastIndexOf('/');
		return slash >= 0 ? program.substring(slash + 1) : program;
	}
}
