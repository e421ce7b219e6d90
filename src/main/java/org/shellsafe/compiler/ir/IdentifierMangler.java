package org.shellsafe.compiler.ir;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * The fixed mangling table for names that reach the script. A name that is a POSIX reserved word,
 * a special parameter or a variable the shell itself interprets (optionally followed by
 * underscores) gets one more underscore, so the mapping stays injective.
 * <p>
 * Variables of functions other than {@code main} are prefixed with the function name, because
 * POSIX sh has no local variables.
 */
public final class IdentifierMangler {

	private static final Set<String> RESERVED_WORDS = Set.of(
			"if", "then", "else", "elif", "fi", "do", "done", "case", "esac", "while", "until", "for", "in",
			"function", "select", "time", "coproc");

	private static final Set<String> SHELL_VARIABLES = Set.of(
			"IFS", "PATH", "HOME", "ENV", "CDPATH", "PS1", "PS2", "PS4", "PWD", "OLDPWD", "OPTIND", "OPTARG",
			"LINENO", "PPID", "SHELL", "LANG", "LC_ALL", "LC_CTYPE", "LC_COLLATE", "LC_MESSAGES", "LC_NUMERIC",
			"NLSPATH", "MAIL", "MAILCHECK", "MAILPATH", "HISTFILE", "FCEDIT", "TERM", "TMPDIR", "POSIXLY_CORRECT");

	private static final Pattern TRAILING_UNDERSCORES = Pattern.compile("_+$");

	private static final String MAIN = "main";

	/** Prefix of runtime helpers and compiler temporaries. */
	public static final String RUNTIME_PREFIX = "rash_";

	private IdentifierMangler() {}

	/**
	 * Mangles a function name.
	 * @param name The source-level name.
	 * @return The name used in the script.
	 */
	public static String function(String name) {
		return isReserved(name) ? name + "_" : name;
	}

	/**
	 * Mangles a variable name in the context of its function.
	 * @param function The source-level name of the enclosing function.
	 * @param name The source-level variable name.
	 * @return The name used in the script.
	 */
	public static String variable(String function, String name) {
		String mangled = isReserved(name) || name.contains("__") ? name + "_" : name;
		return MAIN.equals(function) ? mangled : function + "__" + mangled;
	}

	/**
	 * Names a compiler temporary. User variables starting with {@link #RUNTIME_PREFIX} are
	 * mangled, so a temporary never collides with one.
	 * @param function The source-level name of the enclosing function.
	 * @param index The per-function sequence number.
	 * @return The name used in the script.
	 */
	public static String temporary(String function, int index) {
		String name = RUNTIME_PREFIX + "b" + index;
		return MAIN.equals(function) ? name : function + "__" + name;
	}

	/**
	 * Names an inner binding that shadows a binding of an enclosing block.
	 * Mangled user names that contain {@code __} always end with {@code _}; this one ends with a digit.
	 * @param scriptName The mangled name of the shadowed binding.
	 * @param index The per-function sequence number.
	 * @return The name used in the script.
	 */
	public static String shadow(String scriptName, int index) {
		return scriptName + "__s" + index;
	}

	/**
	 * @param name A candidate script name.
	 * @return {@code true} if the name must never be emitted as is.
	 */
	public static boolean isReserved(String name) {
		String base = TRAILING_UNDERSCORES.matcher(name).replaceAll("");
		if (base.isEmpty()) {
			return true;
		}
		return RESERVED_WORDS.contains(base) || SHELL_VARIABLES.contains(base) || base.startsWith(RUNTIME_PREFIX);
	}

	/**
	 * @param name A name as it appears in the script.
	 * @return {@code true} if the mangler could have produced it.
	 */
	public static boolean isSafeScriptName(String name) {
		return ShellValue.NAME_PATTERN.matcher(name).matches() && !isReservedExact(name);
	}

	private static boolean isReservedExact(String name) {
		return RESERVED_WORDS.contains(name) || SHELL_VARIABLES.contains(name);
	}
}
