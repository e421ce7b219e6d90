package org.shellsafe.compiler.ir;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Shell functions emitted into a script when the program uses the corresponding stdlib call.
 * Every helper runs its body in a subshell so that it cannot touch the variables of the program.
 * Declaration order is name order, which is the emission order.
 */
public enum RuntimeHelper {
	FS_EXISTS("rash_fs_exists", "[ -e \"${1}\" ]"),
	FS_IS_DIR("rash_fs_is_dir", "[ -d \"${1}\" ]"),
	FS_IS_FILE("rash_fs_is_file", "[ -f \"${1}\" ]"),
	STRING_CONTAINS("rash_string_contains",
			"case \"${1}\" in",
			"    *\"${2}\"*) exit 0 ;;",
			"esac",
			"exit 1"),
	STRING_ENDS_WITH("rash_string_ends_with",
			"case \"${1}\" in",
			"    *\"${2}\") exit 0 ;;",
			"esac",
			"exit 1"),
	STRING_LEN("rash_string_len", "printf '%s\\n' \"${#1}\""),
	STRING_STARTS_WITH("rash_string_starts_with",
			"case \"${1}\" in",
			"    \"${2}\"*) exit 0 ;;",
			"esac",
			"exit 1"),
	STRING_TO_LOWER("rash_string_to_lower", "printf '%s\\n' \"${1}\" | tr '[:upper:]' '[:lower:]'"),
	STRING_TO_UPPER("rash_string_to_upper", "printf '%s\\n' \"${1}\" | tr '[:lower:]' '[:upper:]'"),
	STRING_TRIM("rash_string_trim",
			"s=\"${1}\"",
			"s=\"${s#\"${s%%[![:space:]]*}\"}\"",
			"s=\"${s%\"${s##*[![:space:]]}\"}\"",
			"printf '%s\\n' \"${s}\"");

	private final String functionName;
	private final List<String> body;

	RuntimeHelper(String functionName, String... body) {
		this.functionName = functionName;
		this.body = List.of(body);
	}

	/**
	 * @param functionName A command word.
	 * @return The helper with that function name, if any.
	 */
	public static Optional<RuntimeHelper> byFunctionName(String functionName) {
		return Arrays.stream(values()).filter(h -> h.functionName.equals(functionName)).findFirst();
	}

	public String functionName() {
		return functionName;
	}

	/**
	 * @return The lines of the subshell body, without indentation.
	 */
	public List<String> body() {
		return body;
	}
}
