package org.shellsafe.compiler.frontend.semantics;

import org.shellsafe.compiler.frontend.parser.ast.SourceType;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The allow-listed standard library. Every call that does not target a user function must name
 * one of these entries.
 */
public enum StdlibFunction {
    ENV("env", 1, 1, SourceType.STRING),
    ENV_VAR_OR("env_var_or", 2, 2, SourceType.STRING),
    ARG("arg", 1, 1, SourceType.STRING),
    ARG_COUNT("arg_count", 0, 0, SourceType.INTEGER),
    RUN("run", 1, -1, SourceType.UNIT),
    CAPTURE("capture", 1, -1, SourceType.STRING),
    EXIT("exit", 1, 1, SourceType.UNIT),

    STRING_LEN("string_len", 1, 1, SourceType.INTEGER),
    STRING_TRIM("string_trim", 1, 1, SourceType.STRING),
    STRING_TO_UPPER("string_to_upper", 1, 1, SourceType.STRING),
    STRING_TO_LOWER("string_to_lower", 1, 1, SourceType.STRING),
    STRING_CONTAINS("string_contains", 2, 2, SourceType.BOOLEAN),
    STRING_STARTS_WITH("string_starts_with", 2, 2, SourceType.BOOLEAN),
    STRING_ENDS_WITH("string_ends_with", 2, 2, SourceType.BOOLEAN),

    FS_EXISTS("fs_exists", 1, 1, SourceType.BOOLEAN),
    FS_IS_DIR("fs_is_dir", 1, 1, SourceType.BOOLEAN),
    FS_IS_FILE("fs_is_file", 1, 1, SourceType.BOOLEAN),
    FS_MKDIR("fs_mkdir", 1, 1, SourceType.UNIT),
    FS_REMOVE("fs_remove", 1, 1, SourceType.UNIT),
    FS_COPY("fs_copy", 2, 2, SourceType.UNIT),
    FS_SYMLINK("fs_symlink", 2, 2, SourceType.UNIT),

    ARRAY_LEN("array_len", 1, 1, SourceType.INTEGER),
    ARRAY_JOIN("array_join", 2, 2, SourceType.STRING);

    private static final Map<String, StdlibFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(StdlibFunction::sourceName, Function.identity()));

    private final String sourceName;
    private final int minArity;
    private final int maxArity;
    private final SourceType resultType;

    StdlibFunction(String sourceName, int minArity, int maxArity, SourceType resultType) {
        this.sourceName = sourceName;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.resultType = resultType;
    }

    /**
     * Looks up a stdlib entry by its source-level name.
     * @param name The called name.
     * @return The entry, or empty if the name is not allow-listed.
     */
    public static Optional<StdlibFunction> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String sourceName() {
        return sourceName;
    }

    public SourceType resultType() {
        return resultType;
    }

    /**
     * @param count The number of arguments at a call site.
     * @return {@code true} if the count is accepted.
     */
    public boolean acceptsArity(int count) {
        return count >= minArity && (maxArity < 0 || count <= maxArity);
    }

    /**
     * @return A human readable arity, e.g. {@code "2"} or {@code "at least 1"}.
     */
    public String arityDescription() {
        if (maxArity < 0) return "at least " + minArity;
        return String.valueOf(minArity);
    }
}
