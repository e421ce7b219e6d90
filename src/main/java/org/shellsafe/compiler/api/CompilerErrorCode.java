package org.shellsafe.compiler.api;

/**
 * Defines unique, testable error codes for all diagnostics that can occur during compilation.
 * This decouples the test logic from the wording of the messages. The plain-language explanation of
 * each code lives in the {@code compiler_messages} resource bundle under {@code <CODE>.explanation}.
 */
public enum CompilerErrorCode {
    // region Lexer & Parser Errors
    /** A character that cannot start any token. */
    UNEXPECTED_CHARACTER("E0001", ErrorKind.PARSE_ERROR),
    /** A string literal without closing quote. */
    UNTERMINATED_STRING("E0002", ErrorKind.PARSE_ERROR),
    /** An unknown escape sequence inside a string literal. */
    INVALID_ESCAPE("E0003", ErrorKind.PARSE_ERROR),
    /** An integer literal that does not fit into 64 bits. */
    INVALID_NUMBER("E0004", ErrorKind.PARSE_ERROR),
    /** A token that does not fit the grammar at this point. */
    UNEXPECTED_TOKEN("E0005", ErrorKind.PARSE_ERROR),
    /** Expressions nested deeper than the parser accepts. */
    NESTING_TOO_DEEP("E0006", ErrorKind.PARSE_ERROR),
    /** A format string whose placeholders do not match its arguments. */
    INVALID_FORMAT_STRING("E0007", ErrorKind.PARSE_ERROR),
    /** The diagnostic limit was reached and parsing stopped. */
    TOO_MANY_ERRORS("E0008", ErrorKind.PARSE_ERROR),
    // endregion

    // region Unsupported Features
    /** A language construct outside of the accepted subset. */
    UNSUPPORTED_CONSTRUCT("U0001", ErrorKind.UNSUPPORTED_FEATURE),
    /** A macro that is not on the allow-list. */
    UNSUPPORTED_MACRO("U0002", ErrorKind.UNSUPPORTED_FEATURE),
    /** A type outside of the supported scalar types. */
    UNSUPPORTED_TYPE("U0003", ErrorKind.UNSUPPORTED_FEATURE),
    /** Direct or mutual recursion. */
    RECURSION_NOT_SUPPORTED("U0004", ErrorKind.UNSUPPORTED_FEATURE),
    /** A string literal containing a NUL character. */
    NUL_IN_STRING("U0005", ErrorKind.UNSUPPORTED_FEATURE),
    // endregion

    // region Semantic Analysis Errors
    /** The program has no parameterless {@code main} function. */
    MISSING_MAIN("S0001", ErrorKind.SEMANTIC_ERROR),
    /** Two functions share a name. */
    DUPLICATE_FUNCTION("S0002", ErrorKind.SEMANTIC_ERROR),
    /** Two parameters of one function share a name. */
    DUPLICATE_PARAMETER("S0003", ErrorKind.SEMANTIC_ERROR),
    /** A call to a function that is neither user-defined nor allow-listed. */
    UNKNOWN_FUNCTION("S0004", ErrorKind.SEMANTIC_ERROR),
    /** A call with the wrong number of arguments. */
    ARITY_MISMATCH("S0005", ErrorKind.SEMANTIC_ERROR),
    /** A function name that collides with a shell builtin or the runtime prefix. */
    RESERVED_FUNCTION_NAME("S0006", ErrorKind.SEMANTIC_ERROR),
    /** A variable used before it was declared. */
    UNDEFINED_VARIABLE("S0007", ErrorKind.SEMANTIC_ERROR),
    /** Assignment to a binding that was not declared {@code mut}. */
    IMMUTABLE_ASSIGNMENT("S0008", ErrorKind.SEMANTIC_ERROR),
    /** {@code break} or {@code continue} outside of a loop. */
    LOOP_CONTROL_OUTSIDE_LOOP("S0009", ErrorKind.SEMANTIC_ERROR),
    /** A {@code let} binding that is never read. */
    UNUSED_VARIABLE("W0001", ErrorKind.SEMANTIC_ERROR),
    /** A statement that can never execute. */
    UNREACHABLE_CODE("W0002", ErrorKind.SEMANTIC_ERROR),
    /** A function that is never called from {@code main}. */
    UNUSED_FUNCTION("W0003", ErrorKind.SEMANTIC_ERROR),
    // endregion

    // region Lowering Errors
    /** An environment variable name that is not a valid shell identifier. */
    INVALID_ENV_VAR_NAME("L0001", ErrorKind.LOWERING_ERROR),
    /** A string-valued operand in an arithmetic expression. */
    NON_NUMERIC_OPERAND("L0002", ErrorKind.LOWERING_ERROR),
    /** An argument that must be a compile-time literal is not. */
    LITERAL_REQUIRED("L0003", ErrorKind.LOWERING_ERROR),
    /** An expression whose value kind does not fit its use. */
    TYPE_MISMATCH("L0004", ErrorKind.LOWERING_ERROR),
    /** Division or remainder by a literal zero. */
    DIVISION_BY_ZERO("L0005", ErrorKind.LOWERING_ERROR),
    /** A literal index outside of a {@code vec!} binding. */
    INDEX_OUT_OF_BOUNDS("L0006", ErrorKind.LOWERING_ERROR),
    /** A command name that is not a plain, safe word. */
    UNSAFE_COMMAND("L0007", ErrorKind.LOWERING_ERROR),
    /** {@code arg()} or {@code arg_count()} used outside of {@code main}. */
    ARGUMENT_ACCESS_OUTSIDE_MAIN("L0008", ErrorKind.LOWERING_ERROR),
    /** An accepted AST node without a lowering rule. */
    MISSING_LOWERING_RULE("L0099", ErrorKind.LOWERING_ERROR),
    // endregion

    // region Emission Errors
    /** An IR node without an emission rule. */
    MISSING_EMISSION_RULE("M0001", ErrorKind.EMISSION_ERROR),
    // endregion

    // region Validation Failures
    /** An IR shape the validator refuses. */
    UNSAFE_IR("V0001", ErrorKind.VALIDATION_FAILURE),
    /** Emitted text that does not parse as POSIX sh. */
    POSIX_GRAMMAR_VIOLATION("V0002", ErrorKind.VALIDATION_FAILURE),
    /** Emitted text containing a non-POSIX construct. */
    NON_POSIX_CONSTRUCT("V0003", ErrorKind.VALIDATION_FAILURE),
    /** Two compilations of the same input produced different output. */
    NON_DETERMINISTIC_OUTPUT("V0004", ErrorKind.VALIDATION_FAILURE),
    /** The external analyzer reported findings at or above the threshold. */
    ANALYZER_FINDINGS("V0005", ErrorKind.VALIDATION_FAILURE),
    /** The external analyzer timed out, could not start, or failed. */
    ANALYZER_FAILED("V0006", ErrorKind.VALIDATION_FAILURE),
    /** A warning turned fatal by strict mode. */
    STRICT_MODE_WARNING("V0007", ErrorKind.VALIDATION_FAILURE),
    // endregion

    // region General Errors
    /** An I/O error occurred while reading the source or writing the artifact. */
    IO_ERROR("I0001", ErrorKind.IO_ERROR);
    // endregion

    private final String id;
    private final ErrorKind kind;

    CompilerErrorCode(String id, ErrorKind kind) {
        this.id = id;
        this.kind = kind;
    }

    /**
     * @return The short, stable identifier shown to users (e.g. {@code L0001}).
     */
    public String id() {
        return id;
    }

    /**
     * @return The error kind this code belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }
}
