package org.shellsafe.compiler.api;

/**
 * The coarse error taxonomy of the compiler. Every {@link CompilerErrorCode} belongs to exactly one kind.
 */
public enum ErrorKind {
    /** Malformed input text. */
    PARSE_ERROR,
    /** Valid syntax outside of the accepted language subset. */
    UNSUPPORTED_FEATURE,
    /** Name, arity or flow problems found after parsing. */
    SEMANTIC_ERROR,
    /** A violation detected while building the IR, or a missing lowering rule. */
    LOWERING_ERROR,
    /** An IR node the emitter cannot render. Unreachable on valid IR. */
    EMISSION_ERROR,
    /** A safety, determinism or POSIX grammar violation. */
    VALIDATION_FAILURE,
    /** Reading the source or writing the artifact failed. */
    IO_ERROR
}
