package org.shellsafe.compiler.frontend.parser.ast;

/**
 * The value types of the accepted subset. All integer widths collapse to {@link #INTEGER};
 * {@code &str} and {@code String} collapse to {@link #STRING}.
 */
public enum SourceType {
    INTEGER,
    STRING,
    BOOLEAN,
    /** {@code Vec<T>}; only valid as the annotation of a {@code let} bound to {@code vec!}. */
    VECTOR,
    UNIT
}
