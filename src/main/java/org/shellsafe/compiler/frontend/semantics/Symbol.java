package org.shellsafe.compiler.frontend.semantics;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * Represents a single variable binding in the symbol table.
 * Usage is tracked so that unused bindings can be reported when their scope is left.
 */
public final class Symbol {

    /**
     * The kind of a binding.
     */
    public enum Kind {
        /** A {@code let} binding. */
        LOCAL,
        /** A function parameter. */
        PARAMETER,
        /** The variable of a {@code for} loop. */
        LOOP_VARIABLE
    }

    private final String name;
    private final Kind kind;
    private final boolean mutable;
    private final SourceSpan span;
    private boolean used;

    /**
     * @param name The variable name as written in the source.
     * @param kind The kind of the binding.
     * @param mutable Whether the binding was declared {@code mut}.
     * @param span Where the binding was declared.
     */
    public Symbol(String name, Kind kind, boolean mutable, SourceSpan span) {
        this.name = name;
        this.kind = kind;
        this.mutable = mutable;
        this.span = span;
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public boolean mutable() {
        return mutable;
    }

    public SourceSpan span() {
        return span;
    }

    public boolean isUsed() {
        return used;
    }

    void markUsed() {
        this.used = true;
    }
}
