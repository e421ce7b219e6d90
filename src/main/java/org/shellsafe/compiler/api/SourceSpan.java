package org.shellsafe.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the source the position belongs to.
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 * @param length The number of characters covered, at least 1 for real positions.
 */
public record SourceSpan(String fileName, int line, int column, int length) {

    /** Span used for diagnostics that are not tied to a source position. */
    public static final SourceSpan UNKNOWN = new SourceSpan("<unknown>", 0, 0, 0);

    /**
     * Creates a span at the beginning of the given source.
     * @param fileName The logical source name.
     * @return A span at line 1, column 1.
     */
    public static SourceSpan startOf(String fileName) {
        return new SourceSpan(fileName, 1, 1, 0);
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
