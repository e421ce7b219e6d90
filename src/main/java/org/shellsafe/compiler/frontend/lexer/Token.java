package org.shellsafe.compiler.frontend.lexer;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, integer).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token ({@link Long} for integers, the unescaped
 *              {@link String} for string literals), or {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical source name.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return The source span covered by this token.
     */
    public SourceSpan span() {
        return new SourceSpan(fileName, line, column, Math.max(1, text.length()));
    }
}
