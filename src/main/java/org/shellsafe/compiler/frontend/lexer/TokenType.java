package org.shellsafe.compiler.frontend.lexer;

import java.util.Map;

/**
 * Defines the types of tokens that the {@link Lexer} can produce.
 */
public enum TokenType {
    // Literals and names
    IDENTIFIER, INTEGER, STRING, CHAR,

    // Keywords of the accepted subset
    FN, LET, MUT, IF, ELSE, MATCH, FOR, IN, WHILE, RETURN, BREAK, CONTINUE, TRUE, FALSE,

    // Keywords recognised only to report them as unsupported
    ASYNC, AWAIT, UNSAFE, TRAIT, IMPL, STRUCT, ENUM, MOD, USE, STATIC, CONST, LOOP, PUB, TYPE, WHERE, DYN, AS,
    EXTERN, MOVE, REF, SELF, CRATE, SUPER,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, SEMICOLON, COLON, DOUBLE_COLON, ARROW, FAT_ARROW, DOT, DOT_DOT, DOT_DOT_EQ,
    HASH, QUESTION, AT,

    // Operators
    BANG, PLUS, MINUS, STAR, SLASH, PERCENT, AMPERSAND, PIPE, CARET, SHL, SHR,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, AND_AND, OR_OR,
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL,
    AMPERSAND_EQUAL, PIPE_EQUAL, CARET_EQUAL, SHL_EQUAL, SHR_EQUAL,

    // Control
    END_OF_FILE;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("fn", FN), Map.entry("let", LET), Map.entry("mut", MUT), Map.entry("if", IF),
            Map.entry("else", ELSE), Map.entry("match", MATCH), Map.entry("for", FOR), Map.entry("in", IN),
            Map.entry("while", WHILE), Map.entry("return", RETURN), Map.entry("break", BREAK),
            Map.entry("continue", CONTINUE), Map.entry("true", TRUE), Map.entry("false", FALSE),
            Map.entry("async", ASYNC), Map.entry("await", AWAIT), Map.entry("unsafe", UNSAFE),
            Map.entry("trait", TRAIT), Map.entry("impl", IMPL), Map.entry("struct", STRUCT), Map.entry("enum", ENUM),
            Map.entry("mod", MOD), Map.entry("use", USE), Map.entry("static", STATIC), Map.entry("const", CONST),
            Map.entry("loop", LOOP), Map.entry("pub", PUB), Map.entry("type", TYPE), Map.entry("where", WHERE),
            Map.entry("dyn", DYN), Map.entry("as", AS), Map.entry("extern", EXTERN), Map.entry("move", MOVE),
            Map.entry("ref", REF), Map.entry("self", SELF), Map.entry("crate", CRATE), Map.entry("super", SUPER)
    );

    /**
     * Looks up the keyword type of an identifier-shaped word.
     * @param word The word as written in the source.
     * @return The keyword type, or {@link #IDENTIFIER} if the word is not a keyword.
     */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }
}
