package org.shellsafe.compiler.frontend.lexer;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Whitespace and comments ({@code //} line comments and nestable block comments) are dropped.
 * Lexical errors are reported to the diagnostics engine and scanning continues with the next
 * character, so one run reports every lexical problem up to the diagnostics bound.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the source, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd() && !diagnostics.limitReached()) {
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '#': addToken(TokenType.HASH); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '@': addToken(TokenType.AT); break;
            case ':': addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON); break;
            case '.':
                if (match('.')) {
                    addToken(match('=') ? TokenType.DOT_DOT_EQ : TokenType.DOT_DOT);
                } else {
                    addToken(TokenType.DOT);
                }
                break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '*': addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '^': addToken(match('=') ? TokenType.CARET_EQUAL : TokenType.CARET); break;
            case '-':
                if (match('>')) {
                    addToken(TokenType.ARROW);
                } else {
                    addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
                }
                break;
            case '=':
                if (match('>')) {
                    addToken(TokenType.FAT_ARROW);
                } else {
                    addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '&':
                if (match('&')) {
                    addToken(TokenType.AND_AND);
                } else {
                    addToken(match('=') ? TokenType.AMPERSAND_EQUAL : TokenType.AMPERSAND);
                }
                break;
            case '|':
                if (match('|')) {
                    addToken(TokenType.OR_OR);
                } else {
                    addToken(match('=') ? TokenType.PIPE_EQUAL : TokenType.PIPE);
                }
                break;
            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.SHL_EQUAL : TokenType.SHL);
                } else {
                    addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                }
                break;
            case '>':
                // '>>' is only an operator when not closing nested generics, which the parser rejects anyway
                if (match('>')) {
                    addToken(match('=') ? TokenType.SHR_EQUAL : TokenType.SHR);
                } else {
                    addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                }
                break;
            case '/':
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case '"': string(); break;
            case '\'': charLiteral(); break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            default:
                if (c == 'r' && (peek() == '"' || (peek() == '#' && peekNext() == '"'))) {
                    rawString();
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: '" + c + "'");
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(TokenType.keywordOrIdentifier(text));
    }

    private void number() {
        int radix = 10;
        if (previous() == '0' && (peek() == 'x' || peek() == 'o' || peek() == 'b')) {
            char prefix = advance();
            radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
        }
        while (isAlphaNumeric(peek())) advance();

        if (radix == 10 && peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isAlphaNumeric(peek())) advance();
            error(CompilerErrorCode.UNSUPPORTED_CONSTRUCT, "Floating-point literals are not supported: " + source.substring(start, current));
            return;
        }

        String text = source.substring(start, current);
        String digits = stripIntegerSuffix(radix == 10 ? text : text.substring(2)).replace("_", "");
        try {
            if (digits.isEmpty()) throw new NumberFormatException("empty");
            addToken(TokenType.INTEGER, Long.parseLong(digits, radix));
        } catch (NumberFormatException e) {
            if (isMinimumMagnitude(digits, radix)) {
                // 2^63 is only valid after a unary minus; the parser enforces that
                addToken(TokenType.INTEGER, Long.MIN_VALUE);
            } else {
                error(CompilerErrorCode.INVALID_NUMBER, "Invalid integer literal: " + text);
            }
        }
    }

    private static boolean isMinimumMagnitude(String digits, int radix) {
        try {
            return Long.parseUnsignedLong(digits, radix) == Long.MIN_VALUE;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String stripIntegerSuffix(String text) {
        String[] suffixes = {"usize", "isize", "u128", "i128", "u64", "i64", "u32", "i32", "u16", "i16", "u8", "i8"};
        for (String suffix : suffixes) {
            if (text.endsWith(suffix)) {
                return text.substring(0, text.length() - suffix.length());
            }
        }
        return text;
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                newLine();
                value.append(c);
            } else if (c == '\\') {
                if (isAtEnd()) break;
                char escaped = advance();
                switch (escaped) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case 'r': value.append('\r'); break;
                    case '0': value.append('\0'); break;
                    case '\\': value.append('\\'); break;
                    case '"': value.append('"'); break;
                    case '\'': value.append('\''); break;
                    case '\n':
                        // Line continuation: skip the newline and leading whitespace of the next line
                        newLine();
                        while (peek() == ' ' || peek() == '\t') advance();
                        break;
                    default:
                        error(CompilerErrorCode.INVALID_ESCAPE, "Unknown escape sequence: \\" + escaped);
                        break;
                }
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string.");
            return;
        }

        // The closing "
        advance();
        addStringToken(value.toString());
    }

    private void rawString() {
        int hashes = 0;
        while (match('#')) hashes++;
        advance(); // opening "
        int contentStart = current;
        while (!isAtEnd()) {
            if (peek() == '"' && closesRawString(hashes)) {
                String value = source.substring(contentStart, current);
                current += 1 + hashes;
                addStringToken(value);
                return;
            }
            if (advance() == '\n') newLine();
        }
        error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated raw string.");
    }

    private void addStringToken(String value) {
        if (value.indexOf('\0') >= 0) {
            error(CompilerErrorCode.NUL_IN_STRING, "String literals cannot contain NUL characters.");
        }
        addToken(TokenType.STRING, value);
    }

    private boolean closesRawString(int hashes) {
        for (int i = 1; i <= hashes; i++) {
            if (current + i >= source.length() || source.charAt(current + i) != '#') return false;
        }
        return true;
    }

    private void charLiteral() {
        // Only 'x' and '\x' forms; lifetimes ('a without a closing quote) are reported as unexpected
        if (peek() == '\\' && peekNext() != '\0') {
            advance();
            advance();
        } else if (!isAtEnd()) {
            advance();
        }
        if (match('\'')) {
            addToken(TokenType.CHAR, source.substring(start + 1, current - 1));
        } else {
            error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: '\\''");
        }
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                newLine();
            } else if (c == '/' && match('*')) {
                depth++;
            } else if (c == '*' && match('/')) {
                depth--;
            }
        }
        if (depth > 0) {
            error(CompilerErrorCode.UNEXPECTED_TOKEN, "Unterminated block comment.");
        }
    }

    private void error(CompilerErrorCode code, String message) {
        diagnostics.reportError(code, message, new SourceSpan(logicalFileName, tokenLine, tokenColumn, Math.max(1, current - start)));
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, logicalFileName));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
