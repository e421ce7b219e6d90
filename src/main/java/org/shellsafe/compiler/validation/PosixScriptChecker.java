package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text-level check of an emitted script against the POSIX shell grammar subset the emitter uses.
 * <p>
 * The scan tracks quoting, command and parameter substitutions, arithmetic expansions and the
 * compound command keywords. It rejects unbalanced constructs and every construct that only
 * bash or other extended shells understand. Quoted text is masked before the non-POSIX patterns
 * are matched, so string contents can never trigger a finding.
 */
public class PosixScriptChecker {

    /** Span file name of findings in generated text. */
    public static final String OUTPUT_NAME = "<output>";

    private static final Set<String> NON_POSIX_COMMANDS = Set.of(
            "function", "local", "declare", "typeset", "source", "let", "select", "shopt",
            "[[", "pushd", "popd", "mapfile", "readarray");

    private record NonPosixPattern(Pattern pattern, String description) {}

    private static final List<NonPosixPattern> PATTERNS = List.of(
            new NonPosixPattern(Pattern.compile("\\[\\["), "'[[' conditional"),
            new NonPosixPattern(Pattern.compile("\\$'"), "ANSI-C quoting"),
            new NonPosixPattern(Pattern.compile("<<<"), "here-string"),
            new NonPosixPattern(Pattern.compile("&>|\\|&"), "combined output redirection"),
            new NonPosixPattern(Pattern.compile("[<>]\\("), "process substitution"),
            new NonPosixPattern(Pattern.compile("=\\("), "array assignment"),
            new NonPosixPattern(Pattern.compile("(^|[^$])\\(\\("), "arithmetic command"),
            new NonPosixPattern(Pattern.compile("\\[ [^\\]]*=="), "'==' in test"));

    /**
     * Checks a script.
     * @param script The complete emitted text.
     * @throws ValidationException at the first violation.
     */
    public void check(String script) {
        String code = new Scanner(script).scan();
        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            for (NonPosixPattern candidate : PATTERNS) {
                if (candidate.pattern().matcher(lines[i]).find()) {
                    throw nonPosix(i + 1, candidate.description());
                }
            }
        }
    }

    private static ValidationException grammar(int line, String message) {
        return new ValidationException(CompilerErrorCode.POSIX_GRAMMAR_VIOLATION,
                "Generated script line " + line + ": " + message + ".", new SourceSpan(OUTPUT_NAME, line, 1, 1), null);
    }

    private static ValidationException nonPosix(int line, String construct) {
        return new ValidationException(CompilerErrorCode.NON_POSIX_CONSTRUCT,
                "Generated script line " + line + " uses a non-POSIX construct: " + construct + ".",
                new SourceSpan(OUTPUT_NAME, line, 1, 1), null);
    }

    /**
     * Single pass over the script. Produces a copy of the text in which all quoted and
     * arithmetic content is replaced by {@code x}, with line breaks preserved.
     */
    private static final class Scanner {

        private enum Mode { SUBSTITUTION, DOUBLE_QUOTE, PARAMETER, ARITHMETIC }

        private static final class Frame {
            final Mode mode;
            final int line;
            final boolean quoted;
            int depth;

            Frame(Mode mode, int line, boolean quoted) {
                this.mode = mode;
                this.line = line;
                this.quoted = quoted;
            }
        }

        private record Compound(String closer, int line) {}

        private final String text;
        private final StringBuilder code;
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Deque<Compound> compounds = new ArrayDeque<>();
        private final StringBuilder word = new StringBuilder();
        private int pos;
        private int line = 1;
        private boolean wordQuoted;
        private boolean commandPosition = true;
        private boolean echoArguments;

        Scanner(String text) {
            this.text = text;
            this.code = new StringBuilder(text.length());
        }

        String scan() {
            while (pos < text.length()) {
                Frame frame = frames.peek();
                if (frame == null) {
                    topLevel();
                    continue;
                }
                switch (frame.mode) {
                    case SUBSTITUTION:
                        substitution(frame);
                        break;
                    case DOUBLE_QUOTE:
                        doubleQuoted();
                        break;
                    case PARAMETER:
                        parameterWord(frame);
                        break;
                    case ARITHMETIC:
                        arithmetic(frame);
                        break;
                    default:
                        throw new IllegalStateException("Unknown mode " + frame.mode);
                }
            }
            finishWord();
            if (!frames.isEmpty()) {
                Frame open = frames.peek();
                throw grammar(open.line, "unterminated " + describe(open.mode));
            }
            if (!compounds.isEmpty()) {
                Compound open = compounds.peek();
                throw grammar(open.line, "missing '" + open.closer() + "'");
            }
            return code.toString();
        }

        private static String describe(Mode mode) {
            switch (mode) {
                case SUBSTITUTION: return "command substitution";
                case DOUBLE_QUOTE: return "double-quoted string";
                case PARAMETER: return "parameter expansion";
                default: return "arithmetic expansion";
            }
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index < text.length() ? text.charAt(index) : '\0';
        }

        private void keep() {
            char c = text.charAt(pos++);
            code.append(c);
            if (c == '\n') line++;
        }

        private void mask() {
            char c = text.charAt(pos++);
            if (c == '\n') {
                code.append('\n');
                line++;
            } else {
                code.append('x');
            }
        }

        private void push(Mode mode) {
            Frame parent = frames.peek();
            frames.push(new Frame(mode, line, parent != null && parent.mode == Mode.DOUBLE_QUOTE));
        }

        private void topLevel() {
            char c = peek(0);
            switch (c) {
                case '\\':
                    escaped();
                    wordQuoted = true;
                    return;
                case '\'':
                    singleQuoted();
                    wordQuoted = true;
                    return;
                case '"':
                    keep();
                    push(Mode.DOUBLE_QUOTE);
                    wordQuoted = true;
                    return;
                case '$':
                    dollar();
                    wordQuoted = true;
                    return;
                case '`':
                    throw nonPosix(line, "backquote command substitution");
                case '#':
                    if (word.length() == 0 && !wordQuoted) {
                        comment();
                    } else {
                        word.append(c);
                        keep();
                    }
                    return;
                case '\n':
                    finishWord();
                    keep();
                    commandPosition = true;
                    return;
                case ' ':
                case '\t':
                    finishWord();
                    keep();
                    return;
                case ';':
                    finishWord();
                    keep();
                    if (peek(0) == ';') keep();
                    commandPosition = true;
                    return;
                case '&':
                case '|':
                    finishWord();
                    keep();
                    commandPosition = true;
                    return;
                case '<':
                case '>':
                    finishWord();
                    keep();
                    if (peek(0) == '&') keep();
                    return;
                case '(':
                    finishWord();
                    keep();
                    if (peek(0) == ')') {
                        keep();
                    } else {
                        compounds.push(new Compound(")", line));
                    }
                    commandPosition = true;
                    return;
                case ')':
                    finishWord();
                    closeParenthesis();
                    keep();
                    commandPosition = true;
                    return;
                default:
                    word.append(c);
                    keep();
            }
        }

        private void closeParenthesis() {
            Compound open = compounds.peek();
            if (open != null && open.closer().equals(")")) {
                compounds.pop();
            } else if (open == null || !open.closer().equals("esac")) {
                throw grammar(line, "unbalanced ')'");
            }
        }

        private void finishWord() {
            if (word.length() == 0 && !wordQuoted) {
                return;
            }
            String current = word.toString();
            boolean quoted = wordQuoted;
            word.setLength(0);
            wordQuoted = false;

            if (echoArguments) {
                echoArguments = false;
                if (!quoted && current.startsWith("-")) {
                    throw nonPosix(line, "echo with options");
                }
            }
            if (!commandPosition) {
                return;
            }
            if (quoted) {
                commandPosition = false;
                return;
            }
            keyword(current);
        }

        private void keyword(String current) {
            switch (current) {
                case "if":
                    open("fi");
                    break;
                case "then":
                case "else":
                case "elif":
                    Compound open = compounds.peek();
                    if (open == null || !open.closer().equals("fi")) {
                        throw grammar(line, "'" + current + "' outside of 'if'");
                    }
                    commandPosition = true;
                    break;
                case "fi":
                case "esac":
                case "done":
                case "}":
                    close(current);
                    break;
                case "case":
                    compounds.push(new Compound("esac", line));
                    commandPosition = false;
                    break;
                case "do":
                    open("done");
                    break;
                case "{":
                    open("}");
                    break;
                case "while":
                case "until":
                case "!":
                    commandPosition = true;
                    break;
                default:
                    if (NON_POSIX_COMMANDS.contains(current)) {
                        throw nonPosix(line, "'" + current + "'");
                    }
                    echoArguments = current.equals("echo");
                    commandPosition = false;
            }
        }

        private void open(String closer) {
            compounds.push(new Compound(closer, line));
            commandPosition = true;
        }

        private void close(String closer) {
            Compound open = compounds.peek();
            if (open == null || !open.closer().equals(closer)) {
                throw grammar(line, "unexpected '" + closer + "'");
            }
            compounds.pop();
            commandPosition = false;
        }

        private void comment() {
            while (pos < text.length() && peek(0) != '\n') {
                mask();
            }
        }

        private void escaped() {
            mask();
            if (pos < text.length()) {
                mask();
            }
        }

        private void singleQuoted() {
            int start = line;
            keep();
            int end = text.indexOf('\'', pos);
            if (end < 0) {
                throw grammar(start, "unterminated single-quoted string");
            }
            while (pos < end) {
                mask();
            }
            keep();
        }

        private void dollar() {
            if (peek(1) == '(' && peek(2) == '(') {
                keep();
                keep();
                keep();
                push(Mode.ARITHMETIC);
            } else if (peek(1) == '(') {
                keep();
                keep();
                push(Mode.SUBSTITUTION);
            } else if (peek(1) == '{') {
                keep();
                keep();
                parameterHead();
                push(Mode.PARAMETER);
            } else {
                keep();
            }
        }

        /**
         * Reads the name and operator of a {@code ${...}} expansion and rejects the extended forms.
         */
        private void parameterHead() {
            char first = peek(0);
            if (first == '!') {
                throw nonPosix(line, "indirect expansion");
            }
            if (first == '#' && peek(1) != '}') {
                keep();
                first = peek(0);
            }
            if (Character.isLetter(first) || first == '_') {
                while (Character.isLetterOrDigit(peek(0)) || peek(0) == '_') keep();
            } else if (Character.isDigit(first)) {
                while (Character.isDigit(peek(0))) keep();
            } else if ("@*#?$!-".indexOf(first) >= 0 && first != '\0') {
                keep();
            } else {
                throw grammar(line, "bad parameter expansion");
            }

            char op = peek(0);
            switch (op) {
                case '}':
                    return;
                case ':':
                    if ("-=?+".indexOf(peek(1)) < 0 || peek(1) == '\0') {
                        throw nonPosix(line, "substring expansion");
                    }
                    keep();
                    keep();
                    return;
                case '-':
                case '=':
                case '?':
                case '+':
                    keep();
                    return;
                case '#':
                case '%':
                    keep();
                    if (peek(0) == op) keep();
                    return;
                case '[':
                    throw nonPosix(line, "array subscript");
                case '/':
                    throw nonPosix(line, "pattern substitution");
                case '^':
                case ',':
                    throw nonPosix(line, "case modification");
                default:
                    throw grammar(line, "bad parameter expansion");
            }
        }

        private void parameterWord(Frame frame) {
            char c = peek(0);
            switch (c) {
                case '}':
                    keep();
                    frames.pop();
                    return;
                case '\\':
                    escaped();
                    return;
                case '"':
                    keep();
                    push(Mode.DOUBLE_QUOTE);
                    return;
                case '\'':
                    if (frame.quoted) {
                        mask();
                    } else {
                        singleQuoted();
                    }
                    return;
                case '$':
                    dollar();
                    return;
                case '`':
                    throw nonPosix(line, "backquote command substitution");
                default:
                    mask();
            }
        }

        private void doubleQuoted() {
            char c = peek(0);
            switch (c) {
                case '"':
                    keep();
                    frames.pop();
                    return;
                case '\\':
                    escaped();
                    return;
                case '$':
                    dollar();
                    return;
                case '`':
                    throw nonPosix(line, "backquote command substitution");
                default:
                    mask();
            }
        }

        private void substitution(Frame frame) {
            char c = peek(0);
            switch (c) {
                case '\\':
                    escaped();
                    return;
                case '\'':
                    singleQuoted();
                    return;
                case '"':
                    keep();
                    push(Mode.DOUBLE_QUOTE);
                    return;
                case '$':
                    dollar();
                    return;
                case '`':
                    throw nonPosix(line, "backquote command substitution");
                case '(':
                    frame.depth++;
                    keep();
                    return;
                case ')':
                    if (frame.depth == 0) {
                        frames.pop();
                    } else {
                        frame.depth--;
                    }
                    keep();
                    return;
                default:
                    keep();
            }
        }

        private void arithmetic(Frame frame) {
            char c = peek(0);
            switch (c) {
                case '(':
                    frame.depth++;
                    mask();
                    return;
                case ')':
                    if (frame.depth > 0) {
                        frame.depth--;
                        mask();
                    } else if (peek(1) == ')') {
                        keep();
                        keep();
                        frames.pop();
                    } else {
                        throw grammar(line, "unbalanced arithmetic expansion");
                    }
                    return;
                case '$':
                    dollar();
                    return;
                default:
                    mask();
            }
        }
    }
}
