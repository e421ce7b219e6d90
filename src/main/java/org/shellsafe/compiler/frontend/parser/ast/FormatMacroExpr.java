package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * {@code format!}, {@code println!} or {@code eprintln!} with its format string already split.
 * The literal pieces and arguments interleave: {@code pieces[0] args[0] pieces[1] ... args[n-1] pieces[n]}.
 *
 * @param id The canonical node id.
 * @param span The span of the macro name.
 * @param kind Which macro was used.
 * @param pieces The literal text between placeholders; always one more than the arguments.
 * @param arguments The values filling the placeholders.
 */
public record FormatMacroExpr(NodeId id, SourceSpan span, Kind kind, List<String> pieces, List<ExprNode> arguments)
        implements ExprNode {

    /**
     * The formatting macros of the allow-list.
     */
    public enum Kind {
        FORMAT("format"), PRINTLN("println"), EPRINTLN("eprintln"), PRINT("print"), EPRINT("eprint");

        private final String macroName;

        Kind(String macroName) {
            this.macroName = macroName;
        }

        /**
         * @return The macro name without the {@code !}.
         */
        public String macroName() {
            return macroName;
        }
    }

    public FormatMacroExpr {
        pieces = List.copyOf(pieces);
        arguments = List.copyOf(arguments);
        if (pieces.size() != arguments.size() + 1) {
            throw new IllegalArgumentException("pieces must outnumber arguments by one");
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
