package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.semantics.AnalysisContext;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

/**
 * Rejects {@code break} and {@code continue} outside of a loop.
 */
public class LoopControlAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public LoopControlAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!context.inLoop()) {
            String keyword = node instanceof BreakNode ? "break" : "continue";
            diagnostics.reportError(CompilerErrorCode.LOOP_CONTROL_OUTSIDE_LOOP,
                    "'" + keyword + "' outside of a loop.", node.span());
        }
    }
}
