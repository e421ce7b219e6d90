package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.ForNode;
import org.shellsafe.compiler.frontend.semantics.AnalysisContext;
import org.shellsafe.compiler.frontend.semantics.Symbol;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

/**
 * Tracks loop nesting for {@code for} and {@code while}. The loop variable of a {@code for} is
 * staged for the body scope, so the iterable cannot see it.
 */
public class LoopAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public LoopAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        context.enterLoop();
        if (node instanceof ForNode loop) {
            symbolTable.bindOnNextScope(new Symbol(loop.variable(), Symbol.Kind.LOOP_VARIABLE, false, loop.span()));
        }
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        context.leaveLoop();
    }
}
