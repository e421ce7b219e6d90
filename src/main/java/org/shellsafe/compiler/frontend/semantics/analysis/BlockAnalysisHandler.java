package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.BlockNode;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.parser.ast.CallExpr;
import org.shellsafe.compiler.frontend.parser.ast.ContinueNode;
import org.shellsafe.compiler.frontend.parser.ast.ExprStmtNode;
import org.shellsafe.compiler.frontend.parser.ast.ReturnNode;
import org.shellsafe.compiler.frontend.parser.ast.StmtNode;
import org.shellsafe.compiler.frontend.semantics.StdlibFunction;
import org.shellsafe.compiler.frontend.semantics.Symbol;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

/**
 * Handles blocks: opens and closes their scope, reports statements that can never run and
 * {@code let} bindings that are never read.
 */
public class BlockAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        BlockNode block = (BlockNode) node;
        symbolTable.enterScope();
        for (int i = 0; i < block.statements().size() - 1; i++) {
            if (endsControlFlow(block.statements().get(i))) {
                StmtNode next = block.statements().get(i + 1);
                diagnostics.reportWarning(CompilerErrorCode.UNREACHABLE_CODE, "Unreachable statement.", next.span());
                break;
            }
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        for (Symbol symbol : symbolTable.leaveScope()) {
            if (symbol.kind() == Symbol.Kind.LOCAL && !symbol.name().startsWith("_")) {
                diagnostics.reportWarning(CompilerErrorCode.UNUSED_VARIABLE,
                        "Variable '" + symbol.name() + "' is never used.", symbol.span());
            }
        }
    }

    static boolean endsControlFlow(StmtNode statement) {
        if (statement instanceof ReturnNode || statement instanceof BreakNode || statement instanceof ContinueNode) {
            return true;
        }
        return statement instanceof ExprStmtNode expr
                && expr.expression() instanceof CallExpr call
                && call.callee().equals(StdlibFunction.EXIT.sourceName());
    }
}
