package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.CallExpr;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.semantics.AnalysisContext;
import org.shellsafe.compiler.frontend.semantics.StdlibFunction;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Resolves call targets against the user functions and the allow-listed stdlib, checks arity and
 * records the edge in the call graph.
 */
public class CallAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public CallAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        CallExpr call = (CallExpr) node;
        int argumentCount = call.arguments().size();
        FunctionNode target = context.function(call.callee());
        if (target != null) {
            if (context.currentFunction() != null) {
                context.callGraph().addCall(context.currentFunction().name(), target.name());
            }
            if (target.parameters().size() != argumentCount) {
                diagnostics.reportError(CompilerErrorCode.ARITY_MISMATCH,
                        "Function '" + call.callee() + "' takes " + target.parameters().size()
                                + " argument(s) but " + argumentCount + " were supplied.", call.span());
            }
            return;
        }
        Optional<StdlibFunction> stdlib = StdlibFunction.lookup(call.callee());
        if (stdlib.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.UNKNOWN_FUNCTION,
                    "Cannot find function '" + call.callee() + "'.", call.span(),
                    "define it or use one of the allow-listed functions");
        } else if (!stdlib.get().acceptsArity(argumentCount)) {
            diagnostics.reportError(CompilerErrorCode.ARITY_MISMATCH,
                    "Function '" + call.callee() + "' takes " + stdlib.get().arityDescription()
                            + " argument(s) but " + argumentCount + " were supplied.", call.span());
        }
    }
}
