package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.VariableExpr;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

/**
 * Resolves variable references; every variable must be declared before it is read.
 */
public class VariableAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        VariableExpr variable = (VariableExpr) node;
        if (symbolTable.resolve(variable.name()).isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.UNDEFINED_VARIABLE,
                    "Cannot find variable '" + variable.name() + "' in this scope.", variable.span());
        }
    }
}
