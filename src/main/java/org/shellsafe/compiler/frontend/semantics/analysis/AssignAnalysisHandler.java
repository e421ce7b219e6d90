package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AssignNode;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.semantics.Symbol;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Checks that an assignment targets a declared, mutable binding.
 */
public class AssignAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        AssignNode assign = (AssignNode) node;
        Optional<Symbol> target = symbolTable.lookup(assign.target());
        if (target.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.UNDEFINED_VARIABLE,
                    "Cannot assign to undeclared variable '" + assign.target() + "'.", assign.span(),
                    "declare it first with 'let mut " + assign.target() + " = ...;'");
        } else if (!target.get().mutable()) {
            diagnostics.reportError(CompilerErrorCode.IMMUTABLE_ASSIGNMENT,
                    "Cannot assign twice to immutable variable '" + assign.target() + "'.", assign.span(),
                    "declare it with 'mut'");
        }
    }
}
