package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.LetNode;
import org.shellsafe.compiler.frontend.semantics.Symbol;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

/**
 * Defines {@code let} bindings. The binding becomes visible only after its initializer was
 * analyzed, so {@code let x = x + 1;} refers to an outer {@code x}.
 */
public class LetAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // nothing to check before the initializer
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        LetNode let = (LetNode) node;
        symbolTable.define(new Symbol(let.name(), Symbol.Kind.LOCAL, let.mutable(), let.span()));
    }
}
