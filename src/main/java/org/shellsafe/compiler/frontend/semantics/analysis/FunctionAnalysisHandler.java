package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.ParameterNode;
import org.shellsafe.compiler.frontend.semantics.AnalysisContext;
import org.shellsafe.compiler.frontend.semantics.Symbol;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

import java.util.HashSet;
import java.util.Set;

/**
 * Handles function definitions. The parameters are staged so that they are defined in the scope
 * of the function body.
 */
public class FunctionAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public FunctionAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        FunctionNode function = (FunctionNode) node;
        context.setCurrentFunction(function);
        Set<String> seen = new HashSet<>();
        for (ParameterNode parameter : function.parameters()) {
            if (!seen.add(parameter.name())) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_PARAMETER,
                        "Parameter '" + parameter.name() + "' is declared more than once in '" + function.name() + "'.",
                        parameter.span());
                continue;
            }
            symbolTable.bindOnNextScope(new Symbol(parameter.name(), Symbol.Kind.PARAMETER, parameter.mutable(), parameter.span()));
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        context.setCurrentFunction(null);
    }
}
