package org.shellsafe.compiler.frontend.semantics.analysis;

import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of AST node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node before its children are visited.
     * @param node The node to analyze.
     * @param symbolTable The symbol table for the current scope.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);

    /**
     * Called after the children of the node have been analyzed.
     * @param node The node being analyzed.
     * @param symbolTable The symbol table for the current scope.
     * @param diagnostics The engine for reporting errors.
     */
    default void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
    }
}
