package org.shellsafe.compiler.frontend.semantics;

import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state shared by the analysis handlers during one run of the {@link SemanticAnalyzer}:
 * the declared functions, the function being analyzed, the loop nesting and the call graph.
 */
public class AnalysisContext {

    private final Map<String, FunctionNode> functions = new LinkedHashMap<>();
    private final CallGraph callGraph = new CallGraph();
    private FunctionNode currentFunction;
    private int loopDepth;

    /**
     * Declares a user function.
     * @param function The function.
     * @return {@code false} if a function of the same name was already declared.
     */
    public boolean declareFunction(FunctionNode function) {
        callGraph.addFunction(function.name());
        return functions.putIfAbsent(function.name(), function) == null;
    }

    public FunctionNode function(String name) {
        return functions.get(name);
    }

    public Map<String, FunctionNode> functions() {
        return functions;
    }

    public CallGraph callGraph() {
        return callGraph;
    }

    public FunctionNode currentFunction() {
        return currentFunction;
    }

    public void setCurrentFunction(FunctionNode function) {
        this.currentFunction = function;
    }

    public void enterLoop() {
        loopDepth++;
    }

    public void leaveLoop() {
        loopDepth--;
    }

    public boolean inLoop() {
        return loopDepth > 0;
    }
}
