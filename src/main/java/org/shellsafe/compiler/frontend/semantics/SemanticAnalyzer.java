package org.shellsafe.compiler.frontend.semantics;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.parser.ast.AssignNode;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.BlockNode;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.parser.ast.CallExpr;
import org.shellsafe.compiler.frontend.parser.ast.ContinueNode;
import org.shellsafe.compiler.frontend.parser.ast.ForNode;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.LetNode;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.VariableExpr;
import org.shellsafe.compiler.frontend.parser.ast.WhileNode;
import org.shellsafe.compiler.frontend.semantics.analysis.AssignAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.BlockAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.CallAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.FunctionAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.LetAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.LoopAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.LoopControlAnalysisHandler;
import org.shellsafe.compiler.frontend.semantics.analysis.VariableAnalysisHandler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Performs semantic analysis on the AST: the entry point, function names and arity, variable
 * declarations and mutability, loop control and recursion.
 * It operates by traversing the AST and dispatching nodes to specific handlers.
 * Like the parser, it reports every problem it finds instead of stopping at the first.
 */
public class SemanticAnalyzer {

    /** The entry function every program must define. */
    public static final String ENTRY_POINT = "main";

    /** Prefix of the generated runtime helpers; user functions may not use it. */
    public static final String RUNTIME_PREFIX = "rash_";

    /**
     * Shell builtins and the commands the generated scripts rely on. A shell function with one of
     * these names would shadow the command for the whole script.
     */
    public static final Set<String> RESERVED_FUNCTION_NAMES = Set.of(
            "break", "continue", "exit", "return", "shift", "trap", "unset", "export", "readonly", "set",
            "times", "exec", "eval", "true", "false", "test", "cd", "echo", "printf", "read", "wait", "kill",
            "command", "type", "umask", "alias", "getopts", "hash", "source", "local",
            "seq", "mkdir", "rm", "cp", "ln", "tr", "sed", "cat");

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final AnalysisContext context = new AnalysisContext();
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.symbolTable = new SymbolTable();
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        LoopAnalysisHandler loopHandler = new LoopAnalysisHandler(context);
        LoopControlAnalysisHandler loopControlHandler = new LoopControlAnalysisHandler(context);
        handlers.put(FunctionNode.class, new FunctionAnalysisHandler(context));
        handlers.put(BlockNode.class, new BlockAnalysisHandler());
        handlers.put(LetNode.class, new LetAnalysisHandler());
        handlers.put(AssignNode.class, new AssignAnalysisHandler());
        handlers.put(VariableExpr.class, new VariableAnalysisHandler());
        handlers.put(CallExpr.class, new CallAnalysisHandler(context));
        handlers.put(ForNode.class, loopHandler);
        handlers.put(WhileNode.class, loopHandler);
        handlers.put(BreakNode.class, loopControlHandler);
        handlers.put(ContinueNode.class, loopControlHandler);
    }

    /**
     * Analyzes the given program.
     * This is the main entry point for the semantic analysis phase. The first pass collects the
     * function signatures, the second analyzes the bodies and the last inspects the call graph.
     * @param program The parsed program.
     */
    public void analyze(ProgramNode program) {
        collectFunctions(program);
        traverseAndAnalyze(List.copyOf(program.functions()));
        checkCallGraph(program);
    }

    private void collectFunctions(ProgramNode program) {
        for (FunctionNode function : program.functions()) {
            String name = function.name();
            if (!context.declareFunction(function)) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_FUNCTION,
                        "Function '" + name + "' is defined more than once.", function.span());
                continue;
            }
            if (RESERVED_FUNCTION_NAMES.contains(name) || StdlibFunction.lookup(name).isPresent()) {
                diagnostics.reportError(CompilerErrorCode.RESERVED_FUNCTION_NAME,
                        "Function name '" + name + "' is reserved.", function.span(), "rename the function");
            } else if (name.startsWith(RUNTIME_PREFIX)) {
                diagnostics.reportError(CompilerErrorCode.RESERVED_FUNCTION_NAME,
                        "Function names may not start with '" + RUNTIME_PREFIX + "'.", function.span(), "rename the function");
            }
        }

        FunctionNode main = context.function(ENTRY_POINT);
        if (main == null) {
            diagnostics.reportError(CompilerErrorCode.MISSING_MAIN, "The program has no 'main' function.", program.span(),
                    "add 'fn main() { ... }'");
        } else if (!main.parameters().isEmpty() || main.returnType() != SourceType.UNIT) {
            diagnostics.reportError(CompilerErrorCode.MISSING_MAIN,
                    "'main' must take no parameters and return nothing.", main.span(), "use arg(n) to read arguments");
        }
    }

    private void traverseAndAnalyze(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, symbolTable, diagnostics);
            }
            traverseAndAnalyze(node.getChildren());
            if (handler != null) {
                handler.afterChildren(node, symbolTable, diagnostics);
            }
        }
    }

    private void checkCallGraph(ProgramNode program) {
        CallGraph graph = context.callGraph();
        for (List<String> cycle : graph.findCycles()) {
            FunctionNode first = context.function(cycle.get(0));
            String path = String.join(" -> ", cycle);
            diagnostics.reportError(CompilerErrorCode.RECURSION_NOT_SUPPORTED,
                    "Recursion is not supported: " + path + ".", first.span(), "rewrite the recursion as a loop");
        }
        if (context.function(ENTRY_POINT) == null) {
            return;
        }
        Set<String> reachable = graph.reachableFrom(ENTRY_POINT);
        for (FunctionNode function : program.functions()) {
            if (!reachable.contains(function.name())) {
                diagnostics.reportWarning(CompilerErrorCode.UNUSED_FUNCTION,
                        "Function '" + function.name() + "' is never called from main.", function.span());
            }
        }
    }
}
