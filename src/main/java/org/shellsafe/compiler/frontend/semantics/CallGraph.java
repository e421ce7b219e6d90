package org.shellsafe.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The directed graph of calls between user functions. Iteration order follows insertion order,
 * so every traversal is deterministic.
 */
public class CallGraph {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    /**
     * Registers a function as a node of the graph.
     * @param function The function name.
     */
    public void addFunction(String function) {
        edges.computeIfAbsent(function, k -> new LinkedHashSet<>());
    }

    /**
     * Records that {@code caller} calls {@code callee}.
     */
    public void addCall(String caller, String callee) {
        addFunction(callee);
        edges.computeIfAbsent(caller, k -> new LinkedHashSet<>()).add(callee);
    }

    public Set<String> callees(String function) {
        return edges.getOrDefault(function, Set.of());
    }

    /**
     * Finds every cycle by depth-first search. Each cycle is reported once, as the path from the
     * first function of the cycle back to itself.
     * @return The cycles, e.g. {@code [a, b, a]} for mutual recursion.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        Deque<String> path = new ArrayDeque<>();
        for (String function : edges.keySet()) {
            if (!state.containsKey(function)) {
                visit(function, state, path, cycles);
            }
        }
        return cycles;
    }

    private void visit(String function, Map<String, Integer> state, Deque<String> path, List<List<String>> cycles) {
        state.put(function, 1);
        path.addLast(function);
        for (String callee : callees(function)) {
            Integer calleeState = state.get(callee);
            if (calleeState == null) {
                visit(callee, state, path, cycles);
            } else if (calleeState == 1) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onPath : path) {
                    if (onPath.equals(callee)) inCycle = true;
                    if (inCycle) cycle.add(onPath);
                }
                cycle.add(callee);
                cycles.add(cycle);
            }
        }
        path.removeLast();
        state.put(function, 2);
    }

    /**
     * @param root The entry function.
     * @return Every function reachable from {@code root}, including itself.
     */
    public Set<String> reachableFrom(String root) {
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            String function = work.pop();
            if (reachable.add(function)) {
                for (String callee : callees(function)) {
                    work.push(callee);
                }
            }
        }
        return reachable;
    }
}
