package org.shellsafe.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for variable bindings during semantic analysis.
 * It supports nested block scopes and resolves names from the innermost scope outwards.
 * <p>
 * Bindings that belong to a block but are introduced by its enclosing construct (function
 * parameters, loop variables) are staged with {@link #bindOnNextScope(Symbol)} and defined when
 * that block's scope is entered.
 */
public class SymbolTable {

    /**
     * Represents a single block scope.
     */
    public static class Scope {
        private final Scope parent;
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();
        private final List<Symbol> shadowed = new ArrayList<>();

        Scope(Scope parent) {
            this.parent = parent;
        }
    }

    private final Scope rootScope = new Scope(null);
    private final List<Symbol> pending = new ArrayList<>();
    private final Deque<Scope> openScopes = new ArrayDeque<>();
    private Scope currentScope = rootScope;

    /**
     * Stages a binding for the next scope that is entered.
     * @param symbol The binding.
     */
    public void bindOnNextScope(Symbol symbol) {
        pending.add(symbol);
    }

    /**
     * Enters a new scope and defines any staged bindings in it.
     * @return The new scope.
     */
    public Scope enterScope() {
        Scope scope = new Scope(currentScope);
        currentScope = scope;
        openScopes.push(scope);
        for (Symbol symbol : pending) {
            define(symbol);
        }
        pending.clear();
        return scope;
    }

    /**
     * Leaves the current scope.
     * @return The bindings of the left scope that were never read, in declaration order.
     */
    public List<Symbol> leaveScope() {
        Scope left = currentScope;
        if (left.parent != null) {
            currentScope = left.parent;
            openScopes.pop();
        }
        List<Symbol> unused = new ArrayList<>();
        for (Symbol symbol : left.shadowed) {
            if (!symbol.isUsed()) unused.add(symbol);
        }
        for (Symbol symbol : left.symbols.values()) {
            if (!symbol.isUsed()) unused.add(symbol);
        }
        return unused;
    }

    /**
     * Defines a binding in the current scope. A binding of the same name in the same scope is
     * shadowed, as the source language allows.
     * @param symbol The binding to define.
     */
    public void define(Symbol symbol) {
        Symbol previous = currentScope.symbols.put(symbol.name(), symbol);
        if (previous != null) {
            currentScope.shadowed.add(previous);
        }
    }

    /**
     * Resolves a name from the current scope upwards and marks the binding as used.
     * @param name The variable name.
     * @return The binding, or empty if the name is not declared.
     */
    public Optional<Symbol> resolve(String name) {
        Optional<Symbol> symbol = lookup(name);
        symbol.ifPresent(Symbol::markUsed);
        return symbol;
    }

    /**
     * Resolves a name without marking it as used (e.g. for an assignment target).
     * @param name The variable name.
     * @return The binding, or empty if the name is not declared.
     */
    public Optional<Symbol> lookup(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) return Optional.of(symbol);
        }
        return Optional.empty();
    }

    /**
     * @return The number of currently open block scopes.
     */
    public int depth() {
        return openScopes.size();
    }
}
