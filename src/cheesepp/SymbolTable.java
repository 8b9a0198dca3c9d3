package cheesepp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names to values across nested scopes. Every name keeps a stack of definitions,
 * innermost last, so exiting a scope uncovers shadowed outer bindings again.
 */
public class SymbolTable {
    public static final int GLOBAL_SCOPE = 0;

    private final Map<String, ArrayList<Symbol>> table = new HashMap<>();
    private final Deque<Integer> scopeStack = new ArrayDeque<>();
    private int lastScopeLevel = GLOBAL_SCOPE;

    public SymbolTable() {
        scopeStack.push(GLOBAL_SCOPE);
    }

    public int getCurrentScopeLevel() {
        return scopeStack.peek();
    }

    public int getScopeDepth() {
        return scopeStack.size();
    }

    public void enterScope() {
        scopeStack.push(++lastScopeLevel);
    }

    /** Drops every symbol of the innermost scope. The global scope is never exited. */
    public void exitScope() {
        if (scopeStack.size() <= 1) {
            return;
        }
        int exiting = scopeStack.pop();
        table.values().forEach(symbols -> symbols.removeIf(symbol -> symbol.getScopeLevel() == exiting));
        table.values().removeIf(List::isEmpty);
    }

    /** Returns false if the name is already defined in the current scope. */
    public boolean define(String name, Symbol.SymbolKind kind, Value value, Integer line) {
        if (lookupInCurrentScope(name) != null) {
            return false;
        }
        table.computeIfAbsent(name, k -> new ArrayList<>())
                .add(new Symbol(name, kind, value, getCurrentScopeLevel(), line));
        return true;
    }

    public Symbol lookup(String name) {
        ArrayList<Symbol> symbols = table.get(name);
        if (symbols == null || symbols.isEmpty()) {
            return null;
        }
        return symbols.get(symbols.size() - 1);
    }

    public Symbol lookupInCurrentScope(String name) {
        Symbol symbol = lookup(name);
        if (symbol != null && symbol.getScopeLevel() == getCurrentScopeLevel()) {
            return symbol;
        }
        return null;
    }

    /** Rebinds the innermost visible definition; false if the name is unresolved. */
    public boolean update(String name, Value value) {
        Symbol symbol = lookup(name);
        if (symbol == null) {
            return false;
        }
        symbol.setValue(value);
        return true;
    }

    /** Innermost visible symbol per name, sorted by name. */
    public Map<String, Symbol> getAllSymbols() {
        Map<String, Symbol> visible = new LinkedHashMap<>();
        table.keySet().stream().sorted().forEach(name -> {
            Symbol symbol = lookup(name);
            if (symbol != null) {
                visible.put(name, symbol);
            }
        });
        return visible;
    }

    public int size() {
        return table.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        return "SymbolTable(scope=" + getCurrentScopeLevel() + ", symbols=" + size() + ")";
    }
}
