package yul.sema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope. A function scope holds the parameters and return variables of a function;
 * variables of enclosing scopes are not visible through it, functions are.
 */
public final class Scope {
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Scope parent;
    private final boolean functionScope;

    public Scope(Scope parent, boolean functionScope) {
        this.parent = parent;
        this.functionScope = functionScope;
    }

    /** Adds the symbol unless this scope already binds its name. */
    public boolean define(Symbol sym) {
        if (symbols.containsKey(sym.name())) return false;
        symbols.put(sym.name(), sym);
        return true;
    }

    public Symbol getLocal(String name) {
        return symbols.get(name);
    }

    /** True if this scope or any enclosing one binds the name, function boundaries included. */
    public boolean exists(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.symbols.containsKey(name)) return true;
        }
        return false;
    }

    public Symbol lookup(String name) {
        boolean crossedFunctionBoundary = false;
        for (Scope s = this; s != null; s = s.parent) {
            Symbol sym = s.symbols.get(name);
            if (sym != null) {
                if (crossedFunctionBoundary && sym instanceof VarSymbol) return null;
                return sym;
            }
            if (s.functionScope) crossedFunctionBoundary = true;
        }
        return null;
    }

    public Map<String, Symbol> symbols() {
        return Collections.unmodifiableMap(symbols);
    }

    public Scope parent() {
        return parent;
    }

    public boolean isFunctionScope() {
        return functionScope;
    }
}
