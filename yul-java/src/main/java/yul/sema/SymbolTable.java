package yul.sema;

import java.util.ArrayDeque;
import java.util.Deque;

public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public Scope push(boolean functionScope) {
        Scope s = new Scope(scopes.peek(), functionScope);
        scopes.push(s);
        return s;
    }

    public void pop() { scopes.pop(); }

    public boolean define(Symbol sym) { return scopes.peek().define(sym); }

    public boolean exists(String name) {
        return !scopes.isEmpty() && scopes.peek().exists(name);
    }

    public Symbol lookup(String name) {
        return scopes.isEmpty() ? null : scopes.peek().lookup(name);
    }
}
