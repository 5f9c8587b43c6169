package org.kasd.compiler.frontend.semantics;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The symbol table of one analysis pass. Names are unique: a name can be defined only once.
 * A new table is created for every pass and discarded afterwards.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    /**
     * Defines a new symbol.
     * @param symbol The symbol to define.
     * @return {@code true} if the symbol was added, {@code false} if its name is already defined.
     */
    public boolean define(Symbol symbol) {
        return symbols.putIfAbsent(symbol.name(), symbol) == null;
    }

    /**
     * Resolves a symbol by name.
     * @param name The name to look up.
     * @return An optional containing the found symbol, or empty if not found.
     */
    public Optional<Symbol> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @param name The name to look up.
     * @return {@code true} if the name is defined.
     */
    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    /**
     * @return All symbols in definition order.
     */
    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }
}
