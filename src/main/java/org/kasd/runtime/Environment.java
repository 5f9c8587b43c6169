package org.kasd.runtime;

import org.kasd.runtime.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The name to value bindings of one {@link Interpreter}. Defining an existing name
 * replaces its value.
 */
public class Environment {

    private final Map<String, Value> bindings = new LinkedHashMap<>();

    /**
     * Binds a name, replacing any previous binding of the same name.
     * @param name The variable name.
     * @param value The value to bind.
     */
    public void define(String name, Value value) {
        bindings.put(name, value);
    }

    /**
     * Looks up a binding.
     * @param name The variable name.
     * @return The bound value, or empty if the name is unbound.
     */
    public Optional<Value> get(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * @return The number of bound names.
     */
    public int size() {
        return bindings.size();
    }

    /**
     * Returns a read-only copy of the current bindings, in definition order.
     * @return The bindings.
     */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }
}
