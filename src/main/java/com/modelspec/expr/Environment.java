package com.modelspec.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable chain of variable and function scopes captured by a deferred expression.
 *
 * The root of every chain created through {@link #empty()} is the built-in function scope.
 */
public final class Environment {

    private static final Environment BUILTINS = new Environment(null, Map.of(), BuiltinFunctions.all());

    private final Environment parent;
    private final Map<String, Object> variables;
    private final Map<String, ExprFunction> functions;

    private Environment(Environment parent, Map<String, Object> variables, Map<String, ExprFunction> functions) {
        this.parent = parent;
        this.variables = variables;
        this.functions = functions;
    }

    public static Environment builtins() {
        return BUILTINS;
    }

    /**
     * A fresh scope whose parent is the built-in functions.
     */
    public static Environment empty() {
        return new Environment(BUILTINS, Map.of(), Map.of());
    }

    public Environment child() {
        return new Environment(this, Map.of(), Map.of());
    }

    public Environment with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(variables);
        copy.put(name, value);
        return new Environment(parent, Collections.unmodifiableMap(copy), functions);
    }

    public Environment withFunction(String name, ExprFunction function) {
        Map<String, ExprFunction> copy = new LinkedHashMap<>(functions);
        copy.put(name, function);
        return new Environment(parent, variables, Collections.unmodifiableMap(copy));
    }

    public boolean defines(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.variables.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Value bound to {@code name} in the nearest scope; callers check {@link #defines} first
     * since a variable may be bound to null.
     */
    public Object get(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.variables.containsKey(name)) {
                return env.variables.get(name);
            }
        }
        return null;
    }

    public Optional<ExprFunction> function(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            ExprFunction fn = env.functions.get(name);
            if (fn != null) {
                return Optional.of(fn);
            }
        }
        return Optional.empty();
    }
}
