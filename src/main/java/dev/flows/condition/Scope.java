package dev.flows.condition;

import java.util.HashMap;
import java.util.Map;

/**
 * Name bindings visible to an expression. The root scope holds only the condition context;
 * lambdas push one child scope per parameter.
 */
final class Scope {

    private final Map<String, Object> bindings;
    private final Scope parent;

    Scope(Map<String, Object> bindings) {
        this(bindings, null);
    }

    private Scope(Map<String, Object> bindings, Scope parent) {
        this.bindings = bindings;
        this.parent = parent;
    }

    Scope child(String name, Object value) {
        var map = new HashMap<String, Object>(2);
        map.put(name, value);
        return new Scope(map, this);
    }

    Object lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.bindings.containsKey(name)) {
                return scope.bindings.get(name);
            }
        }
        throw new ConditionRuntimeException(name + " is not defined");
    }
}
