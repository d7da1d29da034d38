package com.claro.script.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.claro.script.parser.Value;

/**
 * Variable mapping of one execution scope.
 *
 * There is one global environment per run. A function call gets a copy of the caller's
 * environment and, when the call completes, every key of the copy is written back into
 * the caller (last write wins). Calls are not lexically isolated.
 */
public class Environment {
    private final Map<String, Value> vars;
    private final Map<String, Value> readOnly;

    public Environment() {
        this(null);
    }

    public Environment(Map<String, Value> initial) {
        this.vars = new LinkedHashMap<>();
        if (initial != null) vars.putAll(initial);
        this.readOnly = Collections.unmodifiableMap(vars);
    }

    public void define(String name, Value value) {
        if (value == null) throw new IllegalArgumentException("value for '" + name + "' is null");
        vars.put(name, value);
    }

    public Value get(String name) {
        return vars.get(name);
    }

    /** Live read-only view handed to the expression evaluator. */
    public Map<String, Value> view() {
        return readOnly;
    }

    /** Copy-in: the frame a function call starts from. */
    public Environment childForCall() {
        return new Environment(vars);
    }

    /** Merge-out: every binding of {@code callFrame} becomes visible here. */
    public void mergeFrom(Environment callFrame) {
        vars.putAll(callFrame.vars);
    }

    public Map<String, Value> snapshot() {
        return new LinkedHashMap<>(vars);
    }
}
