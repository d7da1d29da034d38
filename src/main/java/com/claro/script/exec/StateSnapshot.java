package com.claro.script.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.claro.script.parser.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON view of interpreter state, used by TRACE and by hosts that want to inspect a run.
 *
 * Shape:
 * {
 *   "variables": { "x": 1, "names": ["a", "b"] },
 *   "functions": { "add": ["a", "b"] },
 *   "callStack": ["add(3, 4)"]
 * }
 */
public final class StateSnapshot {

    private static final ObjectMapper om = new ObjectMapper();
    private static final ObjectMapper pretty = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private StateSnapshot() {}

    public static Map<String, Object> capture(ExecutionState state, Environment env) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("variables", ValueCodec.toPlainMap(env.snapshot()));

        Map<String, Object> fns = new LinkedHashMap<>();
        for (Map.Entry<String, UserFunction> e : state.functions().all().entrySet()) {
            fns.put(e.getKey(), new ArrayList<>(e.getValue().params()));
        }
        root.put("functions", fns);

        // Deque iterates innermost first; report outermost first
        List<String> stack = new ArrayList<>();
        for (Iterator<CallFrame> it = state.callStack().descendingIterator(); it.hasNext();) {
            stack.add(it.next().toString());
        }
        root.put("callStack", stack);
        return root;
    }

    public static String toJson(ExecutionState state, Environment env, boolean indent) {
        return write(capture(state, env), indent);
    }

    public static String write(Object jsonSafe, boolean indent) {
        try {
            return (indent ? pretty : om).writeValueAsString(jsonSafe);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state: " + e.getOriginalMessage(), e);
        }
    }

    /** Converts Values into JSON-safe Java types (Long, Double, Boolean, String, List, Map, null). */
    public static final class ValueCodec {
        private ValueCodec() {}

        public static Object toPlainJava(Value v) {
            if (v == null) return null;
            switch (v.getType()) {
                case NONE:
                    return null;
                case INT:
                    return v.asInt();
                case FLOAT:
                    return v.asNumber();
                case BOOL:
                    return v.asBool();
                case STRING:
                    return v.asString();
                case LIST: {
                    List<Object> out = new ArrayList<>();
                    for (Value item : v.asList()) out.add(toPlainJava(item));
                    return out;
                }
                case DICT:
                    return toPlainMap(v.asDict());
                default:
                    throw new IllegalStateException("Unsupported Value type: " + v.getType());
            }
        }

        public static Map<String, Object> toPlainMap(Map<String, Value> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Value> e : m.entrySet()) {
                out.put(e.getKey(), toPlainJava(e.getValue()));
            }
            return out;
        }
    }
}
