package com.claro.script.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dynamic value of the Claro language.
 *
 * Integers are 64-bit, floats are doubles, lists and dicts keep insertion order.
 * NONE is the result of a call that never reached RETURN.
 */
public class Value {
    public enum Type { INT, FLOAT, BOOL, STRING, LIST, DICT, NONE }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "string")); }
    public static Value list(List<Value> l) { return new Value(Type.LIST, Objects.requireNonNull(l, "list")); }
    public static Value dict(Map<String, Value> m) { return new Value(Type.DICT, Objects.requireNonNull(m, "dict")); }
    public static Value none() { return NONE; }

    public Type getType() { return type; }

    public boolean isNumeric() {
        return type == Type.INT || type == Type.FLOAT;
    }

    public long asInt() {
        if (type != Type.INT) throw new IllegalStateException("Expected int, got " + typeName());
        return (long) value;
    }

    /** Numeric view of INT or FLOAT. */
    public double asNumber() {
        if (type == Type.INT) return (double) (long) value;
        if (type == Type.FLOAT) return (double) value;
        throw new IllegalStateException("Expected number, got " + typeName());
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + typeName());
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asDict() {
        if (type != Type.DICT) throw new IllegalStateException("Expected dict, got " + typeName());
        return (Map<String, Value>) value;
    }

    public String typeName() {
        switch (type) {
            case INT: return "int";
            case FLOAT: return "float";
            case BOOL: return "bool";
            case STRING: return "str";
            case LIST: return "list";
            case DICT: return "dict";
            default: return "None";
        }
    }

    public boolean isTruthy() {
        switch (type) {
            case NONE: return false;
            case BOOL: return asBool();
            case INT: return asInt() != 0L;
            case FLOAT: return asNumber() != 0.0;
            case STRING: return !asString().isEmpty();
            case LIST: return !asList().isEmpty();
            case DICT: return !asDict().isEmpty();
            default: return true;
        }
    }

    /**
     * Elements in iteration order, or null when the value has none.
     * Strings iterate characters, dicts iterate keys. The returned list is a snapshot.
     */
    public List<Value> iterationSnapshot() {
        switch (type) {
            case LIST:
                return new ArrayList<>(asList());
            case DICT: {
                List<Value> keys = new ArrayList<>(asDict().size());
                for (String k : asDict().keySet()) keys.add(Value.string(k));
                return keys;
            }
            case STRING: {
                String s = asString();
                List<Value> chars = new ArrayList<>(s.length());
                s.codePoints().forEach(cp -> chars.add(Value.string(new String(Character.toChars(cp)))));
                return chars;
            }
            default:
                return null;
        }
    }

    /** Text appended to output by PRINT: strings raw, everything else as repr. */
    public String display() {
        return (type == Type.STRING) ? asString() : repr();
    }

    public String repr() {
        switch (type) {
            case NONE: return "None";
            case BOOL: return asBool() ? "True" : "False";
            case INT: return Long.toString(asInt());
            case FLOAT: return formatFloat(asNumber());
            case STRING: return quote(asString());
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                Iterator<Value> it = asList().iterator();
                while (it.hasNext()) {
                    sb.append(it.next().repr());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append(']').toString();
            }
            case DICT: {
                StringBuilder sb = new StringBuilder("{");
                Iterator<Map.Entry<String, Value>> it = asDict().entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Value> e = it.next();
                    sb.append(quote(e.getKey())).append(": ").append(e.getValue().repr());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append('}').toString();
            }
            default:
                return String.valueOf(value);
        }
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return Long.toString((long) d) + ".0";
        }
        return Double.toString(d);
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (isNumeric() && other.isNumeric()) {
            if (type == Type.INT && other.type == Type.INT) return asInt() == other.asInt();
            return asNumber() == other.asNumber();
        }
        if (type == Type.BOOL && other.type == Type.BOOL) return asBool() == other.asBool();
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (isNumeric()) {
            double d = asNumber();
            if (d == Math.rint(d)) return Long.hashCode((long) d);
            return Double.hashCode(d);
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return repr();
    }
}
