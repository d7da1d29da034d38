package com.claro.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.claro.script.parser.Expr.Binary;
import com.claro.script.parser.Expr.Call;
import com.claro.script.parser.Expr.DictLiteral;
import com.claro.script.parser.Expr.ExprInterface;
import com.claro.script.parser.Expr.ExprVisitor;
import com.claro.script.parser.Expr.Index;
import com.claro.script.parser.Expr.ListLiteral;
import com.claro.script.parser.Expr.Literal;
import com.claro.script.parser.Expr.Logical;
import com.claro.script.parser.Expr.Unary;
import com.claro.script.parser.Expr.Variable;

/**
 * Tree-walking evaluator for Claro expressions.
 *
 * - Types: int, float, str, bool, list, dict, None
 * - Operators: + - * / // % ** == != < <= > >= in and or not (also && || !)
 * - Literals: numbers, 'str' / "str", [list], {dict}, True/False/None (any case)
 * - Indexing: list[i] (negative from the end), str[i], dict["key"]
 * - Built-ins: registered via registerFunction, core set installed by the constructor
 *
 * Parsed trees are cached per expression text; loops re-evaluate the same lines often.
 */
public class ExpressionEvaluator implements Evaluator {

    private static final int PARSE_CACHE_SIZE = 512;

    private final Map<String, BuiltinFunction> functions = new HashMap<>();

    private final Map<String, ExprInterface> parseCache =
            new LinkedHashMap<String, ExprInterface>(64, 0.75f, true) {
                private static final long serialVersionUID = 1L;

                @Override
                protected boolean removeEldestEntry(Map.Entry<String, ExprInterface> eldest) {
                    return size() > PARSE_CACHE_SIZE;
                }
            };

    public ExpressionEvaluator() {
        registerCoreBuiltins();
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    @Override
    public Value evaluate(String expression, Map<String, Value> variables) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ExpressionException("", "Empty expression");
        }
        ExprInterface tree = parse(expression);
        try {
            return tree.accept(new Evaluation(expression, variables));
        } catch (ExpressionException e) {
            throw e;
        } catch (ArithmeticException e) {
            throw new ExpressionException(expression, e.getMessage(), e);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new ExpressionException(expression, e.getMessage(), e);
        }
    }

    /** Parse only; exposed so statements can be checked without running them. */
    public ExprInterface parse(String expression) {
        ExprInterface tree = parseCache.get(expression);
        if (tree == null) {
            List<Token> tokens = new Lexer(expression).tokenize();
            tree = new Parser(expression, tokens).parse();
            parseCache.put(expression, tree);
        }
        return tree;
    }

    private final class Evaluation implements ExprVisitor<Value> {
        private final String source;
        private final Map<String, Value> variables;

        Evaluation(String source, Map<String, Value> variables) {
            this.source = source;
            this.variables = (variables == null) ? Collections.emptyMap() : variables;
        }

        private Value eval(ExprInterface expr) { return expr.accept(this); }

        private ExpressionException error(String message) {
            return new ExpressionException(source, message);
        }

        @Override
        public Value visitLiteralExpr(Literal expr) {
            return expr.value;
        }

        @Override
        public Value visitListLiteralExpr(ListLiteral expr) {
            List<Value> values = new ArrayList<>(expr.items.size());
            for (ExprInterface e : expr.items) values.add(eval(e));
            return Value.list(values);
        }

        @Override
        public Value visitDictLiteralExpr(DictLiteral expr) {
            Map<String, Value> out = new LinkedHashMap<>();
            for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) {
                out.put(e.getKey(), eval(e.getValue()));
            }
            return Value.dict(out);
        }

        @Override
        public Value visitVariableExpr(Variable expr) {
            String name = expr.name.lexeme;
            Value v = variables.get(name);
            if (v == null) throw error("Undefined variable: " + name);
            return v;
        }

        @Override
        public Value visitLogicalExpr(Logical expr) {
            Value left = eval(expr.left);
            boolean isOr = expr.operator.type == TokenType.OR || expr.operator.type == TokenType.OR_OR;
            if (isOr) {
                if (left.isTruthy()) return left;
            } else {
                if (!left.isTruthy()) return left;
            }
            return eval(expr.right);
        }

        @Override
        public Value visitUnaryExpr(Unary expr) {
            Value right = eval(expr.right);
            switch (expr.operator.type) {
                case BANG:
                case NOT:
                    return Value.bool(!right.isTruthy());
                case MINUS:
                    if (right.getType() == Value.Type.INT) return Value.integer(Math.negateExact(right.asInt()));
                    if (right.getType() == Value.Type.FLOAT) return Value.floating(-right.asNumber());
                    throw error("Unary '-' expects a number, got " + right.typeName());
                case PLUS:
                    if (!right.isNumeric()) throw error("Unary '+' expects a number, got " + right.typeName());
                    return right;
                default:
                    throw error("Unsupported unary operator: " + expr.operator.lexeme);
            }
        }

        @Override
        public Value visitBinaryExpr(Binary expr) {
            Value left = eval(expr.left);
            Value right = eval(expr.right);
            Token op = expr.operator;

            switch (op.type) {
                case PLUS:
                    return add(left, right);
                case MINUS:
                    requireNumbers(left, right, op);
                    if (bothInts(left, right)) return Value.integer(Math.subtractExact(left.asInt(), right.asInt()));
                    return Value.floating(left.asNumber() - right.asNumber());
                case STAR:
                    return multiply(left, right, op);
                case SLASH:
                    requireNumbers(left, right, op);
                    if (right.asNumber() == 0.0) throw error("division by zero");
                    return Value.floating(left.asNumber() / right.asNumber());
                case DOUBLE_SLASH:
                    requireNumbers(left, right, op);
                    if (right.asNumber() == 0.0) throw error("integer division by zero");
                    if (bothInts(left, right)) return Value.integer(Math.floorDiv(left.asInt(), right.asInt()));
                    return Value.floating(Math.floor(left.asNumber() / right.asNumber()));
                case PERCENT:
                    requireNumbers(left, right, op);
                    if (right.asNumber() == 0.0) throw error("modulo by zero");
                    if (bothInts(left, right)) return Value.integer(Math.floorMod(left.asInt(), right.asInt()));
                    double a = left.asNumber();
                    double b = right.asNumber();
                    return Value.floating(a - b * Math.floor(a / b));
                case DOUBLE_STAR:
                    return power(left, right, op);

                case GREATER:
                    return Value.bool(compare(left, right, op) > 0);
                case GREATER_EQUAL:
                    return Value.bool(compare(left, right, op) >= 0);
                case LESS:
                    return Value.bool(compare(left, right, op) < 0);
                case LESS_EQUAL:
                    return Value.bool(compare(left, right, op) <= 0);
                case EQUAL_EQUAL:
                    return Value.bool(left.equals(right));
                case BANG_EQUAL:
                    return Value.bool(!left.equals(right));
                case IN:
                    return Value.bool(contains(right, left));

                default:
                    throw error("Unsupported binary operator: " + op.lexeme);
            }
        }

        @Override
        public Value visitIndexExpr(Index expr) {
            Value target = eval(expr.target);
            Value idx = eval(expr.index);

            if (target.getType() == Value.Type.DICT) {
                if (idx.getType() != Value.Type.STRING) throw error("Dict key must be a string, got " + idx.typeName());
                Value v = target.asDict().get(idx.asString());
                if (v == null) throw error("Key not found: " + idx.asString());
                return v;
            }

            if (idx.getType() != Value.Type.INT) throw error("Index must be an int, got " + idx.typeName());
            long i = idx.asInt();

            if (target.getType() == Value.Type.LIST) {
                List<Value> list = target.asList();
                return list.get(checkIndex(i, list.size()));
            }
            if (target.getType() == Value.Type.STRING) {
                String s = target.asString();
                int at = checkIndex(i, s.length());
                return Value.string(s.substring(at, at + 1));
            }
            throw error("Indexing not supported on type: " + target.typeName());
        }

        @Override
        public Value visitCallExpr(Call expr) {
            String name = expr.name.lexeme;
            BuiltinFunction fn = functions.get(name);
            if (fn == null) throw error("Unknown function: " + name);

            List<Value> args = new ArrayList<>(expr.arguments.size());
            for (ExprInterface a : expr.arguments) args.add(eval(a));
            try {
                return fn.call(args);
            } catch (ExpressionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExpressionException(source, name + "(): " + e.getMessage(), e);
            }
        }

        private int checkIndex(long i, int size) {
            long at = (i < 0) ? size + i : i;
            if (at < 0 || at >= size) throw error("Index out of range: " + i);
            return (int) at;
        }

        private Value add(Value left, Value right) {
            if (left.isNumeric() && right.isNumeric()) {
                if (bothInts(left, right)) return Value.integer(Math.addExact(left.asInt(), right.asInt()));
                return Value.floating(left.asNumber() + right.asNumber());
            }
            if (left.getType() == Value.Type.LIST && right.getType() == Value.Type.LIST) {
                List<Value> out = new ArrayList<>(left.asList());
                out.addAll(right.asList());
                return Value.list(out);
            }
            if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
                return Value.string(left.display() + right.display());
            }
            throw error("Unsupported operand types for '+': " + left.typeName() + ", " + right.typeName());
        }

        private Value multiply(Value left, Value right, Token op) {
            if (left.isNumeric() && right.isNumeric()) {
                if (bothInts(left, right)) return Value.integer(Math.multiplyExact(left.asInt(), right.asInt()));
                return Value.floating(left.asNumber() * right.asNumber());
            }
            Value seq = (right.getType() == Value.Type.INT) ? left : right;
            Value times = (seq == left) ? right : left;
            if (times.getType() == Value.Type.INT) {
                int n = (int) Math.max(0L, Math.min(times.asInt(), Integer.MAX_VALUE));
                if (seq.getType() == Value.Type.STRING) return Value.string(seq.asString().repeat(n));
                if (seq.getType() == Value.Type.LIST) {
                    List<Value> out = new ArrayList<>();
                    for (int i = 0; i < n; i++) out.addAll(seq.asList());
                    return Value.list(out);
                }
            }
            throw error("Unsupported operand types for '" + op.lexeme + "': " + left.typeName() + ", " + right.typeName());
        }

        private Value power(Value left, Value right, Token op) {
            requireNumbers(left, right, op);
            if (bothInts(left, right) && right.asInt() >= 0) {
                long base = left.asInt();
                long exp = right.asInt();
                long result = 1L;
                while (exp > 0) {
                    if ((exp & 1L) == 1L) result = Math.multiplyExact(result, base);
                    exp >>= 1;
                    if (exp > 0) base = Math.multiplyExact(base, base);
                }
                return Value.integer(result);
            }
            return Value.floating(Math.pow(left.asNumber(), right.asNumber()));
        }

        private int compare(Value left, Value right, Token op) {
            if (left.isNumeric() && right.isNumeric()) {
                return Double.compare(left.asNumber(), right.asNumber());
            }
            if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                return left.asString().compareTo(right.asString());
            }
            throw error("Operator '" + op.lexeme + "' not supported between " + left.typeName() + " and " + right.typeName());
        }

        private boolean contains(Value container, Value item) {
            switch (container.getType()) {
                case LIST:
                    return container.asList().contains(item);
                case DICT:
                    return item.getType() == Value.Type.STRING && container.asDict().containsKey(item.asString());
                case STRING:
                    if (item.getType() != Value.Type.STRING) throw error("'in <str>' requires a string on the left");
                    return container.asString().contains(item.asString());
                default:
                    throw error("Argument of type " + container.typeName() + " is not a container");
            }
        }

        private void requireNumbers(Value a, Value b, Token op) {
            if (!a.isNumeric() || !b.isNumeric()) {
                throw error("Operator '" + op.lexeme + "' expects numbers, got " + a.typeName() + ", " + b.typeName());
            }
        }

        private boolean bothInts(Value a, Value b) {
            return a.getType() == Value.Type.INT && b.getType() == Value.Type.INT;
        }
    }

    private void registerCoreBuiltins() {
        registerFunction("len", args -> {
            requireArgCount("len", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: return Value.integer(v.asString().length());
                case LIST: return Value.integer(v.asList().size());
                case DICT: return Value.integer(v.asDict().size());
                default: throw new IllegalArgumentException("len() not supported for type: " + v.typeName());
            }
        });

        registerFunction("str", args -> {
            requireArgCount("str", args, 1);
            return Value.string(args.get(0).display());
        });

        registerFunction("int", args -> {
            requireArgCount("int", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case INT: return v;
                case FLOAT: return Value.integer((long) v.asNumber());
                case BOOL: return Value.integer(v.asBool() ? 1L : 0L);
                case STRING:
                    try {
                        return Value.integer(Long.parseLong(v.asString().trim()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("invalid literal for int(): '" + v.asString() + "'");
                    }
                default: throw new IllegalArgumentException("int() not supported for type: " + v.typeName());
            }
        });

        registerFunction("float", args -> {
            requireArgCount("float", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case INT:
                case FLOAT: return Value.floating(v.asNumber());
                case BOOL: return Value.floating(v.asBool() ? 1.0 : 0.0);
                case STRING:
                    try {
                        return Value.floating(Double.parseDouble(v.asString().trim()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("could not convert string to float: '" + v.asString() + "'");
                    }
                default: throw new IllegalArgumentException("float() not supported for type: " + v.typeName());
            }
        });

        registerFunction("range", args -> {
            if (args.isEmpty() || args.size() > 3) {
                throw new IllegalArgumentException("range() expects 1 to 3 arguments, got " + args.size());
            }
            long start = 0;
            long stop;
            long step = 1;
            if (args.size() == 1) {
                stop = intArg("range", args.get(0));
            } else {
                start = intArg("range", args.get(0));
                stop = intArg("range", args.get(1));
                if (args.size() == 3) step = intArg("range", args.get(2));
            }
            if (step == 0) throw new IllegalArgumentException("range() step must not be zero");
            List<Value> out = new ArrayList<>();
            for (long i = start; step > 0 ? i < stop : i > stop; i += step) out.add(Value.integer(i));
            return Value.list(out);
        });

        registerFunction("keys", args -> {
            requireArgCount("keys", args, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.DICT) throw new IllegalArgumentException("keys() expects a dict");
            List<Value> out = new ArrayList<>();
            for (String k : v.asDict().keySet()) out.add(Value.string(k));
            return Value.list(out);
        });

        registerFunction("abs", args -> {
            requireArgCount("abs", args, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.INT) return Value.integer(Math.absExact(v.asInt()));
            return Value.floating(Math.abs(v.asNumber()));
        });

        registerFunction("min", args -> extreme("min", args, -1));
        registerFunction("max", args -> extreme("max", args, 1));

        registerFunction("round", args -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new IllegalArgumentException("round() expects 1 or 2 arguments, got " + args.size());
            }
            double d = args.get(0).asNumber();
            if (args.size() == 1) return Value.integer(Math.round(d));
            long digits = intArg("round", args.get(1));
            double scale = Math.pow(10, digits);
            return Value.floating(Math.round(d * scale) / scale);
        });

        registerFunction("upper", args -> {
            requireArgCount("upper", args, 1);
            return Value.string(args.get(0).asString().toUpperCase());
        });

        registerFunction("lower", args -> {
            requireArgCount("lower", args, 1);
            return Value.string(args.get(0).asString().toLowerCase());
        });

        registerFunction("typeof", args -> {
            requireArgCount("typeof", args, 1);
            return Value.string(args.get(0).typeName());
        });
    }

    private static Value extreme(String name, List<Value> args, int sign) {
        List<Value> items = args;
        if (args.size() == 1 && args.get(0).getType() == Value.Type.LIST) items = args.get(0).asList();
        if (items.isEmpty()) throw new IllegalArgumentException(name + "() expects at least 1 argument");
        Value best = items.get(0);
        for (int i = 1; i < items.size(); i++) {
            Value v = items.get(i);
            if (Double.compare(v.asNumber(), best.asNumber()) * sign > 0) best = v;
        }
        return best;
    }

    private static long intArg(String name, Value v) {
        if (v.getType() != Value.Type.INT) throw new IllegalArgumentException(name + "() expects int arguments, got " + v.typeName());
        return v.asInt();
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new IllegalArgumentException(name + "() expects " + expected + " arguments, got " + args.size());
        }
    }
}
