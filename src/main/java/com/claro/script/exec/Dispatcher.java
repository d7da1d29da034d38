package com.claro.script.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.claro.debug.Debug;
import com.claro.script.parser.ExpressionException;
import com.claro.script.parser.Value;

/**
 * Executes one statement of a line sequence and tells the caller where to continue.
 *
 * A dispatcher is bound to one line sequence (the program, or one function body) and one
 * environment (the globals, or one call frame). Block keywords are resolved against the
 * bound sequence only, so a function body's IF/WHILE/FOR/TRY never looks outside the body.
 */
public class Dispatcher {
    private static final String TAG = "Dispatcher";

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String[] HELP_TEXT = {
            "Available commands:",
            "  PRINT <expr>                          print a value",
            "  VARIABLE|SET <name> = <expr>          bind a variable",
            "  STRING|LIST|DICT <name> = <expr>      bind a typed variable",
            "  GET <name>                            show one variable",
            "  CONCAT <dest> <a> <b>                 join two variables into a string",
            "  INPUT <name> [prompt]                 read a line into a variable",
            "  REPEAT <count> <statement>            run one statement several times",
            "  IF <cond> ... [ELSE ...] END          conditional block",
            "  WHILE <cond> ... END                  loop while the condition holds",
            "  FOR <var> = <a> TO <b> [STEP <s>] ... END",
            "  FOR <var> IN <expr> ... END           loop over a list, dict, string or range",
            "  BREAK | CONTINUE                      leave or restart the innermost loop",
            "  FUNC <name> [params...] ... END       define a function",
            "  CALL <name> [args...] [INTO <var>]    call a function",
            "  RETURN [expr]                         return from a function",
            "  TRY ... [EXCEPT [var] ...] [FINALLY ...] END",
            "  TRACE                                 show variables and functions as JSON",
            "  STACK                                 show the function call stack",
            "  DEBUG ON|OFF                          trace every statement to stderr",
            "  HELP                                  show this list",
            "  EXIT                                  stop the program"
    };

    private static final Pattern CALL_INTO =
            Pattern.compile("^(?:(.*)\\s+)?INTO\\s+([A-Za-z_][A-Za-z0-9_]*)$", Pattern.CASE_INSENSITIVE);

    private final ExecutionState state;
    private final LineSequence lines;
    private final Environment env;
    private final BlockResolver resolver;
    private final LoopDriver loops;
    private final ExceptionRegionRunner regions;

    public Dispatcher(ExecutionState state, LineSequence lines, Environment env) {
        this.state = state;
        this.lines = lines;
        this.env = env;
        this.resolver = lines.resolver();
        this.loops = new LoopDriver(this);
        this.regions = new ExceptionRegionRunner(this);
    }

    LineSequence lines() { return lines; }

    Environment env() { return env; }

    BlockResolver resolver() { return resolver; }

    /**
     * Runs lines [from, to) in order. Returns NEXT(to) when the range completes, or the
     * first BREAK / CONTINUE / RETURN / HALT raised inside it.
     */
    public Outcome runBlock(int from, int to) {
        int pc = from;
        while (pc < to) {
            Outcome outcome = execute(pc);
            if (!outcome.isNext()) return outcome;
            pc = outcome.nextIndex();
        }
        return Outcome.next(to);
    }

    /** Executes the statement at {@code index}. */
    public Outcome execute(int index) {
        return executeStatement(lines.get(index), index);
    }

    private Outcome executeStatement(SourceLine line, int index) {
        if (!Debug.get().isSilent()) {
            Debug.get().t(TAG, "Executing line " + line.lineNumber() + ": " + line.text());
        }
        StatementKind kind = line.kind();
        if (kind == null) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT,
                    "Invalid statement type: " + firstWord(line), line.lineNumber());
        }
        try {
            return dispatch(kind, line, index);
        } catch (ExpressionException e) {
            throw new ClaroException(ErrorKind.EXPRESSION_ERROR,
                    "Cannot evaluate '" + e.getExpression() + "': " + e.getMessage(), line.lineNumber(), e);
        }
    }

    private Outcome dispatch(StatementKind kind, SourceLine line, int index) {
        switch (kind) {
            case PRINT: return print(line, index);
            case VARIABLE: return assign(line, index, kind);
            case STRING: return assign(line, index, kind);
            case LIST: return assign(line, index, kind);
            case DICT: return assign(line, index, kind);
            case IF: return ifStatement(line, index);
            case ELSE: return elseStatement(line, index);
            case WHILE: return loops.runWhile(line, index);
            case FOR: return loops.runFor(line, index);
            case FUNC: return defineFunction(line, index);
            case CALL: return call(line, index);
            case RETURN: return returnStatement(line);
            case TRY: return regions.run(line, index);
            case BREAK: return Outcome.breakLoop(line.lineNumber());
            case CONTINUE: return Outcome.continueLoop(line.lineNumber());
            case INPUT: return input(line, index);
            case REPEAT: return repeat(line, index);
            case TRACE: return trace(index);
            case STACK: return stack(index);
            case DEBUG: return debug(line, index);
            case GET: return get(line, index);
            case CONCAT: return concat(line, index);
            case HELP: return help(index);
            case EXIT: return Outcome.halt();
            case COMMENT: return Outcome.next(index + 1);
            case END: return Outcome.next(index + 1);
            case EXCEPT:
            case FINALLY:
                throw new ClaroException(ErrorKind.INVALID_STATEMENT,
                        line.keyword() + " without a matching TRY", line.lineNumber());
            default:
                throw new ClaroException(ErrorKind.INVALID_STATEMENT,
                        "Unsupported statement: " + line.keyword(), line.lineNumber());
        }
    }

    // ------------------------------------------------------------------
    // Simple statements
    // ------------------------------------------------------------------

    private Outcome print(SourceLine line, int index) {
        if (!line.hasArgument()) throw missing(line, "PRINT statement requires an argument");
        state.emit(evaluate(line.argument()).display());
        return Outcome.next(index + 1);
    }

    /** VARIABLE/SET, STRING, LIST and DICT: "name = value", or the legacy "name value". */
    private Outcome assign(SourceLine line, int index, StatementKind kind) {
        String[] target = splitAssignment(line);
        String name = target[0];
        String text = target[1];

        Value value;
        switch (kind) {
            case STRING:
                value = Value.string(evaluate(text).display());
                break;
            case LIST:
                value = evaluate(text);
                if (value.getType() != Value.Type.LIST) {
                    throw new ClaroException(ErrorKind.TYPE_MISMATCH,
                            "LIST requires a list value, got " + value.typeName(), line.lineNumber());
                }
                break;
            case DICT: {
                String literal = (text.startsWith("{") && text.endsWith("}")) ? text : "{" + text + "}";
                value = evaluate(literal);
                if (value.getType() != Value.Type.DICT) {
                    throw new ClaroException(ErrorKind.TYPE_MISMATCH,
                            "DICT requires a dict value, got " + value.typeName(), line.lineNumber());
                }
                break;
            }
            default:
                value = evaluate(text);
        }
        env.define(name, value);
        return Outcome.next(index + 1);
    }

    private String[] splitAssignment(SourceLine line) {
        String usage = line.keyword() + " statement requires a name and a value";
        String arg = line.argument();
        int split = 0;
        while (split < arg.length() && (Character.isLetterOrDigit(arg.charAt(split)) || arg.charAt(split) == '_')) {
            split++;
        }
        String name = arg.substring(0, split);
        if (name.isEmpty() || !IDENTIFIER.matcher(name).matches()) throw missing(line, usage);

        String rest = arg.substring(split).trim();
        if (rest.startsWith("=") && !rest.startsWith("==")) {
            rest = rest.substring(1).trim();
        } else if (split < arg.length() && !Character.isWhitespace(arg.charAt(split))) {
            throw missing(line, usage);
        }
        if (rest.isEmpty()) throw missing(line, usage);
        return new String[] { name, rest };
    }

    private Outcome input(SourceLine line, int index) {
        if (!line.hasArgument()) throw missing(line, "INPUT statement requires a variable name");
        String arg = line.argument();
        int split = SourceLine.indexOfWhitespace(arg);
        String name = (split < 0) ? arg : arg.substring(0, split);
        if (!IDENTIFIER.matcher(name).matches()) throw missing(line, "INPUT statement requires a variable name");

        String prompt = (split < 0) ? String.format(state.inputPrompt(), name) : unquote(arg.substring(split).trim());
        LineInput in = state.input();
        if (in == null) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT, "INPUT is not available: no line input configured", line.lineNumber());
        }
        String read;
        try {
            read = in.readLine(prompt);
        } catch (ClaroException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ClaroException(ErrorKind.INPUT_ERROR,
                    "Cannot read input for '" + name + "': " + e.getMessage(), line.lineNumber(), e);
        }
        env.define(name, Value.string(read == null ? "" : read.trim()));
        return Outcome.next(index + 1);
    }

    private Outcome returnStatement(SourceLine line) {
        Value value = line.hasArgument() ? evaluate(line.argument()) : Value.none();
        return Outcome.returnValue(value, line.lineNumber());
    }

    /** REPEAT n statement: runs a single-line statement n times. */
    private Outcome repeat(SourceLine line, int index) {
        String arg = line.argument();
        int split = SourceLine.indexOfWhitespace(arg);
        if (split < 0) throw missing(line, "REPEAT statement requires a count and a statement");

        Value count = evaluate(arg.substring(0, split));
        if (count.getType() != Value.Type.INT || count.asInt() < 0) {
            throw new ClaroException(ErrorKind.TYPE_MISMATCH,
                    "REPEAT count must be a non-negative integer, got " + count.repr(), line.lineNumber());
        }

        String inner = arg.substring(split).trim();
        SourceLine innerLine = new SourceLine(inner, line.lineNumber());
        StatementKind innerKind = innerLine.kind();
        if (innerKind != null && (innerKind.opensBlock() || innerKind.isBlockClause())) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT,
                    "REPEAT cannot run block statement " + innerLine.keyword(), line.lineNumber());
        }

        for (long i = 0; i < count.asInt(); i++) {
            Outcome outcome = executeStatement(innerLine, index);
            if (!outcome.isNext()) return outcome;
        }
        return Outcome.next(index + 1);
    }

    private Outcome trace(int index) {
        state.emit(StateSnapshot.toJson(state, env, state.prettyTrace()));
        return Outcome.next(index + 1);
    }

    private Outcome stack(int index) {
        StringBuilder sb = new StringBuilder("main");
        for (Iterator<CallFrame> it = state.callStack().descendingIterator(); it.hasNext();) {
            sb.append(" > ").append(it.next());
        }
        state.emit(sb.toString());
        return Outcome.next(index + 1);
    }

    private Outcome debug(SourceLine line, int index) {
        String arg = line.argument().toUpperCase();
        if (arg.equals("ON")) {
            state.debugOn();
        } else if (arg.equals("OFF")) {
            state.debugOff();
        } else {
            throw missing(line, "Usage: DEBUG ON|OFF");
        }
        return Outcome.next(index + 1);
    }

    private Outcome get(SourceLine line, int index) {
        String name = line.argument();
        if (!IDENTIFIER.matcher(name).matches()) throw missing(line, "GET statement requires a variable name");
        Value value = env.get(name);
        state.emit(value == null
                ? "Variable '" + name + "' is not defined."
                : "Variable '" + name + "' = " + value.repr());
        return Outcome.next(index + 1);
    }

    /** CONCAT dest a b: an undefined source variable contributes nothing. */
    private Outcome concat(SourceLine line, int index) {
        String[] names = line.argument().split("\\s+");
        if (names.length != 3) throw missing(line, "CONCAT statement requires a destination and two variable names");
        for (String name : names) {
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new ClaroException(ErrorKind.INVALID_STATEMENT, "Invalid variable name in CONCAT: " + name, line.lineNumber());
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < names.length; i++) {
            Value part = env.get(names[i]);
            if (part != null) {
                sb.append(part.display());
            } else {
                Debug.get().d(TAG, "CONCAT at line " + line.lineNumber() + ": '" + names[i] + "' is not defined");
            }
        }
        env.define(names[0], Value.string(sb.toString()));
        return Outcome.next(index + 1);
    }

    private Outcome help(int index) {
        for (String text : HELP_TEXT) state.emit(text);
        return Outcome.next(index + 1);
    }

    // ------------------------------------------------------------------
    // IF / ELSE
    // ------------------------------------------------------------------

    private Outcome ifStatement(SourceLine line, int index) {
        if (!line.hasArgument()) throw missing(line, "IF statement requires a condition");
        // resolve first so an unterminated IF fails even when its condition is true
        int elseOrEnd = resolver.findElseOrClose(index);
        if (evaluate(line.argument()).isTruthy()) {
            return Outcome.next(index + 1);
        }
        // ELSE: run its body next. END: continue after it.
        return Outcome.next(elseOrEnd + 1);
    }

    /** Reached by falling out of a true IF branch, or by a stray ELSE: skip the ELSE body. */
    private Outcome elseStatement(SourceLine line, int index) {
        if (line.hasArgument()) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT, "ELSE takes no arguments", line.lineNumber());
        }
        int owner = resolver.findElseOwner(index);
        return Outcome.next(resolver.findClose(owner) + 1);
    }

    // ------------------------------------------------------------------
    // FUNC / CALL
    // ------------------------------------------------------------------

    private Outcome defineFunction(SourceLine line, int index) {
        List<String> signature = new ArrayList<>();
        for (String part : line.argument().split("[\\s,()]+")) {
            if (!part.isEmpty()) signature.add(part);
        }
        if (signature.isEmpty()) {
            throw new ClaroException(ErrorKind.FUNCTION_DEFINITION_ERROR,
                    "FUNC statement requires a name", line.lineNumber());
        }

        Set<String> params = new LinkedHashSet<>();
        for (String token : signature) {
            if (!IDENTIFIER.matcher(token).matches()) {
                throw new ClaroException(ErrorKind.FUNCTION_DEFINITION_ERROR,
                        "Invalid name in FUNC signature: " + token, line.lineNumber());
            }
        }
        String name = signature.get(0);
        for (String p : signature.subList(1, signature.size())) {
            if (!params.add(p)) {
                throw new ClaroException(ErrorKind.FUNCTION_DEFINITION_ERROR,
                        "Duplicate parameter '" + p + "' in FUNC " + name, line.lineNumber());
            }
        }

        int end;
        try {
            end = resolver.findClose(index);
        } catch (ClaroException e) {
            if (e.getKind() != ErrorKind.UNTERMINATED_BLOCK) throw e;
            throw new ClaroException(ErrorKind.FUNCTION_DEFINITION_ERROR,
                    "FUNC " + name + " has no matching END", line.lineNumber(), e);
        }

        state.functions().define(new UserFunction(name, new ArrayList<>(params), lines.slice(index + 1, end), line.lineNumber()));
        return Outcome.next(end + 1);
    }

    /** CALL name [arg...] [INTO var] */
    private Outcome call(SourceLine line, int index) {
        if (!line.hasArgument()) throw missing(line, "CALL statement requires a function name");
        String arg = line.argument();
        int split = SourceLine.indexOfWhitespace(arg);
        String name = (split < 0) ? arg : arg.substring(0, split);
        String rest = (split < 0) ? "" : arg.substring(split).trim();

        String into = null;
        Matcher m = CALL_INTO.matcher(rest);
        if (m.matches()) {
            into = m.group(2);
            rest = (m.group(1) == null) ? "" : m.group(1).trim();
        }

        UserFunction fn = state.functions().get(name);
        if (fn == null) {
            throw new ClaroException(ErrorKind.UNDEFINED_FUNCTION,
                    "Function '" + name + "' is not defined", line.lineNumber());
        }

        List<String> argTexts = ArgumentSplitter.split(rest);
        if (argTexts.size() != fn.params().size()) {
            throw new ClaroException(ErrorKind.ARITY_MISMATCH,
                    "Function '" + name + "' expects " + fn.params().size() + " argument(s), got " + argTexts.size(),
                    line.lineNumber());
        }

        List<Value> args = new ArrayList<>(argTexts.size());
        for (String text : argTexts) args.add(evaluate(text));

        Outcome outcome = fn.call(state, env, args, line.lineNumber());
        if (outcome.kind() == Outcome.Kind.HALT) return outcome;

        if (into != null) {
            env.define(into, outcome.kind() == Outcome.Kind.RETURN ? outcome.value() : Value.none());
        }
        return Outcome.next(index + 1);
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    Value evaluate(String expression) {
        return state.evaluator().evaluate(expression, env.view());
    }

    static ClaroException missing(SourceLine line, String message) {
        return new ClaroException(ErrorKind.MISSING_ARGUMENT, message, line.lineNumber());
    }

    private static String firstWord(SourceLine line) {
        int split = SourceLine.indexOfWhitespace(line.text());
        return (split < 0) ? line.text() : line.text().substring(0, split);
    }

    private static String unquote(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '"' || first == '\'') && first == last) return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
