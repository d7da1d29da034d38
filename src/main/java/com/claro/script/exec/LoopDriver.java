package com.claro.script.exec;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.claro.debug.Debug;
import com.claro.script.parser.Value;

/**
 * WHILE and FOR. The body of a loop opened at index s is [s + 1, end). Each pass runs the
 * body through the owning dispatcher; BREAK and CONTINUE are consumed here, RETURN and
 * HALT travel on to the caller.
 */
final class LoopDriver {
    private static final String TAG = "LoopDriver";

    private static final Pattern FOR_EACH =
            Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s+IN\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOR_COUNT =
            Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+?)\\s+TO\\s+(.+?)(?:\\s+STEP\\s+(.+))?$",
                    Pattern.CASE_INSENSITIVE);

    private final Dispatcher dispatcher;

    LoopDriver(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    Outcome runWhile(SourceLine line, int index) {
        if (!line.hasArgument()) throw Dispatcher.missing(line, "WHILE statement requires a condition");
        int end = dispatcher.resolver().findClose(index);

        while (dispatcher.evaluate(line.argument()).isTruthy()) {
            Outcome body = dispatcher.runBlock(index + 1, end);
            if (body.kind() == Outcome.Kind.BREAK) {
                logBreak(line, body);
                break;
            }
            if (isEscaping(body)) return body;
        }
        return Outcome.next(end + 1);
    }

    Outcome runFor(SourceLine line, int index) {
        if (!line.hasArgument()) throw Dispatcher.missing(line, "FOR statement requires a loop header");
        int end = dispatcher.resolver().findClose(index);
        String header = line.argument();

        Matcher each = FOR_EACH.matcher(header);
        if (each.matches()) {
            return forEach(line, index, end, each.group(1), each.group(2).trim());
        }
        Matcher count = FOR_COUNT.matcher(header);
        if (count.matches()) {
            return forCount(line, index, end, count.group(1), count.group(2), count.group(3), count.group(4));
        }
        throw Dispatcher.missing(line, "FOR statement must be 'FOR var IN expr' or 'FOR var = a TO b [STEP s]'");
    }

    private Outcome forEach(SourceLine line, int index, int end, String var, String expression) {
        Value iterable = dispatcher.evaluate(expression);
        // snapshot first: the body may rebind the iterable
        List<Value> items = iterable.iterationSnapshot();
        if (items == null) {
            throw new ClaroException(ErrorKind.NOT_ITERABLE,
                    "Cannot iterate over " + iterable.typeName() + " value " + iterable.repr(), line.lineNumber());
        }

        Environment env = dispatcher.env();
        for (Value item : items) {
            env.define(var, item);
            Outcome body = dispatcher.runBlock(index + 1, end);
            if (body.kind() == Outcome.Kind.BREAK) {
                logBreak(line, body);
                break;
            }
            if (isEscaping(body)) return body;
        }
        return Outcome.next(end + 1);
    }

    private Outcome forCount(SourceLine line, int index, int end, String var,
                             String fromText, String toText, String stepText) {
        Value from = numeric(line, "start", dispatcher.evaluate(fromText));
        Value to = numeric(line, "end", dispatcher.evaluate(toText));
        Value step = (stepText == null) ? Value.integer(1) : numeric(line, "step", dispatcher.evaluate(stepText));

        boolean integral = from.getType() == Value.Type.INT
                && to.getType() == Value.Type.INT
                && step.getType() == Value.Type.INT;
        if (step.asNumber() == 0) {
            throw new ClaroException(ErrorKind.TYPE_MISMATCH, "FOR step must not be zero", line.lineNumber());
        }

        Environment env = dispatcher.env();
        if (integral) {
            long stop = to.asInt();
            long inc = step.asInt();
            // distances are compared unsigned so a bound near Long.MAX_VALUE never wraps the counter
            long magnitude = (inc > 0) ? inc : -inc;
            long i = from.asInt();
            boolean more = (inc > 0) ? i <= stop : i >= stop;
            while (more) {
                env.define(var, Value.integer(i));
                Outcome body = dispatcher.runBlock(index + 1, end);
                if (body.kind() == Outcome.Kind.BREAK) {
                    logBreak(line, body);
                    break;
                }
                if (isEscaping(body)) return body;
                long remaining = (inc > 0) ? stop - i : i - stop;
                more = Long.compareUnsigned(remaining, magnitude) >= 0;
                i += inc;
            }
        } else {
            double stop = to.asNumber();
            double inc = step.asNumber();
            for (double d = from.asNumber(); inc > 0 ? d <= stop : d >= stop; d += inc) {
                env.define(var, Value.floating(d));
                Outcome body = dispatcher.runBlock(index + 1, end);
                if (body.kind() == Outcome.Kind.BREAK) {
                    logBreak(line, body);
                    break;
                }
                if (isEscaping(body)) return body;
            }
        }
        return Outcome.next(end + 1);
    }

    private static Value numeric(SourceLine line, String role, Value v) {
        if (!v.isNumeric()) {
            throw new ClaroException(ErrorKind.TYPE_MISMATCH,
                    "FOR " + role + " must be a number, got " + v.typeName(), line.lineNumber());
        }
        return v;
    }

    private static void logBreak(SourceLine loop, Outcome signal) {
        Debug.get().d(TAG, loop.keyword() + " at line " + loop.lineNumber() + " left by BREAK at line " + signal.lineNumber());
    }

    /** RETURN and HALT leave the loop; NEXT and CONTINUE start the next pass. */
    private static boolean isEscaping(Outcome body) {
        return body.kind() == Outcome.Kind.RETURN || body.kind() == Outcome.Kind.HALT;
    }
}
