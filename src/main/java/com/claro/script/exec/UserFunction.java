package com.claro.script.exec;

import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.claro.debug.Debug;
import com.claro.script.parser.Value;

/** A FUNC definition: parameter names plus the raw body lines, executed only on CALL. */
public class UserFunction {
    private static final String TAG = "UserFunction";

    final String name;
    final List<String> params;
    final LineSequence body;
    final int definedAt;

    UserFunction(String name, List<String> params, LineSequence body, int definedAt) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = body;
        this.definedAt = definedAt;
    }

    public String name() { return name; }

    public List<String> params() { return params; }

    public int definedAt() { return definedAt; }

    /**
     * Runs the body in a copy of {@code caller} with the parameters bound, then merges the
     * copy back into {@code caller}. Returns RETURN (with its value), HALT, or NEXT when the
     * body ran to completion without RETURN.
     */
    Outcome call(ExecutionState state, Environment caller, List<Value> args, int callLine) {
        if (args.size() != params.size()) {
            throw new ClaroException(ErrorKind.ARITY_MISMATCH,
                    "Function '" + name + "' expects " + params.size() + " argument(s), got " + args.size(), callLine);
        }

        Deque<CallFrame> stack = state.callStack();
        if (stack.size() >= state.maxCallDepth()) {
            throw new ClaroException(ErrorKind.RECURSION_LIMIT_EXCEEDED,
                    "Maximum call depth of " + state.maxCallDepth() + " exceeded calling '" + name + "'", callLine);
        }

        Environment frame = caller.childForCall();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i), args.get(i));
        }

        Debug.get().d(TAG, "CALL " + name + " at line " + callLine + " depth " + (stack.size() + 1));
        stack.push(new CallFrame(name, args));
        Outcome outcome;
        try {
            outcome = new Dispatcher(state, body, frame).runBlock(0, body.size());
        } finally {
            stack.pop();
        }

        if (outcome.kind() == Outcome.Kind.BREAK || outcome.kind() == Outcome.Kind.CONTINUE) {
            throw outcome.misplaced();
        }

        caller.mergeFrom(frame);
        return outcome;
    }
}
