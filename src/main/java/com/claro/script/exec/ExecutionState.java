package com.claro.script.exec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.claro.debug.ConsoleDebugSink;
import com.claro.debug.Debug;
import com.claro.debug.DebugLevel;
import com.claro.debug.DebugSink;
import com.claro.script.parser.Evaluator;

/**
 * Everything shared by all statements of one run (or one interactive session):
 * global environment, output buffer, function table, call stack and collaborators.
 * Single-threaded; a host that runs programs concurrently needs one state per run.
 */
public class ExecutionState {

    private final Environment globals;
    private final FunctionTable functions;
    private final Evaluator evaluator;
    private final LineInput input;
    private final int maxCallDepth;
    private final String inputPrompt;
    private final boolean prettyTrace;

    private final List<String> output = new ArrayList<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<>();

    // debug settings in force before DEBUG ON; null while DEBUG is off
    private DebugSink sinkBeforeDebug;
    private DebugLevel levelBeforeDebug;

    public ExecutionState(Environment globals, FunctionTable functions, Evaluator evaluator, LineInput input,
                          int maxCallDepth, String inputPrompt, boolean prettyTrace) {
        if (globals == null) throw new IllegalArgumentException("globals is null");
        if (functions == null) throw new IllegalArgumentException("functions is null");
        if (evaluator == null) throw new IllegalArgumentException("evaluator is null");
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be positive, got " + maxCallDepth);
        this.globals = globals;
        this.functions = functions;
        this.evaluator = evaluator;
        this.input = input;
        this.maxCallDepth = maxCallDepth;
        this.inputPrompt = (inputPrompt == null) ? "Enter value for %s: " : inputPrompt;
        this.prettyTrace = prettyTrace;
    }

    public Environment globals() { return globals; }

    public FunctionTable functions() { return functions; }

    public Evaluator evaluator() { return evaluator; }

    public LineInput input() { return input; }

    public int maxCallDepth() { return maxCallDepth; }

    public String inputPrompt() { return inputPrompt; }

    public boolean prettyTrace() { return prettyTrace; }

    public Deque<CallFrame> callStack() { return callStack; }

    public void emit(String text) {
        output.add(text);
    }

    /** Output produced so far, in order. */
    public List<String> output() {
        return new ArrayList<>(output);
    }

    /** Returns the buffered output and clears the buffer. */
    public List<String> drainOutput() {
        List<String> out = new ArrayList<>(output);
        output.clear();
        return out;
    }

    /**
     * DEBUG ON: traces every statement. A console sink already installed by the host is
     * raised to TRACE; otherwise a stderr console sink is installed until DEBUG OFF.
     */
    public void debugOn() {
        if (sinkBeforeDebug != null) return;
        DebugSink sink = Debug.get().getSink();
        sinkBeforeDebug = sink;
        if (sink instanceof ConsoleDebugSink) {
            levelBeforeDebug = ((ConsoleDebugSink) sink).getMinLevel();
            ((ConsoleDebugSink) sink).setMinLevel(DebugLevel.TRACE);
        } else {
            levelBeforeDebug = null;
            Debug.get().setSink(new ConsoleDebugSink(DebugLevel.TRACE));
        }
    }

    /** DEBUG OFF: puts back the sink and level that were in force before DEBUG ON. */
    public void debugOff() {
        if (sinkBeforeDebug == null) return;
        if (levelBeforeDebug != null) {
            ((ConsoleDebugSink) sinkBeforeDebug).setMinLevel(levelBeforeDebug);
        } else {
            Debug.get().setSink(sinkBeforeDebug);
        }
        sinkBeforeDebug = null;
        levelBeforeDebug = null;
    }

    public boolean isDebugOn() {
        return sinkBeforeDebug != null;
    }
}
