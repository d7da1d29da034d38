package com.claro.script;

import java.util.Map;

import com.claro.debug.Debug;
import com.claro.script.exec.ClaroException;
import com.claro.script.exec.Environment;
import com.claro.script.exec.ExecutionState;
import com.claro.script.exec.FunctionTable;
import com.claro.script.exec.LineInput;
import com.claro.script.exec.LineSequence;
import com.claro.script.exec.ProgramDriver;
import com.claro.script.parser.BuiltinFunction;
import com.claro.script.parser.ExpressionEvaluator;
import com.claro.script.parser.Value;

/**
 * Core Claro engine.
 *
 * - Line-oriented statements: PRINT, VARIABLE/SET, STRING, LIST, DICT, INPUT
 * - Blocks closed by END: IF/ELSE, WHILE, FOR, FUNC, TRY/EXCEPT/FINALLY
 * - Functions: FUNC name params... / CALL name args... [INTO var] / RETURN
 * - Expressions: ints, floats, strings, bools, lists, dicts (see ExpressionEvaluator)
 *
 * Each call to {@link #run(String)} starts from an empty environment and function table.
 * Use {@link ClaroSession} to keep state across several pieces of source.
 */
public class ClaroScript {
    private static final String TAG = "ClaroScript";

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private int maxCallDepth;
    private String inputPrompt;
    private boolean traceIndent;
    private LineInput lineInput;
    private ErrorReporter errorReporter;

    public ClaroScript() {
        this(ClaroConfig.defaults());
    }

    public ClaroScript(ClaroConfig config) {
        config.validated("configuration");
        this.maxCallDepth = config.getMaxCallDepth();
        this.inputPrompt = config.getInputPrompt();
        this.traceIndent = config.isTraceIndent();
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("depth must be positive, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** Adds (or replaces) a function callable from expressions. */
    public void registerFunction(String name, BuiltinFunction fn) { evaluator.registerFunction(name, fn); }

    /** Source of INPUT lines; INPUT fails when none is set. */
    public void setLineInput(LineInput input) { this.lineInput = input; }

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - No reporter registered: run errors THROW to the host as ClaroException.
     * - Reporter registered: run errors are passed to it and SUPPRESSED; run(...) returns
     *   the partial result with error() set.
     */
    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    ErrorReporter errorReporter() { return errorReporter; }

    public RunResult run(String source) {
        return run(source, null);
    }

    /** Runs {@code source} with {@code initialEnv} as the starting global variables. */
    public RunResult run(String source, Map<String, Value> initialEnv) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        ExecutionState state = newState(new Environment(initialEnv), new FunctionTable());
        try {
            return execute(state, LineSequence.fromSource(source), errorReporter);
        } finally {
            // a DEBUG ON left active does not outlive a one-shot run
            state.debugOff();
        }
    }

    ExecutionState newState(Environment globals, FunctionTable functions) {
        return new ExecutionState(globals, functions, evaluator, lineInput, maxCallDepth, inputPrompt, traceIndent);
    }

    /** Runs one program against {@code state}, applying the error contract above. */
    static RunResult execute(ExecutionState state, LineSequence program, ErrorReporter reporter) {
        boolean completed;
        try {
            completed = new ProgramDriver(state).run(program);
        } catch (ClaroException e) {
            if (reporter == null) throw e;
            reporter.report(e);
            Debug.get().d(TAG, "Error suppressed by reporter: " + e.describe());
            return new RunResult(state.drainOutput(), state.globals().snapshot(), e, false);
        }
        return new RunResult(state.drainOutput(), state.globals().snapshot(), null, !completed);
    }
}
