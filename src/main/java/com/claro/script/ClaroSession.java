package com.claro.script;

import com.claro.script.exec.Environment;
import com.claro.script.exec.ExecutionState;
import com.claro.script.exec.FunctionTable;
import com.claro.script.exec.LineSequence;
import com.claro.script.exec.SourceLine;
import com.claro.script.exec.StatementKind;

/**
 * Interactive execution: variables and functions persist from one entry to the next.
 *
 * An entry that opens a block (IF, WHILE, FOR, FUNC, TRY) is buffered together with the
 * following entries until its END closes it; the whole block then runs as one program.
 * Line numbers count every entered line, so errors point at the line as typed.
 * An error never ends the session: it is reported through the result and the next entry
 * starts from the state left behind.
 */
public final class ClaroSession {

    private final ExecutionState state;
    private final ErrorReporter reporter;

    private final StringBuilder pending = new StringBuilder();
    private int pendingDepth;
    private int pendingFirstLine;
    private int linesEntered;

    public ClaroSession(ClaroScript engine) {
        this.state = engine.newState(new Environment(), new FunctionTable());
        ErrorReporter hostReporter = engine.errorReporter();
        this.reporter = (hostReporter != null) ? hostReporter : error -> { /* carried by RunResult */ };
    }

    /**
     * Accepts one line of input.
     *
     * @return the result of running the completed entry, or null while a block is still open
     */
    public RunResult feed(String line) {
        linesEntered++;
        String trimmed = (line == null) ? "" : line.trim();

        if (pending.length() == 0) pendingFirstLine = linesEntered;
        pending.append(trimmed).append('\n');

        if (!trimmed.isEmpty() && !LineSequence.isComment(trimmed)) {
            StatementKind kind = new SourceLine(trimmed, linesEntered).kind();
            if (kind != null && kind.opensBlock()) {
                pendingDepth++;
            } else if (kind == StatementKind.END && pendingDepth > 0) {
                pendingDepth--;
            }
        }
        if (pendingDepth > 0) return null;

        String source = pending.toString();
        pending.setLength(0);
        return ClaroScript.execute(state, LineSequence.fromSource(source, pendingFirstLine), reporter);
    }

    /** True while an open block is being collected. */
    public boolean isBuffering() {
        return pendingDepth > 0;
    }

    /** Drops a partially entered block. */
    public void reset() {
        pending.setLength(0);
        pendingDepth = 0;
    }

    public Environment globals() {
        return state.globals();
    }

    public FunctionTable functions() {
        return state.functions();
    }
}
