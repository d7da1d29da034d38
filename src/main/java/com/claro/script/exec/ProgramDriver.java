package com.claro.script.exec;

import com.claro.debug.Debug;

/**
 * Runs a compacted program from its first line to its last against one execution state.
 * A BREAK, CONTINUE or RETURN that reaches the top level is an error; HALT ends the run.
 */
public final class ProgramDriver {
    private static final String TAG = "ProgramDriver";

    private final ExecutionState state;

    public ProgramDriver(ExecutionState state) {
        if (state == null) throw new IllegalArgumentException("state is null");
        this.state = state;
    }

    /**
     * @return true if the program ran to its end, false if it stopped at EXIT
     * @throws ClaroException on the first unhandled error
     */
    public boolean run(LineSequence program) {
        Dispatcher top = new Dispatcher(state, program, state.globals());
        try {
            Outcome outcome = top.runBlock(0, program.size());
            switch (outcome.kind()) {
                case NEXT:
                    return true;
                case HALT:
                    Debug.get().d(TAG, "Program halted by EXIT");
                    return false;
                default:
                    throw outcome.misplaced();
            }
        } catch (ClaroException e) {
            Debug.get().d(TAG, "Run aborted: " + e.describe());
            throw e;
        }
    }
}
