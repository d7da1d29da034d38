package com.claro.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.claro.script.exec.ClaroException;
import com.claro.script.parser.Value;

/** Output lines and final global variables of one run, plus the error that stopped it, if any. */
public final class RunResult {
    private final List<String> output;
    private final Map<String, Value> variables;
    private final ClaroException error;
    private final boolean halted;

    RunResult(List<String> output, Map<String, Value> variables, ClaroException error, boolean halted) {
        this.output = Collections.unmodifiableList(output);
        this.variables = Collections.unmodifiableMap(variables);
        this.error = error;
        this.halted = halted;
    }

    public List<String> output() { return output; }

    public Map<String, Value> variables() { return variables; }

    /** Error that aborted the run; null when the run completed. */
    public ClaroException error() { return error; }

    public boolean failed() { return error != null; }

    /** True when the program stopped at EXIT. */
    public boolean halted() { return halted; }

    /** Output joined with newlines. */
    public String text() {
        return String.join("\n", output);
    }

    @Override
    public String toString() {
        return "RunResult{output=" + output + ", variables=" + variables.keySet()
                + (error == null ? "" : ", error=" + error.describe()) + "}";
    }
}
