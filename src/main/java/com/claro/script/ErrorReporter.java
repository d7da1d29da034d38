package com.claro.script;

import com.claro.script.exec.ClaroException;

/**
 * Host hook for run errors.
 *
 * Registering a reporter switches the engine from "throw to the host" to "report and
 * suppress": the run stops at the failing line, the reporter is told, and the partial
 * {@link RunResult} is returned.
 */
@FunctionalInterface
public interface ErrorReporter {
    void report(ClaroException error);
}
