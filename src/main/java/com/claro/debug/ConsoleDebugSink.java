package com.claro.debug;

import java.io.PrintStream;

/**
 * Writes "[LEVEL] tag: message" lines to a stream (stderr by default).
 * The minimum level can be changed at runtime, which is how DEBUG ON|OFF works.
 */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;
    private volatile DebugLevel minLevel;

    public ConsoleDebugSink(DebugLevel minLevel) {
        this(System.err, minLevel);
    }

    public ConsoleDebugSink(PrintStream out, DebugLevel minLevel) {
        if (out == null) throw new IllegalArgumentException("out is null");
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.WARN : minLevel;
    }

    public DebugLevel getMinLevel() {
        return minLevel;
    }

    public void setMinLevel(DebugLevel minLevel) {
        this.minLevel = (minLevel == null) ? DebugLevel.WARN : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null && level.atLeast(DebugLevel.ERROR) && minLevel == DebugLevel.TRACE) {
            error.printStackTrace(out);
        }
    }
}
