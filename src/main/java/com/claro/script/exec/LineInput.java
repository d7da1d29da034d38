package com.claro.script.exec;

/** Blocking source of one input line, used by INPUT. Returns null at end of input. */
@FunctionalInterface
public interface LineInput {
    String readLine(String prompt);
}
