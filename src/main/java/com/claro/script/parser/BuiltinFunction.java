package com.claro.script.parser;

import java.util.List;

/** Functional interface for built-in expression functions. */
@FunctionalInterface
public interface BuiltinFunction {
    Value call(List<Value> args);
}
