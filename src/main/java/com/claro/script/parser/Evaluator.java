package com.claro.script.parser;

import java.util.Map;

/** Evaluates one expression string against a variable mapping. */
public interface Evaluator {
    Value evaluate(String expression, Map<String, Value> variables);
}
