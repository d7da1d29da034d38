package com.claro.script.exec;

import java.util.List;

import com.claro.script.parser.Value;

/** One active function invocation, kept on the call stack for STACK and depth checks. */
public class CallFrame {
    private final String functionName;
    private final List<Value> arguments;

    CallFrame(String functionName, List<Value> arguments) {
        this.functionName = functionName;
        this.arguments = arguments;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(functionName).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i).repr());
        }
        return sb.append(')').toString();
    }
}
