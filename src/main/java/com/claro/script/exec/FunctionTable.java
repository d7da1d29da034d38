package com.claro.script.exec;

import java.util.LinkedHashMap;
import java.util.Map;

import com.claro.debug.Debug;

/** Process-wide table of FUNC definitions. Redefinition silently replaces the old entry. */
public class FunctionTable {
    private static final String TAG = "FunctionTable";

    private final Map<String, UserFunction> functions = new LinkedHashMap<>();

    public void define(UserFunction fn) {
        UserFunction previous = functions.put(fn.name(), fn);
        if (previous != null) {
            Debug.get().d(TAG, "FUNC " + fn.name() + " at line " + fn.definedAt()
                    + " replaces the definition from line " + previous.definedAt());
        } else {
            Debug.get().d(TAG, "FUNC " + fn.name() + " defined with " + fn.params().size() + " parameter(s)");
        }
    }

    public UserFunction get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }
}
