package com.claro.script.exec;

/** Error taxonomy of the statement engine. */
public enum ErrorKind {
    INVALID_STATEMENT("InvalidStatement", true),
    MISSING_ARGUMENT("MissingArgument", true),
    FUNCTION_DEFINITION_ERROR("FunctionDefinitionError", true),
    UNTERMINATED_BLOCK("UnterminatedBlock", true),
    UNDEFINED_FUNCTION("UndefinedFunction", true),
    ARITY_MISMATCH("ArityMismatch", true),
    TYPE_MISMATCH("TypeMismatch", true),
    NOT_ITERABLE("NotIterable", true),
    EXPRESSION_ERROR("ExpressionError", true),
    RECURSION_LIMIT_EXCEEDED("RecursionLimitExceeded", true),
    /** The host's line input failed while INPUT was reading. */
    INPUT_ERROR("InputError", true),
    /** BREAK/CONTINUE outside every loop, RETURN outside a function. Never caught by TRY. */
    MISPLACED_CONTROL("MisplacedControl", false);

    private final String displayName;
    private final boolean recoverable;

    ErrorKind(String displayName, boolean recoverable) {
        this.displayName = displayName;
        this.recoverable = recoverable;
    }

    public String displayName() {
        return displayName;
    }

    /** Whether an EXCEPT clause may catch this kind. */
    public boolean isRecoverable() {
        return recoverable;
    }
}
