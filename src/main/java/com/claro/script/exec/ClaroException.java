package com.claro.script.exec;

/**
 * Runtime error raised while executing a Claro program.
 * Always carries the 1-based line number of the source line that raised it.
 */
public class ClaroException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int lineNumber;

    public ClaroException(ErrorKind kind, String message, int lineNumber) {
        super(message);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public ClaroException(ErrorKind kind, String message, int lineNumber, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /** "Error at line 3: UndefinedFunction: Function 'foo' is not defined" */
    public String describe() {
        return "Error at line " + lineNumber + ": " + kind.displayName() + ": " + getMessage();
    }

    @Override
    public String toString() {
        return describe();
    }
}
