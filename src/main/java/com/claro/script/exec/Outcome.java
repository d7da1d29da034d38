package com.claro.script.exec;

import com.claro.script.parser.Value;

/**
 * Result of executing one statement or one block.
 *
 * NEXT carries the index of the next line to run. BREAK and CONTINUE travel up to the
 * nearest loop, which consumes them. RETURN travels up to the enclosing call. HALT ends
 * the whole run.
 */
public final class Outcome {

    public enum Kind { NEXT, BREAK, CONTINUE, RETURN, HALT }

    private static final Outcome HALT = new Outcome(Kind.HALT, -1, null, -1);

    private final Kind kind;
    private final int nextIndex;
    private final Value value;
    /** Source line that raised a BREAK/CONTINUE/RETURN, for misplaced-control errors. */
    private final int lineNumber;

    private Outcome(Kind kind, int nextIndex, Value value, int lineNumber) {
        this.kind = kind;
        this.nextIndex = nextIndex;
        this.value = value;
        this.lineNumber = lineNumber;
    }

    public static Outcome next(int index) { return new Outcome(Kind.NEXT, index, null, -1); }
    public static Outcome breakLoop(int lineNumber) { return new Outcome(Kind.BREAK, -1, null, lineNumber); }
    public static Outcome continueLoop(int lineNumber) { return new Outcome(Kind.CONTINUE, -1, null, lineNumber); }
    public static Outcome returnValue(Value value, int lineNumber) { return new Outcome(Kind.RETURN, -1, value, lineNumber); }
    public static Outcome halt() { return HALT; }

    public Kind kind() { return kind; }

    public boolean isNext() { return kind == Kind.NEXT; }

    public int nextIndex() {
        if (kind != Kind.NEXT) throw new IllegalStateException("No next index on " + kind);
        return nextIndex;
    }

    public Value value() {
        if (kind != Kind.RETURN) throw new IllegalStateException("No value on " + kind);
        return value;
    }

    public int lineNumber() { return lineNumber; }

    /** Error for a BREAK/CONTINUE/RETURN that escaped every construct able to consume it. */
    ClaroException misplaced() {
        switch (kind) {
            case BREAK:
                return new ClaroException(ErrorKind.MISPLACED_CONTROL, "BREAK outside of a loop", lineNumber);
            case CONTINUE:
                return new ClaroException(ErrorKind.MISPLACED_CONTROL, "CONTINUE outside of a loop", lineNumber);
            case RETURN:
                return new ClaroException(ErrorKind.MISPLACED_CONTROL, "RETURN outside of a function", lineNumber);
            default:
                throw new IllegalStateException("Outcome " + kind + " is not a control signal");
        }
    }

    @Override
    public String toString() {
        return (kind == Kind.NEXT) ? "NEXT(" + nextIndex + ")" : kind.toString();
    }
}
