package com.claro.script.exec;

import com.claro.debug.Debug;
import com.claro.script.parser.Value;

/**
 * TRY [EXCEPT [name]] [FINALLY] END.
 *
 * A recoverable error raised in the TRY body hands control to the EXCEPT body (or is
 * simply dropped when there is none). The FINALLY body runs exactly once on every way
 * out of the block: normal completion, a handled error, an unhandled error, or a
 * BREAK / CONTINUE / RETURN / HALT leaving the block. A non-NEXT outcome of FINALLY
 * replaces whatever was leaving the block.
 */
final class ExceptionRegionRunner {
    private static final String TAG = "TryBlock";

    private final Dispatcher dispatcher;

    ExceptionRegionRunner(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    Outcome run(SourceLine line, int index) {
        if (line.hasArgument()) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT, "TRY takes no arguments", line.lineNumber());
        }
        BlockResolver.TryLayout layout = dispatcher.resolver().tryLayout(index);
        String errorVariable = exceptVariable(layout);

        Outcome guarded;
        try {
            guarded = guarded(layout, errorVariable);
        } catch (RuntimeException e) {
            Outcome fin = runFinally(layout);
            if (!fin.isNext()) return fin;
            throw e;
        }

        Outcome fin = runFinally(layout);
        if (!fin.isNext()) return fin;
        return guarded.isNext() ? Outcome.next(layout.endIndex + 1) : guarded;
    }

    /** TRY body, and EXCEPT body when the TRY body raised a recoverable error. */
    private Outcome guarded(BlockResolver.TryLayout layout, String errorVariable) {
        try {
            return dispatcher.runBlock(layout.tryIndex + 1, layout.tryBodyEnd());
        } catch (ClaroException e) {
            if (!e.getKind().isRecoverable()) throw e;
            Debug.get().i(TAG, "Caught " + e.describe());
            if (layout.exceptIndex < 0) return Outcome.next(layout.endIndex + 1);

            if (errorVariable != null) {
                dispatcher.env().define(errorVariable, Value.string(e.getMessage()));
            }
            return dispatcher.runBlock(layout.exceptIndex + 1, layout.exceptBodyEnd());
        }
    }

    private Outcome runFinally(BlockResolver.TryLayout layout) {
        if (layout.finallyIndex < 0) return Outcome.next(layout.endIndex + 1);
        return dispatcher.runBlock(layout.finallyBodyStart(), layout.endIndex);
    }

    private String exceptVariable(BlockResolver.TryLayout layout) {
        if (layout.exceptIndex < 0) return null;
        SourceLine except = dispatcher.lines().get(layout.exceptIndex);
        if (!except.hasArgument()) return null;
        if (!Dispatcher.IDENTIFIER.matcher(except.argument()).matches()) {
            throw new ClaroException(ErrorKind.INVALID_STATEMENT,
                    "EXCEPT expects a variable name, got '" + except.argument() + "'", except.lineNumber());
        }
        return except.argument();
    }
}
