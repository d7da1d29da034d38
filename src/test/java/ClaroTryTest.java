import org.junit.jupiter.api.Test;

import com.claro.script.ClaroScript;
import com.claro.script.RunResult;
import com.claro.script.exec.ClaroException;
import com.claro.script.exec.ErrorKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClaroTryTest {

    private static RunResult run(String... lines) {
        return new ClaroScript().run(String.join("\n", lines));
    }

    @Test
    public void noError_skipsExcept_runsFinally() {
        RunResult r = run(
                "TRY",
                "PRINT 'body'",
                "EXCEPT",
                "PRINT 'handler'",
                "FINALLY",
                "PRINT 'cleanup'",
                "END",
                "PRINT 'after'");
        assertEquals(Arrays.asList("body", "cleanup", "after"), r.output());
    }

    @Test
    public void error_abandonsBody_runsExceptThenFinallyOnce() {
        RunResult r = run(
                "TRY",
                "PRINT 'before'",
                "PRINT 1 / 0",
                "PRINT 'skipped'",
                "EXCEPT",
                "PRINT 'handler'",
                "FINALLY",
                "PRINT 'cleanup'",
                "END",
                "PRINT 'after'");
        assertEquals(Arrays.asList("before", "handler", "cleanup", "after"), r.output());
    }

    @Test
    public void error_withoutExcept_stillRunsFinallyOnce_andContinues() {
        RunResult r = run(
                "TRY",
                "CALL nowhere",
                "FINALLY",
                "PRINT 'cleanup'",
                "END",
                "PRINT 'after'");
        assertEquals(Arrays.asList("cleanup", "after"), r.output());
    }

    @Test
    public void exceptVariable_receivesMessage() {
        RunResult r = run(
                "TRY",
                "CALL nowhere",
                "EXCEPT err",
                "PRINT 'caught: ' + err",
                "END");
        assertEquals(List.of("caught: Function 'nowhere' is not defined"), r.output());
    }

    @Test
    public void catchAlias() {
        RunResult r = run(
                "TRY",
                "LIST xs = 5",
                "CATCH",
                "PRINT 'bad list'",
                "END");
        assertEquals(List.of("bad list"), r.output());
    }

    @Test
    public void errorInExcept_propagatesAfterFinally() {
        ClaroScript es = new ClaroScript();
        es.setErrorReporter(e -> { });
        RunResult r = es.run(String.join("\n",
                "TRY",
                "PRINT missing",
                "EXCEPT",
                "PRINT alsoMissing",
                "FINALLY",
                "PRINT 'cleanup'",
                "END",
                "PRINT 'after'"));
        assertEquals(List.of("cleanup"), r.output());
        assertEquals(ErrorKind.EXPRESSION_ERROR, r.error().getKind());
        assertEquals(4, r.error().getLineNumber());
    }

    @Test
    public void errorInsideCalledFunction_isCaughtByCallersTry() {
        RunResult r = run(
                "FUNC risky",
                "VARIABLE touched = True",
                "PRINT 1 // 0",
                "END",
                "TRY",
                "CALL risky",
                "EXCEPT e",
                "PRINT 'recovered'",
                "END");
        assertEquals(List.of("recovered"), r.output());
        // merge-out happens only when the call completes
        assertNull(r.variables().get("touched"));
    }

    @Test
    public void nestedTry_innerHandlesItsOwnError() {
        RunResult r = run(
                "TRY",
                "TRY",
                "PRINT nope",
                "EXCEPT",
                "PRINT 'inner'",
                "END",
                "PRINT 'outer body continues'",
                "EXCEPT",
                "PRINT 'outer'",
                "END");
        assertEquals(Arrays.asList("inner", "outer body continues"), r.output());
    }

    @Test
    public void breakInsideTry_runsFinallyThenLeavesLoop() {
        RunResult r = run(
                "FOR i IN [1, 2, 3]",
                "TRY",
                "IF i == 2",
                "BREAK",
                "END",
                "PRINT i",
                "FINALLY",
                "PRINT 'f' + str(i)",
                "END",
                "END");
        assertEquals(Arrays.asList("1", "f1", "f2"), r.output());
    }

    @Test
    public void returnInsideTry_runsFinally() {
        RunResult r = run(
                "FUNC f",
                "TRY",
                "RETURN 'value'",
                "FINALLY",
                "PRINT 'finally'",
                "END",
                "END",
                "CALL f INTO v",
                "PRINT v");
        assertEquals(Arrays.asList("finally", "value"), r.output());
    }

    @Test
    public void misplacedControl_isNotCaught() {
        ClaroException e = assertThrows(ClaroException.class, () -> run(
                "TRY",
                "FUNC bad",
                "BREAK",
                "END",
                "CALL bad",
                "EXCEPT",
                "PRINT 'should not catch'",
                "END"));
        assertEquals(ErrorKind.MISPLACED_CONTROL, e.getKind());
    }

    @Test
    public void recursionLimit_isRecoverable() {
        ClaroScript es = new ClaroScript();
        es.setMaxCallDepth(10);
        RunResult r = es.run(String.join("\n",
                "FUNC loop",
                "CALL loop",
                "END",
                "TRY",
                "CALL loop",
                "EXCEPT err",
                "PRINT 'stopped'",
                "END"));
        assertEquals(List.of("stopped"), r.output());
    }

    @Test
    public void strayExcept_isInvalidStatement() {
        ClaroException e = assertThrows(ClaroException.class, () -> run(
                "PRINT 1",
                "EXCEPT"));
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    public void unterminatedTry() {
        ClaroException e = assertThrows(ClaroException.class, () -> run(
                "TRY",
                "PRINT 1"));
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, e.getKind());
        assertEquals(1, e.getLineNumber());
    }

    @Test
    public void failingLineInput_isCaughtByExcept() {
        ClaroScript es = new ClaroScript();
        es.setLineInput(prompt -> {
            throw new IllegalStateException("terminal closed");
        });
        RunResult r = es.run(String.join("\n",
                "TRY",
                "INPUT name",
                "EXCEPT err",
                "PRINT err",
                "END"));
        assertEquals(List.of("Cannot read input for 'name': terminal closed"), r.output());
    }

    @Test
    public void failingLineInput_reportsTheInputLine() {
        ClaroScript es = new ClaroScript();
        es.setLineInput(prompt -> {
            throw new UncheckedIOException(new IOException("stream closed"));
        });
        List<ClaroException> reported = new ArrayList<>();
        es.setErrorReporter(reported::add);

        RunResult r = es.run("PRINT 'a'\nINPUT name");

        assertEquals(1, reported.size());
        assertEquals(ErrorKind.INPUT_ERROR, r.error().getKind());
        assertEquals(2, r.error().getLineNumber());
        assertEquals(List.of("a"), r.output());
    }
}
