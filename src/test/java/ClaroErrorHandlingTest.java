import org.junit.jupiter.api.Test;

import com.claro.script.ClaroScript;
import com.claro.script.RunResult;
import com.claro.script.exec.ClaroException;
import com.claro.script.exec.ErrorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClaroErrorHandlingTest {

    private static ClaroException fails(String... lines) {
        return assertThrows(ClaroException.class, () -> new ClaroScript().run(String.join("\n", lines)));
    }

    @Test
    public void noReporter_throwsToHost() {
        ClaroException e = fails("PRINT y");
        assertEquals(ErrorKind.EXPRESSION_ERROR, e.getKind());
        assertEquals(1, e.getLineNumber());
        assertTrue(e.getMessage().contains("Undefined variable: y"), e.getMessage());
    }

    @Test
    public void reporter_suppressesAndReturnsPartialResult() {
        ClaroScript es = new ClaroScript();
        List<ClaroException> reported = new ArrayList<>();
        es.setErrorReporter(reported::add);

        RunResult r = assertDoesNotThrow(() -> es.run(String.join("\n",
                "VARIABLE a = 1",
                "PRINT 'before'",
                "CALL nothing",
                "PRINT 'after'")));

        assertEquals(1, reported.size());
        assertSame(reported.get(0), r.error());
        assertTrue(r.failed());
        assertEquals(List.of("before"), r.output());
        assertEquals(1L, r.variables().get("a").asInt());
        assertEquals("Error at line 3: UndefinedFunction: Function 'nothing' is not defined", r.error().describe());
    }

    @Test
    public void unterminatedIf_namesIfLine() {
        ClaroException e = fails(
                "VARIABLE x = 1",
                "",
                "# the IF below never closes",
                "IF x > 0",
                "PRINT x");
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, e.getKind());
        assertEquals(4, e.getLineNumber());
    }

    @Test
    public void unterminatedIf_evenWhenConditionFalse() {
        ClaroException e = fails(
                "IF False",
                "PRINT 1");
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, e.getKind());
        assertEquals(1, e.getLineNumber());
    }

    @Test
    public void unknownKeyword_isInvalidStatement() {
        ClaroException e = fails(
                "PRINT 1",
                "",
                "FROBNICATE 3");
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
        assertEquals(3, e.getLineNumber());
        assertTrue(e.getMessage().contains("FROBNICATE"));
    }

    @Test
    public void missingArguments() {
        for (String src : Arrays.asList("PRINT", "VARIABLE", "VARIABLE x", "VARIABLE x =", "VARIABLE 9 = 1",
                "INPUT", "CALL", "IF", "WHILE", "FOR", "REPEAT 3", "DEBUG maybe")) {
            String program = src.startsWith("IF") || src.startsWith("WHILE") || src.startsWith("FOR")
                    ? src + "\nEND" : src;
            ClaroException e = assertThrows(ClaroException.class, () -> new ClaroScript().run(program), src);
            assertEquals(ErrorKind.MISSING_ARGUMENT, e.getKind(), src);
            assertEquals(1, e.getLineNumber(), src);
        }
    }

    @Test
    public void listStatement_requiresList() {
        ClaroException e = fails("LIST xs = 'abc'");
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    public void repeat_rejectsBadCountsAndBlocks() {
        assertEquals(ErrorKind.TYPE_MISMATCH, fails("REPEAT -1 PRINT 1").getKind());
        assertEquals(ErrorKind.TYPE_MISMATCH, fails("REPEAT 'x' PRINT 1").getKind());
        assertEquals(ErrorKind.INVALID_STATEMENT, fails("REPEAT 2 IF True").getKind());
    }

    @Test
    public void elseWithArguments_isInvalid() {
        ClaroException e = fails(
                "IF True",
                "PRINT 1",
                "ELSE IF False",
                "END");
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    public void inputWithoutLineInput_isReported() {
        ClaroException e = fails("INPUT name");
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
    }

    @Test
    public void expressionErrorWrapsCause() {
        ClaroException e = fails(
                "VARIABLE d = {'a': 1}",
                "PRINT d['missing']");
        assertEquals(2, e.getLineNumber());
        assertNotNull(e.getCause());
        assertTrue(e.describe().startsWith("Error at line 2: ExpressionError:"), e.describe());
    }

    @Test
    public void recoverability() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind != ErrorKind.MISPLACED_CONTROL, kind.isRecoverable(), kind.name());
        }
    }
}
