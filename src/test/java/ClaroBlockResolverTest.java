import org.junit.jupiter.api.Test;

import com.claro.script.exec.BlockResolver;
import com.claro.script.exec.ClaroException;
import com.claro.script.exec.ErrorKind;
import com.claro.script.exec.LineSequence;

import static org.junit.jupiter.api.Assertions.*;

public class ClaroBlockResolverTest {

    private static LineSequence lines(String... src) {
        return LineSequence.fromSource(String.join("\n", src));
    }

    @Test
    public void compaction_keepsOriginalLineNumbers() {
        LineSequence seq = lines(
                "# comment",
                "",
                "PRINT 1",
                "   ",
                "PRINT 2");
        assertEquals(2, seq.size());
        assertEquals(3, seq.get(0).lineNumber());
        assertEquals(5, seq.get(1).lineNumber());
        assertEquals("PRINT 2", seq.get(1).text());
    }

    @Test
    public void findClose_skipsNestedBlocks() {
        LineSequence seq = lines(
                "WHILE x",          // 0
                "IF y",             // 1
                "FOR i IN z",       // 2
                "END",              // 3
                "END",              // 4
                "TRY",              // 5
                "EXCEPT",           // 6
                "END",              // 7
                "END");             // 8
        BlockResolver r = seq.resolver();
        assertEquals(8, r.findClose(0));
        assertEquals(4, r.findClose(1));
        assertEquals(3, r.findClose(2));
        assertEquals(7, r.findClose(5));
    }

    @Test
    public void findElseOrClose_ignoresNestedElse() {
        LineSequence seq = lines(
                "IF a",             // 0
                "IF b",             // 1
                "ELSE",             // 2
                "END",              // 3
                "ELSE",             // 4
                "END");             // 5
        BlockResolver r = seq.resolver();
        assertEquals(4, r.findElseOrClose(0));
        assertEquals(2, r.findElseOrClose(1));
        assertEquals(5, r.findClose(0));
        assertEquals(5, r.findClose(4));
    }

    @Test
    public void findElseOrClose_withoutElseReturnsEnd() {
        BlockResolver r = lines("IF a", "PRINT 1", "END").resolver();
        assertEquals(2, r.findElseOrClose(0));
    }

    @Test
    public void funcCountsTowardNesting() {
        BlockResolver r = lines(
                "IF a",
                "FUNC f x",
                "PRINT x",
                "END",
                "END").resolver();
        assertEquals(4, r.findClose(0));
        assertEquals(3, r.findClose(1));
    }

    @Test
    public void unterminatedBlock_namesOpenerLine() {
        LineSequence seq = lines(
                "PRINT 0",
                "",
                "WHILE x",
                "IF y",
                "END");
        ClaroException e = assertThrows(ClaroException.class, () -> seq.resolver().findClose(1));
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, e.getKind());
        assertEquals(3, e.getLineNumber());
        assertTrue(e.getMessage().startsWith("WHILE"));
    }

    @Test
    public void tryLayout_locatesClauses() {
        LineSequence seq = lines(
                "TRY",              // 0
                "PRINT 1",          // 1
                "TRY",              // 2
                "EXCEPT",           // 3
                "END",              // 4
                "EXCEPT err",       // 5
                "PRINT err",        // 6
                "FINALLY",          // 7
                "PRINT 2",          // 8
                "END");             // 9
        BlockResolver.TryLayout layout = seq.resolver().tryLayout(0);
        assertEquals(5, layout.exceptIndex);
        assertEquals(7, layout.finallyIndex);
        assertEquals(9, layout.endIndex);
        assertEquals(5, layout.tryBodyEnd());
        assertEquals(7, layout.exceptBodyEnd());
        assertEquals(8, layout.finallyBodyStart());
    }

    @Test
    public void tryLayout_withoutClauses() {
        BlockResolver.TryLayout layout = lines("TRY", "PRINT 1", "END").resolver().tryLayout(0);
        assertEquals(-1, layout.exceptIndex);
        assertEquals(-1, layout.finallyIndex);
        assertEquals(2, layout.tryBodyEnd());
        assertEquals(2, layout.finallyBodyStart());
    }

    @Test
    public void tryLayout_rejectsExceptAfterFinally() {
        LineSequence seq = lines("TRY", "FINALLY", "EXCEPT", "END");
        ClaroException e = assertThrows(ClaroException.class, () -> seq.resolver().tryLayout(0));
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    public void results_areStableAcrossRepeatedLookups() {
        LineSequence seq = lines("WHILE a", "PRINT 1", "END");
        BlockResolver r = seq.resolver();
        assertSame(r, seq.resolver());
        assertEquals(2, r.findClose(0));
        assertEquals(2, r.findClose(0));
    }

    @Test
    public void elseOwner_isTheEnclosingIf() {
        LineSequence seq = lines("IF a", "IF b", "ELSE", "END", "ELSE", "END");
        BlockResolver r = seq.resolver();
        assertEquals(1, r.findElseOwner(2));
        assertEquals(0, r.findElseOwner(4));
    }

    @Test
    public void elseInsideWhile_isRejected() {
        LineSequence seq = lines("WHILE a", "PRINT 1", "ELSE", "PRINT 2", "END");
        ClaroException e = assertThrows(ClaroException.class, () -> seq.resolver().findElseOwner(2));
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
        assertEquals(3, e.getLineNumber());
        assertEquals("ELSE without IF", e.getMessage());
    }

    @Test
    public void elseAtTopLevel_isRejected() {
        LineSequence seq = lines("PRINT 1", "ELSE", "PRINT 2");
        ClaroException e = assertThrows(ClaroException.class, () -> seq.resolver().findElseOwner(1));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    public void secondElse_isRejectedWhenTheIfIsResolved() {
        LineSequence seq = lines("IF a", "PRINT 1", "ELSE", "PRINT 2", "ELSE", "PRINT 3", "END");
        ClaroException e = assertThrows(ClaroException.class, () -> seq.resolver().findElseOrClose(0));
        assertEquals(ErrorKind.INVALID_STATEMENT, e.getKind());
        assertEquals(5, e.getLineNumber());
    }
}
