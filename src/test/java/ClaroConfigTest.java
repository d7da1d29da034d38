import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.claro.script.ClaroConfig;
import com.claro.script.ClaroScript;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ClaroConfigTest {

    @Test
    public void defaultsComeFromBundledResource() {
        ClaroConfig c = ClaroConfig.defaults();
        assertEquals(200, c.getMaxCallDepth());
        assertFalse(c.isDebug());
        assertEquals("Enter value for %s: ", c.getInputPrompt());
        assertFalse(c.isTraceIndent());
    }

    @Test
    public void fileOverridesOnlyNamedKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("claro.json");
        Files.writeString(file, "{ \"maxCallDepth\": 12, \"debug\": true }", StandardCharsets.UTF_8);

        ClaroConfig c = ClaroConfig.load(file);
        assertEquals(12, c.getMaxCallDepth());
        assertTrue(c.isDebug());
        assertEquals("Enter value for %s: ", c.getInputPrompt());
    }

    @Test
    public void overlayLeavesOriginalUntouched() throws IOException {
        ClaroConfig base = ClaroConfig.defaults();
        ClaroConfig changed = base.overlay("{\"inputPrompt\": \"? \"}", "inline");
        assertEquals("? ", changed.getInputPrompt());
        assertEquals("Enter value for %s: ", base.getInputPrompt());
    }

    @Test
    public void unknownKeyIsRejected() {
        IOException e = assertThrows(IOException.class,
                () -> ClaroConfig.defaults().overlay("{\"maxDepth\": 3}", "bad.json"));
        assertTrue(e.getMessage().contains("bad.json"), e.getMessage());
        assertTrue(e.getMessage().contains("maxDepth"), e.getMessage());
    }

    @Test
    public void nonPositiveDepthIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ClaroConfig.defaults().overlay("{\"maxCallDepth\": 0}", "zero.json"));
    }

    @Test
    public void engineUsesConfiguredValues() throws IOException {
        ClaroConfig c = ClaroConfig.defaults().overlay("{\"maxCallDepth\": 7, \"inputPrompt\": \"[%s] \"}", "inline");
        ClaroScript es = new ClaroScript(c);
        assertEquals(7, es.getMaxCallDepth());

        String[] seen = new String[1];
        es.setLineInput(prompt -> {
            seen[0] = prompt;
            return "v";
        });
        es.run("INPUT answer");
        assertEquals("[answer] ", seen[0]);
    }

    @Test
    public void promptWithBadFormatIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ClaroConfig.defaults().overlay("{\"inputPrompt\": \"%d> \"}", "prompt.json"));
        assertTrue(e.getMessage().contains("prompt.json"), e.getMessage());
    }

    @Test
    public void promptWithTwoPlaceholdersIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ClaroConfig.defaults().overlay("{\"inputPrompt\": \"%s %s\"}", "prompt.json"));
    }

    @Test
    public void promptSetDirectlyIsCheckedByTheEngine() {
        ClaroConfig c = ClaroConfig.defaults();
        c.setInputPrompt("value %q: ");
        assertThrows(IllegalArgumentException.class, () -> new ClaroScript(c));
    }

    @Test
    public void promptWithoutPlaceholderIsAccepted() throws IOException {
        ClaroConfig c = ClaroConfig.defaults().overlay("{\"inputPrompt\": \"> \"}", "inline");
        assertEquals("> ", c.getInputPrompt());
    }
}
