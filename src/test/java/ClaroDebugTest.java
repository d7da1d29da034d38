import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.claro.debug.Debug;
import com.claro.script.ClaroScript;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClaroDebugTest {

    @AfterEach
    public void resetDebug() {
        Debug.get().setSink(null);
    }

    @Test
    public void freshlyLoadedHub_isSilentAndLogs() throws Exception {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        try (URLClassLoader loader = new URLClassLoader(new URL[] { classes }, null)) {
            Class<?> fresh = Class.forName("com.claro.debug.Debug", true, loader);
            assertNotSame(Debug.class, fresh);

            Object hub = fresh.getMethod("get").invoke(null);
            assertNotNull(fresh.getMethod("getSink").invoke(hub));
            assertEquals(Boolean.TRUE, fresh.getMethod("isSilent").invoke(hub));
            fresh.getMethod("d", String.class, String.class).invoke(hub, "ClaroDebugTest", "no sink installed");
        }
    }

    @Test
    public void clearingTheSink_fallsBackToSilent() {
        Debug.get().setSink((level, tag, message, error) -> { });
        assertFalse(Debug.get().isSilent());

        Debug.get().setSink(null);
        assertTrue(Debug.get().isSilent());
        assertNotNull(Debug.get().getSink());
    }

    @Test
    public void runWithoutInstalledSink_completes() {
        Debug.get().setSink(null);
        assertEquals(List.of("3"), new ClaroScript().run("VARIABLE x = 1\nPRINT x + 2").output());
    }
}
