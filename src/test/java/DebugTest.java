import com.graphoid.debug.Debug;
import com.graphoid.debug.DebugLevel;
import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.ErrorKind;
import com.graphoid.script.errors.GraphoidException;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @Test
    void defaultSinkIsInstalledBeforeAnyEmbedderSetsOne() {
        assertNotNull(Debug.get().getSink());
        Debug.get().e("test", "nobody listening");
    }

    @Test
    void engineErrorsStayTypedWithoutASink() {
        GraphoidException ex = assertThrows(GraphoidException.class, () -> new Graphoid().executeSource("y"));
        assertEquals(ErrorKind.RUNTIME, ex.getKind());
        assertEquals(1.0, new Graphoid().executeSource("x = 1\nx").asNumber(), 1e-9);
    }

    @Test
    void clearingTheSinkFallsBackToNoop() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Debug.get().setSink(Debug.printStreamSink(new PrintStream(buf, true, StandardCharsets.UTF_8), DebugLevel.WARN));
        try {
            Debug.get().d("test", "hidden");
            Debug.get().w("test", "shown");
        } finally {
            Debug.get().setSink(null);
        }
        assertEquals("[WARN] test: shown", buf.toString(StandardCharsets.UTF_8).trim());
        assertNotNull(Debug.get().getSink());
        Debug.get().w("test", "dropped");
    }
}
