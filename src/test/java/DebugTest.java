import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.lumen.debug.Debug;
import com.lumen.debug.DebugLevel;
import com.lumen.middleware.Descriptor;
import com.lumen.middleware.Handler;
import com.lumen.middleware.Middleware;
import com.lumen.middleware.MiddlewareConfigurationException;
import com.lumen.middleware.Pipeline;

public class DebugTest {

    private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
        Debug.get().setThreshold(DebugLevel.TRACE);
    }

    private void capture(DebugLevel threshold) {
        Debug.get().setThreshold(threshold);
        Debug.get().setSink((level, tag, message, error) -> lines.add(level + " " + tag + " " + message));
    }

    @Test
    void threshold_filters_lower_levels() {
        capture(DebugLevel.WARN);

        Debug.get().d("T", "quiet");
        Debug.get().i("T", "quiet too");
        Debug.get().w("T", "heard");
        Debug.get().e("T", "also heard", new IllegalStateException());

        List<String> mine = new ArrayList<>();
        synchronized (lines) {
            for (String l : lines) if (l.contains(" T ")) mine.add(l);
        }
        assertEquals(List.of("WARN T heard", "ERROR T also heard"), mine);
    }

    @Test
    void clearing_the_sink_falls_back_to_the_no_op_sink() {
        Debug.get().setSink(null);

        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("T", "nobody listens", new IllegalStateException()));
    }

    @Test
    void rejected_pipeline_is_logged_as_error() {
        capture(DebugLevel.INFO);
        Middleware needy = new Middleware() {
            private final Descriptor d = Descriptor.builder("needy").requires("missing").build();

            @Override
            public Descriptor descriptor() { return d; }

            @Override
            public Handler wrap(Handler next) { return next; }
        };

        Pipeline pipeline = new Pipeline();
        assertThrows(MiddlewareConfigurationException.class, () -> pipeline.install(List.of(needy)));

        assertTrue(new ArrayList<>(lines).stream().anyMatch(l -> l.startsWith("ERROR Pipeline rejected pipeline")), lines.toString());
    }
}
