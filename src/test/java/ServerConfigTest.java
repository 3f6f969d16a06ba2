import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.lumen.middleware.MiddlewareCatalog;
import com.lumen.middleware.MiddlewareConfigurationException;
import com.lumen.protocol.FramedJsonTransport;
import com.lumen.server.ReplServer;
import com.lumen.server.ServerConfig;

public class ServerConfigTest {

    @Test
    void defaults() {
        ServerConfig c = ServerConfig.fromArgs();
        assertEquals(0, c.port());
        assertEquals("127.0.0.1", c.bind());
        assertEquals(0, c.threads());
        assertEquals(FramedJsonTransport.DEFAULT_MAX_FRAME, c.maxFrame());
        assertEquals(MiddlewareCatalog.DEFAULT_STACK, c.middleware());
    }

    @Test
    void flags_are_parsed() {
        ServerConfig c = ServerConfig.fromArgs("--port=7888", "--bind=0.0.0.0", "--threads=16",
                "--max-frame=1024", "--middleware=session, interruptible-eval");
        assertEquals(7888, c.port());
        assertEquals("0.0.0.0", c.bind());
        assertEquals(16, c.threads());
        assertEquals(1024, c.maxFrame());
        assertEquals(List.of("session", "interruptible-eval"), c.middleware());
    }

    @Test
    void bad_flags_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("--colour=blue"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("--port=abc"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("--port=70000"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("--threads=-1"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("--threads=1"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("--threads=2"));
        assertEquals(ServerConfig.MIN_FIXED_THREADS, ServerConfig.fromArgs("--threads=3").threads());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs("stray"));
    }

    @Test
    void unsatisfiable_stack_fails_at_startup() {
        ServerConfig c = ServerConfig.fromArgs("--middleware=interruptible-eval");
        assertThrows(MiddlewareConfigurationException.class, () -> new ReplServer(c));
    }
}
