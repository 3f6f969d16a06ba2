import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.lumen.client.ReplClient;
import com.lumen.debug.Debug;
import com.lumen.debug.DebugLevel;
import com.lumen.protocol.Message;
import com.lumen.protocol.Status;
import com.lumen.server.ReplServer;
import com.lumen.server.ServerConfig;

/** Round trips over a real socket with framed JSON. */
public class ReplServerTest {

    private ReplServer server;

    @BeforeEach
    void start() throws Exception {
        server = new ReplServer(ServerConfig.fromArgs("--port=0", "--bind=127.0.0.1")).start();
        assertTrue(server.port() > 0);
    }

    @AfterEach
    void stop() throws Exception {
        server.close();
    }

    @Test
    void clone_then_eval_over_socket() throws Exception {
        try (ReplClient client = new ReplClient("127.0.0.1", server.port())) {
            String session = client.newSession();

            List<Message> r = client.request(Message.of("op", "eval", "session", session,
                    "code", "(def greeting \"hi\") (println greeting) (count [1 2 3])"));

            assertEquals("#'user/greeting", r.get(0).getString("value"));
            assertEquals("hi\n", r.get(1).getString("out"));
            assertEquals("nil", r.get(2).getString("value"));
            assertEquals("3", r.get(3).getString("value"));
            assertEquals(List.of(Status.DONE), r.get(4).status());
        }
    }

    @Test
    void saturating_a_fixed_pool_is_reported() throws Exception {
        List<String> warnings = Collections.synchronizedList(new ArrayList<>());
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.WARN && "ReplServer".equals(tag)) warnings.add(message);
        });
        try (ReplServer small = new ReplServer(ServerConfig.fromArgs("--port=0", "--threads=3")).start();
             ReplClient first = new ReplClient("127.0.0.1", small.port())) {
            first.newSession();
            assertTrue(warnings.isEmpty(), warnings.toString());

            try (ReplClient second = new ReplClient("127.0.0.1", small.port())) {
                long deadline = System.currentTimeMillis() + 5000;
                while (warnings.isEmpty() && System.currentTimeMillis() < deadline) Thread.sleep(10);
                assertTrue(warnings.get(0).contains("saturated"), warnings.toString());
            }
        } finally {
            Debug.get().setSink(null);
        }
    }

    @Test
    void sessions_are_shared_between_connections() throws Exception {
        try (ReplClient first = new ReplClient("127.0.0.1", server.port());
             ReplClient second = new ReplClient("127.0.0.1", server.port())) {
            String session = first.newSession();
            first.request(Message.of("op", "eval", "session", session, "code", "(def shared 99)"));

            List<Message> r = second.request(Message.of("op", "eval", "session", session, "code", "shared"));
            assertEquals("99", r.get(0).getString("value"));
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void describe_survives_json_encoding() throws Exception {
        try (ReplClient client = new ReplClient("127.0.0.1", server.port())) {
            Message m = client.request(Message.of("op", "describe", "verbose?", true)).get(0);
            Map<String, Object> ops = (Map<String, Object>) m.get("ops");
            Map<String, Object> eval = (Map<String, Object>) ops.get("eval");
            assertEquals("Evaluates code.", eval.get("doc"));
        }
    }

    @Test
    void closed_connection_does_not_affect_others() throws Exception {
        ReplClient dropped = new ReplClient("127.0.0.1", server.port());
        dropped.newSession();
        dropped.close();

        try (ReplClient client = new ReplClient("127.0.0.1", server.port())) {
            assertEquals("4", client.request(Message.of("op", "eval", "code", "(* 2 2)")).get(0).getString("value"));
        }
    }
}
