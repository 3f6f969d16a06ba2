import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.lumen.client.ReplClient;
import com.lumen.protocol.Message;
import com.lumen.protocol.Status;

public class SessionMiddlewareTest {

    private final LocalRepl repl = new LocalRepl();
    private final ReplClient client = repl.client;

    @AfterEach
    void close() throws Exception {
        repl.close();
    }

    private List<Message> eval(String session, String code) throws Exception {
        return client.request(Message.of("op", "eval", "session", session, "code", code));
    }

    @Test
    void clone_creates_a_registered_session() throws Exception {
        List<Message> r = client.request(Message.of("op", "clone"));

        assertEquals(1, r.size());
        String id = r.get(0).getString("new-session");
        assertNotNull(id);
        assertEquals(List.of(Status.DONE), r.get(0).status());
        assertNotNull(repl.server.sessions().get(id));
    }

    @Test
    void clone_copies_the_source_bindings_but_not_later_changes() throws Exception {
        String s1 = client.newSession();
        eval(s1, "(in-ns 'cloned.ns) 7");

        String s2 = client.cloneSession(s1);
        assertNotEquals(s1, s2);
        assertEquals("cloned.ns", eval(s2, "1").get(0).getString("ns"));
        assertEquals("7", eval(s2, "*2").get(0).getString("value"));

        eval(s1, "(in-ns 'user)");
        assertEquals("cloned.ns", eval(s2, "2").get(0).getString("ns"));
    }

    @Test
    void fresh_sessions_start_in_user() throws Exception {
        String s = client.newSession();
        assertEquals("user", eval(s, "1").get(0).getString("ns"));
    }

    @Test
    void ls_sessions_lists_registered_sessions() throws Exception {
        String a = client.newSession();
        String b = client.newSession();

        List<Message> r = client.request(Message.of("op", "ls-sessions"));
        @SuppressWarnings("unchecked")
        List<String> sessions = (List<String>) r.get(0).get("sessions");

        assertEquals(2, sessions.size());
        assertTrue(sessions.contains(a));
        assertTrue(sessions.contains(b));
    }

    @Test
    void close_removes_the_session() throws Exception {
        String s = client.newSession();

        List<Message> r = client.request(Message.of("op", "close", "session", s));
        assertEquals(List.of(Status.SESSION_CLOSED, Status.DONE), r.get(0).status());
        assertNull(repl.server.sessions().get(s));

        List<Message> after = eval(s, "1");
        assertEquals(List.of(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE), after.get(0).status());
    }

    @Test
    void close_interrupts_the_running_eval() throws Exception {
        String s = client.newSession();
        client.send(Message.of("op", "eval", "id", "doomed", "session", s, "code", "(sleep 30000)"));
        long deadline = System.currentTimeMillis() + 5000;
        while (!"doomed".equals(repl.server.sessions().get(s).interruptSlot().activeId())) {
            assertTrue(System.currentTimeMillis() < deadline);
            Thread.sleep(5);
        }

        client.request(Message.of("op", "close", "session", s));

        List<Message> r = client.responses("doomed", 5, TimeUnit.SECONDS);
        assertEquals(1, r.size());
        assertEquals(List.of(Status.INTERRUPTED, Status.DONE), r.get(0).status());
    }

    @Test
    void close_discards_evals_queued_behind_the_running_one() throws Exception {
        String s = client.newSession();
        client.send(Message.of("op", "eval", "id", "sleeper", "session", s, "code", "(sleep 30000)"));
        long deadline = System.currentTimeMillis() + 5000;
        while (!"sleeper".equals(repl.server.sessions().get(s).interruptSlot().activeId())) {
            assertTrue(System.currentTimeMillis() < deadline);
            Thread.sleep(5);
        }
        client.send(Message.of("op", "eval", "id", "queued", "session", s, "code", "(def leaked 1) 42"));

        List<Message> closed = client.request(Message.of("op", "close", "session", s));
        assertEquals(List.of(Status.SESSION_CLOSED, Status.DONE), closed.get(0).status());

        List<Message> sleeper = client.responses("sleeper", 5, TimeUnit.SECONDS);
        assertEquals(List.of(Status.INTERRUPTED, Status.DONE), sleeper.get(sleeper.size() - 1).status());

        List<Message> queued = client.responses("queued", 5, TimeUnit.SECONDS);
        assertEquals(1, queued.size(), queued.toString());
        assertEquals(List.of(Status.SESSION_CLOSED, Status.DONE), queued.get(0).status());
        assertNull(queued.get(0).get("value"));

        // The discarded eval never touched the shared runtime.
        List<Message> lookup = eval(client.newSession(), "leaked");
        assertTrue(lookup.get(0).status().contains(Status.EVAL_ERROR), lookup.toString());
    }

    @Test
    void unknown_session_is_rejected() throws Exception {
        List<Message> r = client.request(Message.of("op", "eval", "session", "no-such-session", "code", "1"));
        assertEquals(1, r.size());
        assertEquals(List.of(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE), r.get(0).status());
    }

    @Test
    void unknown_op_is_reported() throws Exception {
        List<Message> r = client.request(Message.of("op", "frobnicate"));
        assertEquals(List.of(Status.ERROR, Status.UNKNOWN_OP, Status.DONE), r.get(0).status());
        assertEquals("frobnicate", r.get(0).getString("op"));
    }
}
