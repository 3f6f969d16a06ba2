import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.lumen.client.ReplClient;
import com.lumen.protocol.Message;
import com.lumen.protocol.Status;

public class AddStdinMiddlewareTest {

    private LocalRepl repl;
    private ReplClient client;
    private String session;

    @BeforeEach
    void connect() throws Exception {
        repl = new LocalRepl();
        client = repl.client;
        session = client.newSession();
    }

    @AfterEach
    void disconnect() throws Exception {
        repl.close();
    }

    private List<Message> stdin(String text) throws Exception {
        return client.request(Message.of("op", "stdin", "session", session, "stdin", text));
    }

    private List<Message> eval(String code) throws Exception {
        return client.request(Message.of("op", "eval", "session", session, "code", code));
    }

    @Test
    void read_line_consumes_input_sent_earlier() throws Exception {
        assertEquals(List.of(Status.DONE), stdin("hello\nworld\n").get(0).status());

        assertEquals("\"hello\"", eval("(read-line)").get(0).getString("value"));
        assertEquals("\"world\"", eval("(read-line)").get(0).getString("value"));
    }

    @Test
    void blocked_read_asks_for_input_and_resumes_when_it_arrives() throws Exception {
        client.send(Message.of("op", "eval", "id", "reader", "session", session, "code", "(str \"got \" (read-line))"));

        Message ask = client.nextResponse("reader", 5, TimeUnit.SECONDS);
        assertEquals(List.of(Status.NEED_INPUT), ask.status());
        assertEquals(session, ask.session());

        stdin("typed\n");

        List<Message> rest = client.responses("reader", 5, TimeUnit.SECONDS);
        assertEquals("\"got typed\"", rest.get(0).getString("value"));
        assertEquals(List.of(Status.DONE), rest.get(rest.size() - 1).status());
    }

    @Test
    void interrupt_wakes_a_read_blocked_on_input() throws Exception {
        client.send(Message.of("op", "eval", "id", "reader", "session", session, "code", "(read-line) 99"));
        assertEquals(List.of(Status.NEED_INPUT), client.nextResponse("reader", 5, TimeUnit.SECONDS).status());

        List<Message> r = client.request(Message.of("op", "interrupt", "session", session, "interrupt-id", "reader"));
        assertEquals(List.of(Status.INTERRUPTED, Status.DONE), r.get(0).status());

        List<Message> reader = client.responses("reader", 5, TimeUnit.SECONDS);
        assertEquals(1, reader.size(), reader.toString());
        assertEquals(List.of(Status.INTERRUPTED, Status.DONE), reader.get(0).status());

        // The session is usable and still reads from the same buffer.
        stdin("later\n");
        assertEquals("\"later\"", eval("(read-line)").get(0).getString("value"));
    }

    @Test
    void empty_stdin_ends_the_input() throws Exception {
        stdin("partial");
        stdin("");

        assertEquals("\"partial\"", eval("(read-line)").get(0).getString("value"));
        assertEquals("nil", eval("(read-line)").get(0).getString("value"));
    }

    @Test
    void stdin_needs_a_registered_session() throws Exception {
        List<Message> r = client.request(Message.of("op", "stdin", "stdin", "x\n"));
        assertEquals(List.of(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE), r.get(0).status());
    }
}
