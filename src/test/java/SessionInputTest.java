import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.lumen.protocol.LocalTransport;
import com.lumen.protocol.Message;
import com.lumen.protocol.Status;
import com.lumen.session.SessionInput;

public class SessionInputTest {

    @Test
    void lines_are_split_on_newline_and_crlf() throws Exception {
        SessionInput in = new SessionInput();
        in.add("one\r\ntwo\nthr");
        in.add("ee\n");

        assertEquals("one", in.readLine());
        assertEquals("two", in.readLine());
        assertEquals("three", in.readLine());
        assertEquals(0, in.available());
    }

    @Test
    void end_of_input_returns_the_rest_then_null_once() throws Exception {
        SessionInput in = new SessionInput();
        in.add("tail");
        in.add(null);

        assertEquals("tail", in.readLine());
        assertNull(in.readLine());

        in.add("again\n");
        assertEquals("again", in.readLine());
    }

    @Test
    void empty_read_announces_need_input_to_the_current_request() throws Exception {
        LocalTransport[] pair = LocalTransport.pair();
        SessionInput in = new SessionInput();
        in.redirect(pair[0], Message.of("id", "r1", "session", "s1"));

        AtomicReference<String> line = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                line.set(in.readLine());
            } catch (Exception e) {
                line.set("failed: " + e);
            }
        });
        reader.start();

        Message ask = pair[1].receive();
        assertEquals("r1", ask.id());
        assertEquals(List.of(Status.NEED_INPUT), ask.status());

        in.add("ok\n");
        reader.join(5000);
        assertEquals("ok", line.get());
    }

    @Test
    void interrupting_a_blocked_reader_throws_interrupted() throws Exception {
        SessionInput in = new SessionInput();
        CountDownLatch interrupted = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            try {
                in.readLine();
            } catch (InterruptedException e) {
                interrupted.countDown();
            } catch (Exception e) {
                fail(e);
            }
        });
        reader.start();
        Thread.sleep(50);

        reader.interrupt();
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }
}
