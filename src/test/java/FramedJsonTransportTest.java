import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.lumen.protocol.FramedJsonTransport;
import com.lumen.protocol.Message;

public class FramedJsonTransportTest {

    @Test
    void frame_is_length_prefixed_json() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new FramedJsonTransport(new ByteArrayInputStream(new byte[0]), bytes)
                .send(Message.of("op", "eval", "code", "(+ 1 2)"));

        byte[] frame = bytes.toByteArray();
        int len = ((frame[0] & 0xff) << 24) | ((frame[1] & 0xff) << 16) | ((frame[2] & 0xff) << 8) | (frame[3] & 0xff);
        assertEquals(frame.length - 4, len);
        assertEquals("{\"op\":\"eval\",\"code\":\"(+ 1 2)\"}",
                new String(frame, 4, len, StandardCharsets.UTF_8));
    }

    @Test
    @SuppressWarnings("unchecked")
    void receive_decodes_nested_values_in_order() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        FramedJsonTransport writer = new FramedJsonTransport(new ByteArrayInputStream(new byte[0]), bytes);
        writer.send(Message.of("id", "1", "status", List.of("done"), "ops", Map.of("eval", Map.of())));
        writer.send(Message.of("id", "2"));

        FramedJsonTransport reader = new FramedJsonTransport(new ByteArrayInputStream(bytes.toByteArray()),
                new ByteArrayOutputStream());
        Message first = reader.receive();
        assertEquals("1", first.id());
        assertEquals(List.of("done"), first.status());
        assertTrue(((Map<String, Object>) first.get("ops")).containsKey("eval"));
        assertEquals("2", reader.receive().id());
        assertNull(reader.receive(), "clean end of stream");
    }

    @Test
    void truncated_frame_is_an_error() {
        byte[] partial = {0, 0, 0, 10, '{', '}'};
        FramedJsonTransport reader = new FramedJsonTransport(new ByteArrayInputStream(partial), new ByteArrayOutputStream());
        assertThrows(IOException.class, reader::receive);
    }

    @Test
    void oversize_length_is_an_error() {
        byte[] huge = {(byte) 0x7f, 0, 0, 0};
        FramedJsonTransport reader = new FramedJsonTransport(new ByteArrayInputStream(huge), new ByteArrayOutputStream());
        assertThrows(IOException.class, reader::receive);
    }
}
