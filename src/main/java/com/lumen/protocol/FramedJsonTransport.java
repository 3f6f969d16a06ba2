package com.lumen.protocol;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Framed-JSON transport:
 * Frame = uint32_be length + UTF-8 JSON object payload
 */
public final class FramedJsonTransport implements Transport {

    public static final int DEFAULT_MAX_FRAME = 32 * 1024 * 1024;

    private static final ObjectMapper om = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final int maxFrame;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FramedJsonTransport(Socket socket) throws IOException {
        this(socket, DEFAULT_MAX_FRAME);
    }

    public FramedJsonTransport(Socket socket, int maxFrame) throws IOException {
        this(socket, socket.getInputStream(), socket.getOutputStream(), maxFrame);
    }

    /** Stream-only transport (no socket), e.g. over pipes. */
    public FramedJsonTransport(InputStream in, OutputStream out) {
        this(null, in, out, DEFAULT_MAX_FRAME);
    }

    private FramedJsonTransport(Socket socket, InputStream in, OutputStream out, int maxFrame) {
        if (maxFrame <= 0) throw new IllegalArgumentException("maxFrame must be > 0");
        this.socket = socket;
        this.in = new BufferedInputStream(in);
        this.out = new BufferedOutputStream(out);
        this.maxFrame = maxFrame;
    }

    @Override
    public Message receive() throws IOException {
        byte[] payload = readFrame(in, maxFrame);
        if (payload == null) return null; // EOF
        LinkedHashMap<String, Object> fields = om.readValue(payload, MAP_TYPE);
        return Message.of(fields);
    }

    @Override
    public void send(Message message) throws IOException {
        byte[] bytes = om.writeValueAsBytes(message.asMap());
        if (bytes.length > maxFrame) {
            throw new IOException("frame too large: " + bytes.length);
        }
        writeLock.lock();
        try {
            writeFrame(out, bytes);
            out.flush();
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) return;
        if (socket != null) {
            socket.close();
        } else {
            try {
                in.close();
            } finally {
                out.close();
            }
        }
    }

    @Override
    public String toString() {
        return (socket == null) ? "FramedJsonTransport[streams]"
                : "FramedJsonTransport[" + socket.getRemoteSocketAddress() + "]";
    }

    // -------------------------------
    // Framing helpers
    // -------------------------------

    static byte[] readFrame(InputStream in, int maxFrame) throws IOException {
        byte[] lenBuf = in.readNBytes(4);
        if (lenBuf.length == 0) return null;
        if (lenBuf.length < 4) throw new EOFException("partial length header");

        int len = ByteBuffer.wrap(lenBuf).order(ByteOrder.BIG_ENDIAN).getInt();
        if (len < 0 || len > maxFrame) {
            throw new IOException("bad frame length: " + len);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length < len) throw new EOFException("partial frame payload");
        return payload;
    }

    static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        byte[] lenBuf = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(lenBuf);
        out.write(payload);
    }
}
