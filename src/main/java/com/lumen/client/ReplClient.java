package com.lumen.client;

import com.lumen.debug.Debug;
import com.lumen.protocol.FramedJsonTransport;
import com.lumen.protocol.Message;
import com.lumen.protocol.Status;
import com.lumen.protocol.Transport;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking REPL client.
 *
 * - one connection, one background reader
 * - responses are buffered per request id, so requests may overlap
 * - {@link #request(Message)} collects responses until one carries {@code done}
 */
public final class ReplClient implements Closeable {

    private static final String TAG = "ReplClient";
    private static final long DEFAULT_TIMEOUT_MS = 10_000;
    private static final long POLL_MS = 50;

    private final Transport transport;
    private final Map<String, BlockingQueue<Message>> inbox = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final Thread reader;
    private volatile boolean eof;

    public ReplClient(String host, int port) throws IOException {
        this(new FramedJsonTransport(new Socket(host, port)));
    }

    public ReplClient(Transport transport) {
        if (transport == null) throw new IllegalArgumentException("transport is null");
        this.transport = transport;
        this.reader = new Thread(this::readLoop, "lumen-client-reader");
        this.reader.setDaemon(true);
        this.reader.start();
    }

    // -----------------------------
    // Public operations
    // -----------------------------

    /** Send {@code msg}, assigning an id if it has none. Returns the id used. */
    public String send(Message msg) throws IOException {
        String id = msg.id();
        if (id == null) {
            id = "c" + nextId.getAndIncrement();
            msg = msg.with(Message.ID, id);
        }
        queue(id);
        transport.send(msg);
        return id;
    }

    public List<Message> request(Message msg) throws IOException {
        return request(msg, DEFAULT_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }

    public List<Message> request(Message msg, long timeout, TimeUnit unit) throws IOException {
        return responses(send(msg), timeout, unit);
    }

    /** Collect responses for {@code id} up to and including the first one with {@code done}. */
    public List<Message> responses(String id, long timeout, TimeUnit unit) throws IOException {
        List<Message> out = new ArrayList<>();
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            Message m = next(id, deadline);
            out.add(m);
            if (m.hasStatus(Status.DONE)) {
                inbox.remove(id);
                return out;
            }
        }
    }

    /** Next response for {@code id}, waiting up to {@code timeout}. */
    public Message nextResponse(String id, long timeout, TimeUnit unit) throws IOException {
        return next(id, System.nanoTime() + unit.toNanos(timeout));
    }

    /** Create a session; returns its id. */
    public String newSession() throws IOException {
        return cloneSession(null);
    }

    /** Clone {@code session} (a fresh session when null); returns the new session's id. */
    public String cloneSession(String session) throws IOException {
        Message.Builder b = Message.builder().put(Message.OP, "clone").put(Message.SESSION, session);
        for (Message m : request(b.build())) {
            if (m.has("new-session")) return m.getString("new-session");
        }
        throw new IOException("clone returned no new-session");
    }

    public boolean isConnected() { return !eof; }

    // -----------------------------
    // Internals
    // -----------------------------

    private Message next(String id, long deadline) throws IOException {
        BlockingQueue<Message> q = queue(id);
        try {
            while (true) {
                Message m = q.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (m != null) return m;
                if (eof && q.isEmpty()) throw new EOFException("connection closed while waiting for " + id);
                if (System.nanoTime() - deadline > 0) throw new IOException("timed out waiting for response to " + id);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted waiting for " + id);
        }
    }

    private BlockingQueue<Message> queue(String id) {
        return inbox.computeIfAbsent(id == null ? "" : id, k -> new LinkedBlockingQueue<>());
    }

    private void readLoop() {
        try {
            while (true) {
                Message m = transport.receive();
                if (m == null) break; // EOF
                queue(m.id()).add(m);
            }
        } catch (IOException e) {
            if (!eof) Debug.get().d(TAG, "connection ended: " + e.getMessage());
        } finally {
            eof = true;
        }
    }

    @Override
    public void close() throws IOException {
        eof = true;
        transport.close();
    }
}
