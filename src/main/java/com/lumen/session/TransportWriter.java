package com.lumen.session;

import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Transport;

import java.io.IOException;
import java.io.Writer;

/**
 * Session output stream: text written here is buffered and, on {@link #flush()}, sent
 * as one {@code {out: text}} (or {@code err}) response to the request currently being
 * served by the session.
 *
 * Only the task running for the session redirects and writes, so a session's writer is
 * never used by two tasks at once.
 */
public final class TransportWriter extends Writer {

    private final String channel;
    private final StringBuilder buffer = new StringBuilder();
    private volatile Transport transport;
    private volatile Message request;

    public TransportWriter(String channel) {
        this.channel = channel;
    }

    /** Point subsequent output at {@code request}'s transport; pending text goes to the old target first. */
    public synchronized void redirect(Transport transport, Message request) throws IOException {
        flush();
        this.transport = transport;
        this.request = request;
    }

    @Override
    public synchronized void write(char[] cbuf, int off, int len) {
        buffer.append(cbuf, off, len);
    }

    @Override
    public synchronized void flush() throws IOException {
        if (buffer.length() == 0) return;
        String text = buffer.toString();
        buffer.setLength(0);
        Transport t = transport;
        Message req = request;
        if (t == null || req == null) return; // nobody listening
        t.send(Responses.responseFor(req).put(channel, text).build());
    }

    @Override
    public void close() throws IOException {
        flush();
    }
}
