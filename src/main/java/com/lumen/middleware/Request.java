package com.lumen.middleware;

import com.lumen.debug.Debug;
import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Transport;
import com.lumen.session.Session;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * A received message together with what the receiving layer attached to it: the
 * transport to answer on, the session it was resolved to (if any) and the pipeline
 * snapshot dispatching it. None of these travel on the wire.
 */
public final class Request {

    private final Message message;
    private final Transport transport;
    private final Session session;
    private final ComposedPipeline pipeline;

    public Request(Message message, Transport transport) {
        this(message, transport, null, null);
    }

    private Request(Message message, Transport transport, Session session, ComposedPipeline pipeline) {
        if (message == null) throw new IllegalArgumentException("message is null");
        if (transport == null) throw new IllegalArgumentException("transport is null");
        this.message = message;
        this.transport = transport;
        this.session = session;
        this.pipeline = pipeline;
    }

    public Message message() { return message; }
    public String op() { return message.op(); }
    public Transport transport() { return transport; }
    public Session session() { return session; }
    public ComposedPipeline pipeline() { return pipeline; }

    public Request withMessage(Message m) { return new Request(m, transport, session, pipeline); }
    public Request withSession(Session s) { return new Request(message, transport, s, pipeline); }
    Request withPipeline(ComposedPipeline p) { return new Request(message, transport, session, p); }

    /**
     * Send on this request's transport. An I/O failure is logged and rethrown unchecked;
     * the connection's own loop notices the broken transport and tears it down.
     */
    public void send(Message response) {
        try {
            transport.send(response);
        } catch (IOException e) {
            Debug.get().w("Request", "failed to send response on " + transport + ": " + e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    /** Send {@code {id, session, status:[statuses...]}}. */
    public void reply(String... statuses) {
        send(Responses.responseFor(message, statuses));
    }

    @Override
    public String toString() { return "Request" + message; }
}
