package com.lumen.protocol;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process transport. {@link #pair()} returns two connected ends: what one end sends,
 * the other receives, in order. Closing either end ends the stream for both.
 */
public final class LocalTransport implements Transport {

    private static final Message EOF = Message.of("op", "__eof__");

    private final BlockingQueue<Message> inbox;
    private final BlockingQueue<Message> outbox;
    private final AtomicBoolean closed;

    private LocalTransport(BlockingQueue<Message> inbox, BlockingQueue<Message> outbox, AtomicBoolean closed) {
        this.inbox = inbox;
        this.outbox = outbox;
        this.closed = closed;
    }

    public static LocalTransport[] pair() {
        BlockingQueue<Message> a = new LinkedBlockingQueue<>();
        BlockingQueue<Message> b = new LinkedBlockingQueue<>();
        AtomicBoolean closed = new AtomicBoolean(false);
        return new LocalTransport[] {
                new LocalTransport(a, b, closed),
                new LocalTransport(b, a, closed)
        };
    }

    @Override
    public Message receive() throws IOException {
        try {
            Message m = inbox.take();
            if (m == EOF) {
                inbox.offer(EOF); // keep end-of-stream sticky for later receivers
                return null;
            }
            return m;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while receiving", e);
        }
    }

    /** Like {@link #receive()} but gives up after the timeout, returning null. */
    public Message receive(long timeout, TimeUnit unit) throws IOException {
        try {
            Message m = inbox.poll(timeout, unit);
            if (m == EOF) {
                inbox.offer(EOF);
                return null;
            }
            return m;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while receiving", e);
        }
    }

    @Override
    public void send(Message message) throws IOException {
        if (closed.get()) throw new IOException("transport closed");
        outbox.offer(message);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            inbox.offer(EOF);
            outbox.offer(EOF);
        }
    }
}
