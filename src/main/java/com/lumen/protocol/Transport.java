package com.lumen.protocol;

import java.io.Closeable;
import java.io.IOException;

/**
 * Bidirectional, ordered message channel.
 *
 * {@link #receive()} blocks for the next message and returns null at end-of-stream.
 * {@link #send(Message)} may be called from many threads; messages sent by a single
 * caller are delivered in the order they were sent.
 */
public interface Transport extends Closeable {

    Message receive() throws IOException;

    void send(Message message) throws IOException;
}
