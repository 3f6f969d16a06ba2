package com.lumen.session;

import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;
import com.lumen.protocol.Transport;
import com.lumen.script.InputSource;

import java.io.IOException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session standard input. Text arrives through {@code stdin} requests and is consumed a
 * line at a time by the task the session is running.
 *
 * A read that finds no complete line sends {@code {status: [need-input]}} to the request
 * being served and waits. The wait ends when more text arrives or when the reading thread
 * is interrupted, which is how an interrupt reaches a task blocked on input.
 */
public final class SessionInput implements InputSource {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final StringBuilder buffer = new StringBuilder();
    private boolean eof;
    private volatile Transport transport;
    private volatile Message request;

    /** Send later {@code need-input} notices to {@code request} on {@code transport}. */
    public void redirect(Transport transport, Message request) {
        this.transport = transport;
        this.request = request;
    }

    /** Append {@code text}; null or empty marks the end of input. */
    public void add(String text) {
        lock.lock();
        try {
            if (text == null || text.isEmpty()) eof = true;
            else buffer.append(text);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Characters buffered and not yet read. */
    public int available() {
        lock.lock();
        try {
            return buffer.length();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next line, without {@code \n} or {@code \r\n}. At end of input the unterminated rest
     * is returned, then null once; reads after that wait for new input again.
     */
    @Override
    public String readLine() throws IOException, InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                int nl = buffer.indexOf("\n");
                if (nl >= 0) {
                    String line = buffer.substring(0, nl);
                    buffer.delete(0, nl + 1);
                    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
                }
                if (eof) {
                    if (buffer.length() > 0) {
                        String rest = buffer.toString();
                        buffer.setLength(0);
                        return rest;
                    }
                    eof = false;
                    return null;
                }
                needInput();
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    private void needInput() throws IOException {
        Transport t = transport;
        Message req = request;
        if (t == null || req == null) return;
        t.send(Responses.responseFor(req).put(Message.STATUS, Responses.status(Status.NEED_INPUT)).build());
    }
}
