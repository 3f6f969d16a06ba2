package com.lumen.middleware;

import com.lumen.protocol.Message;
import com.lumen.protocol.Status;
import com.lumen.session.Session;

/**
 * Serves {@code stdin}: appends the request's text to the session's input, where a
 * blocked {@code read-line} picks it up.
 */
public final class AddStdinMiddleware implements Middleware {

    public static final String NAME = "add-stdin";

    private static final Descriptor DESCRIPTOR = Descriptor.builder(NAME)
            .requires(SessionMiddleware.NAME)
            .expects("eval")
            .handles("stdin", new OpDoc(
                    "Add content from the value of \"stdin\" to *in* in the current session.",
                    SessionMiddleware.map(
                            "session", "The ID of the session whose input receives the content.",
                            "stdin", "Content to add to *in*. Empty or absent marks the end of input."),
                    null,
                    SessionMiddleware.map("status",
                            "A status of \"need-input\" will be sent if a session's *in* requires content in order to satisfy an attempted read operation.")))
            .build();

    @Override
    public Descriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Handler wrap(Handler next) {
        return request -> {
            if (!"stdin".equals(request.op())) {
                next.handle(request);
                return;
            }
            Message msg = request.message();
            Session session = request.session();
            // A transient session would drop the text as soon as this request ends.
            if (msg.session() == null || session == null) {
                request.reply(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE);
                return;
            }
            session.in().add(msg.getString("stdin"));
            request.reply(Status.DONE);
        };
    }
}
