package com.lumen.middleware;

import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;
import com.lumen.session.InterruptOutcome;
import com.lumen.session.Session;
import com.lumen.session.SessionRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the {@code session} field of every request to a {@link Session} and serves
 * the session lifecycle ops. Requests without a session get a transient one that lives
 * for that request only.
 */
public final class SessionMiddleware implements Middleware {

    public static final String NAME = "session";

    private static final Descriptor DESCRIPTOR = Descriptor.builder(NAME)
            .handles("clone", new OpDoc(
                    "Clones the current session, returning the ID of the newly-created session.",
                    null,
                    map("session", "The ID of the session to be cloned; if not provided, a new session with default bindings is created."),
                    map("new-session", "The ID of the new session.")))
            .handles("close", new OpDoc(
                    "Closes the specified session, interrupting any evaluation it is running.",
                    map("session", "The ID of the session to be closed."),
                    null, null))
            .handles("ls-sessions", new OpDoc(
                    "Lists the IDs of all active sessions.",
                    null, null,
                    map("sessions", "A list of all available session IDs.")))
            .build();

    private final SessionRegistry registry;

    public SessionMiddleware(SessionRegistry registry) {
        if (registry == null) throw new IllegalArgumentException("registry is null");
        this.registry = registry;
    }

    @Override
    public Descriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Handler wrap(Handler next) {
        return request -> {
            Message msg = request.message();
            String sessionId = msg.session();
            Session session = null;
            if (sessionId != null) {
                session = registry.get(sessionId);
                if (session == null) {
                    request.reply(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE);
                    return;
                }
            }

            switch (String.valueOf(request.op())) {
                case "clone": {
                    Session created = (session == null) ? registry.create() : registry.cloneOf(session);
                    request.send(Responses.responseFor(msg)
                            .put("new-session", created.id())
                            .put(Message.STATUS, Responses.status(Status.DONE))
                            .build());
                    return;
                }
                case "close": {
                    if (session == null) {
                        request.reply(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE);
                        return;
                    }
                    // Queued evals are answered as they are discarded; the running one is interrupted.
                    InterruptOutcome outcome = registry.close(session);
                    if (outcome.kind() == InterruptOutcome.Kind.INTERRUPTED) {
                        request.send(Message.builder()
                                .put(Message.ID, outcome.taskId())
                                .put(Message.SESSION, session.id())
                                .put(Message.STATUS, Responses.status(Status.INTERRUPTED, Status.DONE))
                                .build());
                    }
                    request.reply(Status.SESSION_CLOSED, Status.DONE);
                    return;
                }
                case "ls-sessions": {
                    request.send(Responses.responseFor(msg)
                            .put("sessions", registry.ids())
                            .put(Message.STATUS, Responses.status(Status.DONE))
                            .build());
                    return;
                }
                default:
                    next.handle(request.withSession(session != null ? session : registry.transientSession()));
            }
        };
    }

    static Map<String, String> map(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }
}
