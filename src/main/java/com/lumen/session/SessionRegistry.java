package com.lumen.session;

import com.lumen.debug.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/** The set of live sessions, keyed by id. All sessions share one executor. */
public final class SessionRegistry {

    private static final String TAG = "SessionRegistry";

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Executor executor;
    private final BindingSnapshot defaults;

    public SessionRegistry(Executor executor, BindingSnapshot defaults) {
        if (executor == null) throw new IllegalArgumentException("executor is null");
        this.executor = executor;
        this.defaults = (defaults == null) ? BindingSnapshot.empty() : defaults;
    }

    /** New registered session with default bindings. */
    public Session create() {
        return register(newSession(defaults));
    }

    /** New registered session starting from a copy of {@code source}'s bindings. */
    public Session cloneOf(Session source) {
        return register(newSession(source == null ? defaults : source.bindings()));
    }

    /** A session that is not registered: usable for one request, invisible to others. */
    public Session transientSession() {
        return newSession(defaults);
    }

    public Session get(String id) {
        return (id == null) ? null : sessions.get(id);
    }

    /**
     * Remove {@code session} and stop it (see {@link Session#close()}). Returns how the
     * running task, if any, was interrupted.
     */
    public InterruptOutcome close(Session session) {
        sessions.remove(session.id(), session);
        InterruptOutcome outcome = session.close();
        Debug.get().d(TAG, "closed session " + session.id() + " (" + outcome + ")");
        return outcome;
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>(sessions.keySet());
        Collections.sort(ids);
        return ids;
    }

    public int size() {
        return sessions.size();
    }

    private Session newSession(BindingSnapshot start) {
        // Streams are per session; never inherit the source's.
        Map<String, Object> copy = new LinkedHashMap<>(start.asMap());
        copy.remove(BindingSnapshot.OUT);
        copy.remove(BindingSnapshot.ERR);
        copy.remove(BindingSnapshot.IN);
        return new Session(UUID.randomUUID().toString(), BindingSnapshot.empty().withAll(copy), executor);
    }

    private Session register(Session s) {
        sessions.put(s.id(), s);
        Debug.get().d(TAG, "registered session " + s.id());
        return s;
    }
}
