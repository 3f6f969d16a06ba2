package com.lumen.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One request or response: an ordered, immutable mapping of field name to value.
 *
 * Values are whatever the wire codec produces (String, Number, Boolean, List, Map)
 * or whatever a handler puts in a response. Derived messages are built with
 * {@link #with(String, Object)} / {@link #without(String)}; the original is never touched.
 */
public final class Message {

    public static final String OP = "op";
    public static final String ID = "id";
    public static final String SESSION = "session";
    public static final String STATUS = "status";

    private final Map<String, Object> fields;

    private Message(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Message of(Map<String, ?> fields) {
        if (fields == null) throw new IllegalArgumentException("fields is null");
        return new Message(new LinkedHashMap<>(fields));
    }

    /** Alternating key/value pairs: {@code Message.of("op", "eval", "code", "(+ 1 2)")}. */
    public static Message of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Message.of expects key/value pairs");
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new Message(m);
    }

    public static Builder builder() { return new Builder(); }

    public String op() { return getString(OP); }
    public String id() { return getString(ID); }
    public String session() { return getString(SESSION); }

    public boolean has(String key) { return fields.get(key) != null; }

    public Object get(String key) { return fields.get(key); }

    /** String value of a field, or null. Non-string scalars are rendered with String.valueOf. */
    public String getString(String key) {
        Object v = fields.get(key);
        return (v == null) ? null : String.valueOf(v);
    }

    public Integer getInteger(String key) {
        Object v = fields.get(key);
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).intValue();
        try {
            return Integer.valueOf(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + key + "' is not an integer: " + v, e);
        }
    }

    /** Status keywords of a response; empty if none. */
    @SuppressWarnings("unchecked")
    public List<String> status() {
        Object v = fields.get(STATUS);
        if (v == null) return Collections.emptyList();
        if (v instanceof List) return (List<String>) v;
        return Collections.singletonList(String.valueOf(v));
    }

    public boolean hasStatus(String s) {
        return status().contains(s);
    }

    public Message with(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(fields);
        if (value == null) m.remove(key);
        else m.put(key, value);
        return new Message(m);
    }

    public Message without(String key) {
        if (!fields.containsKey(key)) return this;
        Map<String, Object> m = new LinkedHashMap<>(fields);
        m.remove(key);
        return new Message(m);
    }

    /** Unmodifiable, ordered view. */
    public Map<String, Object> asMap() { return fields; }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Message) && fields.equals(((Message) o).fields);
    }

    @Override
    public int hashCode() { return fields.hashCode(); }

    @Override
    public String toString() { return fields.toString(); }

    public static final class Builder {
        private final Map<String, Object> m = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, Object value) {
            if (value != null) m.put(key, value);
            return this;
        }

        public Builder putAll(Map<String, ?> other) {
            if (other != null) {
                for (Map.Entry<String, ?> e : other.entrySet()) put(e.getKey(), e.getValue());
            }
            return this;
        }

        public Message build() { return new Message(m); }
    }
}
