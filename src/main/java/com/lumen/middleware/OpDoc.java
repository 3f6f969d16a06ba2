package com.lumen.middleware;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Documentation of one op, as reported by {@code describe}. */
public final class OpDoc {
    private final String doc;
    private final Map<String, String> requires;
    private final Map<String, String> optional;
    private final Map<String, String> returns;

    public OpDoc(String doc, Map<String, String> requires, Map<String, String> optional, Map<String, String> returns) {
        this.doc = doc;
        this.requires = copy(requires);
        this.optional = copy(optional);
        this.returns = copy(returns);
    }

    public static OpDoc of(String doc) {
        return new OpDoc(doc, null, null, null);
    }

    public String doc() { return doc; }
    public Map<String, String> requires() { return requires; }
    public Map<String, String> optional() { return optional; }
    public Map<String, String> returns() { return returns; }

    /** Wire form for {@code describe}. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("doc", doc);
        m.put("requires", requires);
        m.put("optional", optional);
        m.put("returns", returns);
        return m;
    }

    private static Map<String, String> copy(Map<String, String> m) {
        return (m == null) ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}
