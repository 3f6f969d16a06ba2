package com.lumen.script;

import java.util.Collections;
import java.util.Map;

/** Error raised by user code ({@code ex-info}) or by the runtime while evaluating a form. */
public class ScriptException extends RuntimeException {

    private final Map<Object, Object> data;

    public ScriptException(String message) {
        this(message, Collections.emptyMap(), null);
    }

    public ScriptException(String message, Throwable cause) {
        this(message, Collections.emptyMap(), cause);
    }

    public ScriptException(String message, Map<Object, Object> data, Throwable cause) {
        super(message, cause);
        this.data = (data == null) ? Collections.emptyMap() : data;
    }

    public Map<Object, Object> data() { return data; }
}
