package com.lumen.middleware;

import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves {@code describe}: the ops of the pipeline that dispatched the request, the
 * order of its middleware and version information.
 */
public final class DescribeMiddleware implements Middleware {

    public static final String NAME = "describe";
    public static final String VERSION = "0.1.0";

    private static final Descriptor DESCRIPTOR = Descriptor.builder(NAME)
            .handles("describe", new OpDoc(
                    "Produce a machine- and human-readable directory and documentation for the operations supported by this endpoint.",
                    null,
                    SessionMiddleware.map("verbose?", "Include informational detail for each \"op\"eration in the return message."),
                    SessionMiddleware.map(
                            "ops", "Map of \"op\"erations supported by this endpoint.",
                            "middleware", "Names of the installed middleware, outermost first.",
                            "versions", "Map containing version maps, e.g. {\"java\" {\"version-string\" \"17.0.2\"}}")))
            .build();

    @Override
    public Descriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Handler wrap(Handler next) {
        return request -> {
            if (!NAME.equals(request.op())) {
                next.handle(request);
                return;
            }
            Message msg = request.message();
            boolean verbose = isTrue(msg.get("verbose?"));
            ComposedPipeline pipeline = request.pipeline();

            Map<String, Object> ops = new LinkedHashMap<>();
            for (Map.Entry<String, OpDoc> e : pipeline.ops().entrySet()) {
                ops.put(e.getKey(), verbose ? e.getValue().toMap() : Collections.emptyMap());
            }
            request.send(Responses.responseFor(msg)
                    .put("ops", ops)
                    .put("middleware", pipeline.names())
                    .put("versions", versions())
                    .put(Message.STATUS, Responses.status(Status.DONE))
                    .build());
        };
    }

    static Map<String, Object> versions() {
        Map<String, Object> versions = new LinkedHashMap<>();
        versions.put("lumen", version(VERSION));
        versions.put("java", version(System.getProperty("java.version")));
        return versions;
    }

    private static Map<String, Object> version(String versionString) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("version-string", versionString);
        return m;
    }

    private static boolean isTrue(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean) return (Boolean) v;
        String s = String.valueOf(v).trim();
        return !s.isEmpty() && !"false".equalsIgnoreCase(s) && !"0".equals(s);
    }
}
