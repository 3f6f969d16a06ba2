package com.lumen.middleware;

import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;

import java.util.ArrayList;
import java.util.List;

/**
 * Serves {@code ls-middleware} and {@code swap-middleware}. A swap builds the new stack
 * from catalog names and installs it atomically; requests already in flight finish on
 * the pipeline that dispatched them. The loader keeps itself in every stack it installs.
 */
public final class DynamicLoaderMiddleware implements Middleware {

    public static final String NAME = "dynamic-loader";

    private static final Descriptor DESCRIPTOR = Descriptor.builder(NAME)
            .handles("ls-middleware", new OpDoc(
                    "List of current middleware, outermost first.",
                    null, null,
                    SessionMiddleware.map("middleware", "list of middleware names")))
            .handles("swap-middleware", new OpDoc(
                    "Replace the whole middleware stack with the named catalog entries.",
                    SessionMiddleware.map("middleware", "List of middleware names to install."),
                    null,
                    SessionMiddleware.map(
                            "middleware", "Names of the installed middleware, outermost first.",
                            "err", "Why the stack was not replaced, on failure.")))
            .build();

    private final MiddlewareCatalog catalog;
    private final Pipeline pipeline;

    public DynamicLoaderMiddleware(MiddlewareCatalog catalog, Pipeline pipeline) {
        if (catalog == null) throw new IllegalArgumentException("catalog is null");
        if (pipeline == null) throw new IllegalArgumentException("pipeline is null");
        this.catalog = catalog;
        this.pipeline = pipeline;
    }

    @Override
    public Descriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Handler wrap(Handler next) {
        return request -> {
            String op = request.op();
            if ("ls-middleware".equals(op)) {
                request.send(Responses.responseFor(request.message())
                        .put("middleware", request.pipeline().names())
                        .put(Message.STATUS, Responses.status(Status.DONE))
                        .build());
            } else if ("swap-middleware".equals(op)) {
                swap(request);
            } else {
                next.handle(request);
            }
        };
    }

    private void swap(Request request) {
        Message msg = request.message();
        List<String> names = names(msg.get("middleware"));
        if (!names.contains(NAME)) names.add(NAME);

        ComposedPipeline installed;
        try {
            installed = pipeline.install(catalog.resolve(names));
        } catch (MiddlewareConfigurationException e) {
            request.send(Responses.responseFor(msg)
                    .put(Message.STATUS, Responses.status(Status.ERROR, Status.MIDDLEWARE_CONFIGURATION_ERROR, Status.DONE))
                    .put("err", e.getMessage())
                    .build());
            return;
        }
        request.send(Responses.responseFor(msg)
                .put("middleware", installed.names())
                .put(Message.STATUS, Responses.status(Status.DONE))
                .build());
    }

    private static List<String> names(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List) {
            for (Object o : (List<?>) value) {
                if (o != null) out.add(String.valueOf(o).trim());
            }
        } else if (value != null) {
            for (String s : String.valueOf(value).split(",")) {
                if (!s.trim().isEmpty()) out.add(s.trim());
            }
        }
        return out;
    }
}
