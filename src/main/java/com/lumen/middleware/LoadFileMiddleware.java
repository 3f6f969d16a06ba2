package com.lumen.middleware;

import com.lumen.protocol.Message;
import com.lumen.protocol.Status;

/**
 * Serves {@code load-file} by turning it into an {@code eval} of the file's contents,
 * dispatched from the top of the pipeline that received it.
 */
public final class LoadFileMiddleware implements Middleware {

    public static final String NAME = "load-file";

    private static final Descriptor DESCRIPTOR = Descriptor.builder(NAME)
            .expects("eval")
            .handles("load-file", new OpDoc(
                    "Loads a body of code, using supplied path and filename info to set source file and line number metadata.",
                    SessionMiddleware.map("file", "Full contents of a file of code."),
                    SessionMiddleware.map(
                            "file-path", "Source-path-relative path of the source file, e.g. lumen/walk.lm",
                            "file-name", "Name of source file, e.g. walk.lm"),
                    SessionMiddleware.map(
                            "value", "The result of evaluating each form of the file.",
                            "ex", "The type of exception thrown, if any.")))
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
            if (!msg.has("file")) {
                request.reply(Status.ERROR, Status.NO_CODE, Status.DONE);
                return;
            }
            request.pipeline().handle(request.withMessage(asEval(msg)));
        };
    }

    static Message asEval(Message msg) {
        String path = msg.getString("file-path");
        if (path == null) path = msg.getString("file-name");
        return msg.with(Message.OP, "eval")
                .with("code", msg.getString("file"))
                .with("file", path)
                .without("file-path")
                .without("file-name");
    }
}
