package com.lumen.middleware;

import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;

/** End of every pipeline: nobody recognized the op. */
public final class UnknownOpHandler implements Handler {

    public static final UnknownOpHandler INSTANCE = new UnknownOpHandler();

    private UnknownOpHandler() {}

    @Override
    public void handle(Request request) {
        Message msg = request.message();
        request.send(Responses.responseFor(msg)
                .put(Message.STATUS, Responses.status(Status.ERROR, Status.UNKNOWN_OP, Status.DONE))
                .put(Message.OP, msg.op())
                .build());
    }
}
