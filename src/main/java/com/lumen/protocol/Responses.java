package com.lumen.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Builds responses correlated to a request ({@code id} and {@code session} copied over). */
public final class Responses {

    private Responses() {}

    public static Message.Builder responseFor(Message request) {
        return Message.builder()
                .put(Message.ID, request.get(Message.ID))
                .put(Message.SESSION, request.get(Message.SESSION));
    }

    public static Message responseFor(Message request, String... statuses) {
        return responseFor(request).put(Message.STATUS, status(statuses)).build();
    }

    public static List<String> status(String... statuses) {
        return new ArrayList<>(Arrays.asList(statuses));
    }
}
