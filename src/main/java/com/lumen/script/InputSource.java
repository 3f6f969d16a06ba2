package com.lumen.script;

import java.io.IOException;

/** Where {@code read-line} takes its input from. */
public interface InputSource {

    /**
     * Next line of input without its terminator, blocking until one is available.
     * Returns null at end of input.
     */
    String readLine() throws IOException, InterruptedException;
}
