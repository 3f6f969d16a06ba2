package com.lumen.script;

/** Malformed source text. Carries the position where reading failed. */
public class ReaderException extends ScriptException {
    public final int line;
    public final int column;

    public ReaderException(String message, int line, int column) {
        super("[line " + line + ", column " + column + "] " + message);
        this.line = line;
        this.column = column;
    }
}
