package com.lumen.debug;

/** Severity of a {@link Debug} record, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
