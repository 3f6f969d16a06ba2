package com.lumen.middleware;

/** A set of middleware cannot be composed into a pipeline. */
public class MiddlewareConfigurationException extends RuntimeException {
    public MiddlewareConfigurationException(String message) {
        super(message);
    }
}
