package com.mnemo.context;

/**
 * Receives a trace for every assembled prompt. Exceptions thrown here are logged and ignored.
 */
@FunctionalInterface
public interface ContextTraceListener {
    void onTrace(ContextTrace trace);
}
