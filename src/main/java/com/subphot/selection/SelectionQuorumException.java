package com.subphot.selection;

import java.util.List;

/**
 * Every cascade level was tried and none produced enough frames.
 */
public final class SelectionQuorumException extends Exception {
    private final List<String> trace;

    public SelectionQuorumException(String message, List<String> trace) {
        super(message + (trace == null || trace.isEmpty() ? "" : " (tried " + String.join(", ", trace) + ")"));
        this.trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public List<String> trace() {
        return trace;
    }
}
