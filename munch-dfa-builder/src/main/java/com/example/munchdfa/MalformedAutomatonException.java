package com.example.munchdfa;

import java.io.IOException;

/**
 * Thrown by the automaton readers when a transition or label record is not
 * structurally valid.
 */
public class MalformedAutomatonException extends IOException {

    private static final long serialVersionUID = 1L;

    private final long lineNumber;

    public MalformedAutomatonException(String message) {
        super(message);
        this.lineNumber = -1;
    }

    public MalformedAutomatonException(String source, long lineNumber, String message) {
        super(source + ":" + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MalformedAutomatonException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    /** 1-based line of the offending record, or -1 if unknown. */
    public long getLineNumber() {
        return lineNumber;
    }
}
