package com.example.roundtable.model;

import java.util.Objects;

/** A rejected client event. Carries the code that is echoed back to the sender. */
public class RoundtableException extends RuntimeException {

    private final ErrorCode code;

    public RoundtableException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }
}
