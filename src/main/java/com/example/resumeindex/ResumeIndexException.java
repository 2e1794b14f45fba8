package com.example.resumeindex;

import java.util.Optional;

/**
 * Base class for every failure raised by the core. A failed operation never leaves partially
 * persisted state behind, so callers can simply report the message and stop.
 */
public abstract class ResumeIndexException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ResumeIndexException(String message, Throwable cause, ErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.defaultMessage()), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
