package com.example.resumeindex;

public class UpstreamException extends ResumeIndexException {

    public UpstreamException(String message) {
        this(message, null);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause, ErrorCode.UPSTREAM);
    }
}
