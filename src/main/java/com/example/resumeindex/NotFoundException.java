package com.example.resumeindex;

public class NotFoundException extends ResumeIndexException {

    public NotFoundException(String message) {
        this(message, null);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause, ErrorCode.NOT_FOUND);
    }
}
