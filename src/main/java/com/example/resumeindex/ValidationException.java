package com.example.resumeindex;

public class ValidationException extends ResumeIndexException {

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause, ErrorCode.VALIDATION);
    }
}
