package com.example.resumeindex;

public class ConfigurationException extends ResumeIndexException {

    public ConfigurationException(String message) {
        this(message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause, ErrorCode.CONFIGURATION);
    }
}
