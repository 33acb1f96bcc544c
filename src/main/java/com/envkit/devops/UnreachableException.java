package com.envkit.devops;

public class UnreachableException extends ActionFailedException {
    public UnreachableException(String message) {
        super(message);
    }

    public UnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
