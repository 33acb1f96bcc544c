package com.envkit.devops;

/* Base of every failure a lifecycle action can surface to its caller */

public class ActionFailedException extends Exception {
    public ActionFailedException(String message) {
        super(message);
    }

    public ActionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
