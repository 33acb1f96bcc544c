package com.envkit.devops;

// opaque failure reported by the cloud API or the remote shell, passed through unchanged
public class ProviderException extends ActionFailedException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
