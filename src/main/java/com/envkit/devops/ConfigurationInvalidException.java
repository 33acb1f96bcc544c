package com.envkit.devops;

// partial credential set, or nothing usable to bootstrap SSH access with
public class ConfigurationInvalidException extends ActionFailedException {
    public ConfigurationInvalidException(String message) {
        super(message);
    }
}
