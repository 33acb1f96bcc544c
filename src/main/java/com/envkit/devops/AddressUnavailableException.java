package com.envkit.devops;

public class AddressUnavailableException extends ActionFailedException {
    public AddressUnavailableException(String message) {
        super(message);
    }
}
