package com.example.evcharging.exception;

import lombok.Getter;

@Getter
public class UnknownProviderException extends ClientException {

    private final String providerId;

    public UnknownProviderException(String providerId) {
        super("Unknown provider: " + providerId);
        this.providerId = providerId;
    }
}
