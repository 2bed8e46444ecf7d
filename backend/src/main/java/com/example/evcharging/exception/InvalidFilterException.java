package com.example.evcharging.exception;

public class InvalidFilterException extends ClientException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
