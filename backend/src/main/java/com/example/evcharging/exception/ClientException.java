package com.example.evcharging.exception;

/**
 * Request rejected before any provider I/O. Never retried.
 */
public class ClientException extends RuntimeException {

    public ClientException(String message) {
        super(message);
    }
}
