package com.example.evcharging.exception;

public class StationNotFoundException extends RuntimeException {

    public StationNotFoundException(String stationId, String providerId) {
        super("Station not found: " + stationId + " (provider " + providerId + ")");
    }

    public StationNotFoundException(String message) {
        super(message);
    }
}
