package com.example.evcharging.service;

import com.example.evcharging.model.Place;

import java.util.List;

/**
 * Points of interest around a location, served apart from station discovery.
 */
public interface PlacesClient {

    List<Place> findNearby(double latitude, double longitude, int radiusMeters, String type);
}
