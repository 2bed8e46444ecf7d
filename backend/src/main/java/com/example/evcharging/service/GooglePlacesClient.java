package com.example.evcharging.service;

import com.example.evcharging.config.MapsProperties;
import com.example.evcharging.model.Place;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Places Nearby Search. Without an API key, or when Google fails, callers get an
 * empty list; places are a convenience and never fail a request.
 */
@Slf4j
@Service
public class GooglePlacesClient implements PlacesClient {

    private final RestTemplate restTemplate;
    private final MapsProperties properties;

    @Autowired
    public GooglePlacesClient(RestTemplateBuilder builder, MapsProperties properties) {
        this.restTemplate = builder
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build();
        this.properties = properties;
    }

    GooglePlacesClient(RestTemplate restTemplate, MapsProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<Place> findNearby(double latitude, double longitude, int radiusMeters, String type) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            log.debug("No maps API key configured, skipping places lookup");
            return List.of();
        }
        String placeType = type == null || type.isBlank() ? properties.getPlaceType() : type;
        JsonNode root;
        try {
            root = restTemplate.getForObject(
                    properties.getBaseUrl() + "/nearbysearch/json?location={lat},{lng}&radius={radius}&type={type}&key={key}",
                    JsonNode.class, latitude, longitude, radiusMeters, placeType, properties.getApiKey());
        } catch (RestClientException e) {
            log.warn("Places lookup at ({}, {}) failed: {}", latitude, longitude, e.getMessage());
            return List.of();
        }
        if (root == null) {
            return List.of();
        }
        String status = root.path("status").asText("");
        if (!"OK".equals(status) && !"ZERO_RESULTS".equals(status)) {
            log.warn("Places lookup at ({}, {}) answered {}", latitude, longitude, status);
            return List.of();
        }

        List<Place> places = new ArrayList<>();
        for (JsonNode result : root.path("results")) {
            JsonNode location = result.path("geometry").path("location");
            JsonNode openNow = result.path("opening_hours").path("open_now");
            places.add(Place.builder()
                    .placeId(result.path("place_id").asText(null))
                    .name(result.path("name").asText(null))
                    .address(result.path("vicinity").asText(null))
                    .latitude(location.has("lat") ? location.get("lat").asDouble() : null)
                    .longitude(location.has("lng") ? location.get("lng").asDouble() : null)
                    .rating(result.has("rating") ? result.get("rating").asDouble() : null)
                    .openNow(openNow.isBoolean() ? openNow.asBoolean() : null)
                    .build());
        }
        return places;
    }
}
