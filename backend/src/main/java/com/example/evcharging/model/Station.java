package com.example.evcharging.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Normalized station record. Identity is (provider, stationId); the same physical site
 * reported by two networks yields two stations.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Station {
    private String stationId;
    private String provider;
    private String name;
    private String description;
    private String address;
    private Double latitude;
    private Double longitude;
    private Double distanceKm;
    @Builder.Default
    private List<Charger> chargers = new ArrayList<>();
    @Builder.Default
    private List<String> amenities = new ArrayList<>();
    private String operatingHours;
    private Double rating;
    private Map<String, Double> pricing;
    private StationAvailability availability;

    @JsonIgnore
    public int getAvailableChargerCount() {
        if (availability != null) {
            return availability.getAvailableChargers();
        }
        return (int) chargers.stream().filter(Charger::isAvailable).count();
    }

    @JsonIgnore
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
