package com.example.evcharging.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Discovery filters. Every criterion is evaluated against the merged (live) station view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StationFilter {
    private ConnectorType connectorType;
    @Builder.Default
    private boolean availableOnly = true;
    private Double minPowerKw;
    private Double maxPricePerKwh;

    public static StationFilter none() {
        return StationFilter.builder().availableOnly(false).build();
    }

    public boolean matches(Station station) {
        List<Charger> chargers = station.getChargers();
        if (availableOnly && station.getAvailableChargerCount() == 0) {
            return false;
        }
        if (connectorType != null
                && chargers.stream().noneMatch(c -> c.getConnectorType() == connectorType)) {
            return false;
        }
        if (minPowerKw != null
                && chargers.stream().noneMatch(c -> c.getPowerKw() != null && c.getPowerKw() >= minPowerKw)) {
            return false;
        }
        if (maxPricePerKwh != null
                && chargers.stream().noneMatch(c -> c.getPricePerKwh() != null && c.getPricePerKwh() <= maxPricePerKwh)) {
            return false;
        }
        return true;
    }

    public List<Station> apply(List<Station> stations) {
        return stations.stream().filter(this::matches).collect(Collectors.toList());
    }
}
