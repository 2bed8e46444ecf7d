package com.example.evcharging.service;

import com.example.evcharging.model.Charger;
import com.example.evcharging.model.Station;
import com.example.evcharging.model.StationAvailability;
import com.example.evcharging.store.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Overlays the store's live availability on provider-reported stations. Stations without a
 * status document keep the adapter's data unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityMerger {

    private final LiveStateService liveState;

    public Station merge(Station station) {
        Optional<StationAvailability> status;
        Map<String, Boolean> chargerStates;
        try {
            status = liveState.getStationStatus(station.getStationId());
            if (status.isEmpty()) {
                return station;
            }
            chargerStates = liveState.getChargerAvailability(station.getStationId());
        } catch (StoreException e) {
            log.warn("Live availability unreadable for station {}, keeping provider data: {}",
                    station.getStationId(), e.getMessage());
            return station;
        }

        for (Charger charger : station.getChargers()) {
            Boolean live = chargerStates.get(charger.getChargerId());
            if (live != null) {
                charger.setAvailable(live);
            }
        }
        station.setAvailability(summarize(status.get(), station));
        return station;
    }

    /**
     * The store only knows chargers that saw a session, so a station reported with its
     * chargers is recounted over the merged flags.
     */
    private static StationAvailability summarize(StationAvailability stored, Station station) {
        if (station.getChargers().isEmpty()) {
            return stored;
        }
        int available = (int) station.getChargers().stream().filter(Charger::isAvailable).count();
        return StationAvailability.builder()
                .availableChargers(available)
                .totalChargers(Math.max(stored.getTotalChargers(), station.getChargers().size()))
                .operational(available > 0)
                .lastUpdated(stored.getLastUpdated())
                .build();
    }
}
