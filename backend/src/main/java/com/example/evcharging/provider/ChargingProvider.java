package com.example.evcharging.provider;

import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.Station;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Capability set every charging-network adapter implements.
 * <p>
 * Adapters are stateless across calls and never tag stations with their own provider id;
 * the aggregator does that. Transport problems surface as
 * {@link com.example.evcharging.exception.ProviderUnavailableException}, upstream refusals as
 * {@link com.example.evcharging.exception.ProviderRejectedException}.
 */
public interface ChargingProvider {

    String getProviderId();

    /**
     * Upper bound the aggregator waits for one call to this provider.
     */
    default Duration getCallTimeout() {
        return Duration.ofSeconds(5);
    }

    /**
     * @return stations around the point, empty when there are none
     */
    List<Station> searchStations(double latitude, double longitude, int radiusMeters);

    Optional<Station> getStationDetails(String stationId);

    ChargingSession startSession(String stationId, String chargerId, String userId);

    ChargingSession stopSession(String sessionId);

    Optional<ChargingSession> getSessionStatus(String sessionId);
}
