package com.example.evcharging.provider.evgo;

import com.example.evcharging.config.ProviderProperties;
import com.example.evcharging.model.Charger;
import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.SessionStatus;
import com.example.evcharging.model.Station;
import com.example.evcharging.provider.AbstractHttpProvider;
import com.example.evcharging.provider.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * EVgo network. API-key header, camelCase payloads wrapped in a {@code data} envelope,
 * chargers reported as "ports" with a textual status.
 */
public class EvgoProvider extends AbstractHttpProvider {

    public static final String PROVIDER_ID = "evgo";

    static final String API_KEY_HEADER = "X-Api-Key";

    private final String apiKey;

    public EvgoProvider(RestTemplate restTemplate, ProviderProperties.Endpoint endpoint) {
        super(PROVIDER_ID, restTemplate, endpoint.getBaseUrl(), endpoint.getCallTimeout());
        this.apiKey = endpoint.getApiKey();
    }

    @Override
    protected void authenticate(HttpHeaders headers) {
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(API_KEY_HEADER, apiKey);
        }
    }

    @Override
    public List<Station> searchStations(double latitude, double longitude, int radiusMeters) {
        JsonNode root = call(HttpMethod.GET,
                "/locations?latitude={lat}&longitude={lon}&radiusMeters={radius}", null,
                latitude, longitude, radiusMeters);
        List<Station> stations = new ArrayList<>();
        root.path("data").forEach(node -> stations.add(toStation(node)));
        return stations;
    }

    @Override
    public Optional<Station> getStationDetails(String stationId) {
        return callOptional(HttpMethod.GET, "/locations/{id}", null, stationId)
                .map(root -> toStation(root.path("data")));
    }

    @Override
    public ChargingSession startSession(String stationId, String chargerId, String userId) {
        Map<String, Object> body = new HashMap<>();
        body.put("locationId", stationId);
        body.put("portId", chargerId);
        body.put("driverRef", userId);
        JsonNode root = call(HttpMethod.POST, "/charging/start", body);
        return toSession(root.path("data")).toBuilder()
                .stationId(stationId)
                .chargerId(chargerId)
                .userId(userId)
                .build();
    }

    @Override
    public ChargingSession stopSession(String sessionId) {
        JsonNode root = call(HttpMethod.POST, "/charging/{id}/stop", Map.of(), sessionId);
        return toSession(root.path("data"));
    }

    @Override
    public Optional<ChargingSession> getSessionStatus(String sessionId) {
        return callOptional(HttpMethod.GET, "/charging/{id}", null, sessionId)
                .map(root -> toSession(root.path("data")));
    }

    private Station toStation(JsonNode node) {
        List<Charger> chargers = new ArrayList<>();
        node.path("ports").forEach(p -> chargers.add(Charger.builder()
                .chargerId(JsonFields.text(p, "portId"))
                .connectorType(JsonFields.connector(p, "standard"))
                .powerKw(JsonFields.decimal(p, "maxKw"))
                .available("AVAILABLE".equalsIgnoreCase(JsonFields.text(p, "status")))
                .pricePerKwh(JsonFields.decimal(p.path("pricing"), "energy"))
                .build()));

        JsonNode geo = node.path("geo");
        return Station.builder()
                .stationId(required(node, "id"))
                .name(JsonFields.text(node, "locationName"))
                .address(JsonFields.text(node, "streetAddress"))
                .latitude(JsonFields.decimal(geo, "lat"))
                .longitude(JsonFields.decimal(geo, "lng"))
                .chargers(chargers)
                .amenities(JsonFields.strings(node, "amenities"))
                .operatingHours(JsonFields.text(node, "hours"))
                .build();
    }

    private ChargingSession toSession(JsonNode node) {
        return ChargingSession.builder()
                .sessionId(required(node, "chargeId"))
                .provider(PROVIDER_ID)
                .status(JsonFields.sessionStatus(JsonFields.text(node, "state"), SessionStatus.ACTIVE))
                .startedAt(JsonFields.instant(node, "startTime"))
                .endedAt(JsonFields.instant(node, "endTime"))
                .energyDeliveredKwh(JsonFields.decimal(node, "kwh"))
                .durationMinutes(JsonFields.integer(node, "minutes"))
                .currentPowerKw(JsonFields.decimal(node, "powerKw"))
                .build();
    }
}
