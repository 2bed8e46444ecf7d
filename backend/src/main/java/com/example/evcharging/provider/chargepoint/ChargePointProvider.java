package com.example.evcharging.provider.chargepoint;

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
 * ChargePoint network. Bearer authentication, snake_case payloads with stations wrapped
 * in a {@code stations} array.
 */
public class ChargePointProvider extends AbstractHttpProvider {

    public static final String PROVIDER_ID = "chargepoint";

    private final String apiKey;

    public ChargePointProvider(RestTemplate restTemplate, ProviderProperties.Endpoint endpoint) {
        super(PROVIDER_ID, restTemplate, endpoint.getBaseUrl(), endpoint.getCallTimeout());
        this.apiKey = endpoint.getApiKey();
    }

    @Override
    protected void authenticate(HttpHeaders headers) {
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
    }

    @Override
    public List<Station> searchStations(double latitude, double longitude, int radiusMeters) {
        JsonNode root = call(HttpMethod.GET, "/stations?lat={lat}&lon={lon}&radius={radius}", null,
                latitude, longitude, radiusMeters);
        List<Station> stations = new ArrayList<>();
        root.path("stations").forEach(node -> stations.add(toStation(node)));
        return stations;
    }

    @Override
    public Optional<Station> getStationDetails(String stationId) {
        return callOptional(HttpMethod.GET, "/stations/{stationId}", null, stationId)
                .map(root -> toStation(root.has("station") ? root.get("station") : root));
    }

    @Override
    public ChargingSession startSession(String stationId, String chargerId, String userId) {
        Map<String, Object> body = new HashMap<>();
        body.put("station_id", stationId);
        body.put("charger_id", chargerId);
        body.put("user_id", userId);
        JsonNode root = call(HttpMethod.POST, "/sessions", body);
        return toSession(root).toBuilder()
                .stationId(stationId)
                .chargerId(chargerId)
                .userId(userId)
                .build();
    }

    @Override
    public ChargingSession stopSession(String sessionId) {
        JsonNode root = call(HttpMethod.POST, "/sessions/{sessionId}/stop", Map.of(), sessionId);
        return toSession(root);
    }

    @Override
    public Optional<ChargingSession> getSessionStatus(String sessionId) {
        return callOptional(HttpMethod.GET, "/sessions/{sessionId}", null, sessionId).map(this::toSession);
    }

    private Station toStation(JsonNode node) {
        List<Charger> chargers = new ArrayList<>();
        node.path("chargers").forEach(c -> chargers.add(Charger.builder()
                .chargerId(JsonFields.text(c, "charger_id"))
                .connectorType(JsonFields.connector(c, "connector_type"))
                .powerKw(JsonFields.decimal(c, "power_kw"))
                .available(JsonFields.bool(c, "available"))
                .pricePerKwh(JsonFields.decimal(c, "price_per_kwh"))
                .build()));

        Map<String, Double> pricing = null;
        JsonNode pricingNode = node.get("pricing");
        if (pricingNode != null && pricingNode.isObject()) {
            Map<String, Double> values = new HashMap<>();
            pricingNode.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asDouble()));
            pricing = values;
        }

        return Station.builder()
                .stationId(required(node, "station_id"))
                .name(JsonFields.text(node, "name"))
                .description(JsonFields.text(node, "description"))
                .address(JsonFields.text(node, "address"))
                .latitude(JsonFields.decimal(node, "latitude"))
                .longitude(JsonFields.decimal(node, "longitude"))
                .chargers(chargers)
                .amenities(JsonFields.strings(node, "amenities"))
                .operatingHours(JsonFields.text(node, "operating_hours"))
                .rating(JsonFields.decimal(node, "rating"))
                .pricing(pricing)
                .build();
    }

    private ChargingSession toSession(JsonNode node) {
        Integer duration = JsonFields.integer(node, "duration_minutes");
        if (duration == null) {
            duration = JsonFields.integer(node, "elapsed_minutes");
        }
        return ChargingSession.builder()
                .sessionId(required(node, "session_id"))
                .provider(PROVIDER_ID)
                .status(JsonFields.sessionStatus(JsonFields.text(node, "status"), SessionStatus.ACTIVE))
                .startedAt(JsonFields.instant(node, "started_at"))
                .endedAt(JsonFields.instant(node, "ended_at"))
                .energyDeliveredKwh(JsonFields.decimal(node, "energy_delivered_kwh"))
                .durationMinutes(duration)
                .currentPowerKw(JsonFields.decimal(node, "current_power_kw"))
                .build();
    }
}
