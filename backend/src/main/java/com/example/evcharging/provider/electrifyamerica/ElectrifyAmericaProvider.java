package com.example.evcharging.provider.electrifyamerica;

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
import java.util.StringJoiner;

/**
 * Electrify America network. Sites come back as a bare JSON array, positions as
 * GeoJSON-style {@code [lon, lat]} pairs and the search radius is in kilometres.
 * A charging session is a "transaction" on one EVSE.
 */
public class ElectrifyAmericaProvider extends AbstractHttpProvider {

    public static final String PROVIDER_ID = "electrify_america";

    private final String apiKey;

    public ElectrifyAmericaProvider(RestTemplate restTemplate, ProviderProperties.Endpoint endpoint) {
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
        JsonNode root = call(HttpMethod.GET, "/sites?lat={lat}&lng={lng}&radius_km={radius}", null,
                latitude, longitude, radiusMeters / 1000.0);
        List<Station> stations = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(node -> stations.add(toStation(node)));
        }
        return stations;
    }

    @Override
    public Optional<Station> getStationDetails(String stationId) {
        return callOptional(HttpMethod.GET, "/sites/{siteId}", null, stationId).map(this::toStation);
    }

    @Override
    public ChargingSession startSession(String stationId, String chargerId, String userId) {
        Map<String, Object> body = new HashMap<>();
        body.put("customerRef", userId);
        JsonNode root = call(HttpMethod.POST, "/sites/{siteId}/evses/{evseId}/charge", body, stationId, chargerId);
        return toSession(root).toBuilder()
                .stationId(stationId)
                .chargerId(chargerId)
                .userId(userId)
                .build();
    }

    @Override
    public ChargingSession stopSession(String sessionId) {
        return toSession(call(HttpMethod.DELETE, "/transactions/{id}", null, sessionId));
    }

    @Override
    public Optional<ChargingSession> getSessionStatus(String sessionId) {
        return callOptional(HttpMethod.GET, "/transactions/{id}", null, sessionId).map(this::toSession);
    }

    private Station toStation(JsonNode node) {
        List<Charger> chargers = new ArrayList<>();
        node.path("evses").forEach(e -> chargers.add(Charger.builder()
                .chargerId(JsonFields.text(e, "evseId"))
                .connectorType(JsonFields.connector(e, "plug"))
                .powerKw(JsonFields.decimal(e, "kw"))
                .available("available".equalsIgnoreCase(JsonFields.text(e, "state")))
                .pricePerKwh(JsonFields.decimal(e, "pricePerKwh"))
                .build()));

        Double latitude = null;
        Double longitude = null;
        JsonNode position = node.path("position");
        if (position.isArray() && position.size() == 2) {
            longitude = position.get(0).asDouble();
            latitude = position.get(1).asDouble();
        }

        return Station.builder()
                .stationId(required(node, "siteId"))
                .name(JsonFields.text(node, "siteName"))
                .address(formatAddress(node.path("address")))
                .latitude(latitude)
                .longitude(longitude)
                .chargers(chargers)
                .amenities(JsonFields.strings(node, "services"))
                .operatingHours(JsonFields.text(node, "openingTimes"))
                .rating(JsonFields.decimal(node, "rating"))
                .build();
    }

    private static String formatAddress(JsonNode address) {
        if (address.isTextual()) {
            return address.asText();
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (String part : new String[]{"street", "city", "state"}) {
            String value = JsonFields.text(address, part);
            if (value != null && !value.isBlank()) {
                joiner.add(value);
            }
        }
        return joiner.length() == 0 ? null : joiner.toString();
    }

    private ChargingSession toSession(JsonNode node) {
        return ChargingSession.builder()
                .sessionId(required(node, "transactionId"))
                .provider(PROVIDER_ID)
                .status(JsonFields.sessionStatus(JsonFields.text(node, "state"), SessionStatus.ACTIVE))
                .startedAt(JsonFields.instant(node, "startedAt"))
                .endedAt(JsonFields.instant(node, "stoppedAt"))
                .energyDeliveredKwh(JsonFields.decimal(node, "energyKwh"))
                .durationMinutes(JsonFields.integer(node, "durationMin"))
                .currentPowerKw(JsonFields.decimal(node, "powerKw"))
                .build();
    }
}
