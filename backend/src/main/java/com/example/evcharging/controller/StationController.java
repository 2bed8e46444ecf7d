package com.example.evcharging.controller;

import com.example.evcharging.dto.ApiResponse;
import com.example.evcharging.exception.InvalidFilterException;
import com.example.evcharging.exception.StationNotFoundException;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.Station;
import com.example.evcharging.model.StationAvailability;
import com.example.evcharging.model.StationFilter;
import com.example.evcharging.service.IdentityVerifier;
import com.example.evcharging.service.LiveStateService;
import com.example.evcharging.service.ProviderAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/stations")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "stations", description = "Station discovery across all charging networks")
public class StationController {

    private final ProviderAggregator aggregator;
    private final LiveStateService liveState;
    private final IdentityVerifier identityVerifier;

    @GetMapping("/nearby")
    @Operation(summary = "Stations around a point from every provider, nearest first")
    public CompletableFuture<ResponseEntity<ApiResponse<List<Station>>>> nearby(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(required = false) Integer radius,
            @RequestParam(required = false) String connectorType,
            @RequestParam(defaultValue = "true") boolean availableOnly,
            @RequestParam(required = false) Double minPowerKw,
            @RequestParam(required = false) Double maxPricePerKwh) {
        identityVerifier.verify(authorization);
        StationFilter filter = StationFilter.builder()
                .connectorType(parseConnector(connectorType))
                .availableOnly(availableOnly)
                .minPowerKw(minPowerKw)
                .maxPricePerKwh(maxPricePerKwh)
                .build();
        int radiusMeters = radius != null ? radius : aggregator.getDefaultRadiusMeters();
        return aggregator.discoverAsync(latitude, longitude, radiusMeters, filter)
                .thenApply(stations -> ResponseEntity.ok(ApiResponse.success(stations)));
    }

    @GetMapping("/{stationId}")
    @Operation(summary = "Station detail from its provider, with live availability")
    public ResponseEntity<ApiResponse<Station>> detail(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String stationId,
            @RequestParam String provider) {
        identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(aggregator.getStationDetails(stationId, provider)));
    }

    @GetMapping("/{stationId}/availability")
    @Operation(summary = "Live availability summary held for a station")
    public ResponseEntity<ApiResponse<StationAvailability>> availability(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String stationId) {
        identityVerifier.verify(authorization);
        StationAvailability availability = liveState.getStationStatus(stationId)
                .orElseThrow(() -> new StationNotFoundException("No live availability for station " + stationId));
        return ResponseEntity.ok(ApiResponse.success(availability));
    }

    @PostMapping("/{stationId}/report")
    @Operation(summary = "Report a problem at a station")
    public ResponseEntity<ApiResponse<Void>> report(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String stationId,
            @RequestParam String issueType,
            @RequestParam(required = false) String description) {
        String userId = identityVerifier.verify(authorization);
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("station_id", stationId);
        event.put("user_id", userId);
        event.put("issue_type", issueType);
        if (description != null) {
            event.put("description", description);
        }
        liveState.logEvent("station_issue", event);
        return ResponseEntity.ok(ApiResponse.success("Issue reported", null));
    }

    private static ConnectorType parseConnector(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ConnectorType.lookup(value)
                .orElseThrow(() -> new InvalidFilterException("Unknown connector type: " + value));
    }
}
