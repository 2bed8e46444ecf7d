package com.example.evcharging.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChargingSession {
    private String sessionId;
    private String userId;
    private String stationId;
    private String chargerId;
    private String provider;
    private ConnectorType connectorType;
    private SessionStatus status;
    private Instant startedAt;
    private Instant endedAt;
    private Double energyDeliveredKwh;
    private Integer durationMinutes;
    private Double currentPowerKw;
    private Double estimatedKwh;
}
