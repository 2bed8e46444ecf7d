package com.example.evcharging.dto;

import com.example.evcharging.model.ConnectorType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Charging totals over a user's finished sessions")
public class SessionStats {

    private int totalSessions;

    private double totalEnergyKwh;

    private double totalDurationHours;

    private double averageSessionKwh;

    @Schema(description = "Station with the most finished sessions, absent without history")
    private String favoriteStationId;

    @Schema(description = "Connector used most often, absent when no session recorded one")
    private ConnectorType mostUsedConnector;
}
