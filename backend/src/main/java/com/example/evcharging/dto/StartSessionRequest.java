package com.example.evcharging.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {

    @NotBlank
    private String stationId;

    @NotBlank
    private String chargerId;

    @NotBlank
    private String provider;

    /** Energy the driver expects to take; informational only */
    @PositiveOrZero
    private Double estimatedKwh;

    /** Connector label such as "CCS" or "Type 2" */
    private String connectorType;
}
