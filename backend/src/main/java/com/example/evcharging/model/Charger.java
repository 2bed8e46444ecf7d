package com.example.evcharging.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Charger {
    private String chargerId;
    private ConnectorType connectorType;
    private Double powerKw;
    private boolean available;
    private Double pricePerKwh;
}
