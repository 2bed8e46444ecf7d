package com.example.evcharging.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Live availability summary kept in the realtime store under {@code stations/{id}/status}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StationAvailability {
    private int availableChargers;
    private int totalChargers;
    private boolean operational;
    private Instant lastUpdated;
}
