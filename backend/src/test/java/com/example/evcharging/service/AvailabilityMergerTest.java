package com.example.evcharging.service;

import com.example.evcharging.model.Charger;
import com.example.evcharging.model.Station;
import com.example.evcharging.model.StationFilter;
import com.example.evcharging.store.InMemoryRealtimeStore;
import com.example.evcharging.store.StoreException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AvailabilityMergerTest {

    private final LiveStateService liveState = new LiveStateService(new InMemoryRealtimeStore());
    private final AvailabilityMerger merger = new AvailabilityMerger(liveState);

    @Test
    void storeOverridesProviderReportedAvailability() {
        liveState.updateChargerAvailability("st1", "c1", false, null);

        Station merged = merger.merge(station("st1"));

        assertThat(merged.getChargers()).filteredOn(c -> c.getChargerId().equals("c1"))
                .extracting(Charger::isAvailable).containsExactly(false);
        assertThat(merged.getChargers()).filteredOn(c -> c.getChargerId().equals("c2"))
                .extracting(Charger::isAvailable).containsExactly(true);
        assertThat(merged.getAvailability()).isNotNull();
        assertThat(merged.getAvailableChargerCount()).isEqualTo(1);
    }

    @Test
    void summaryCountsChargersTheStoreHasNotSeen() {
        liveState.updateChargerAvailability("st1", "c1", false, null);

        Station merged = merger.merge(station("st1"));

        assertThat(liveState.getStationStatus("st1").orElseThrow().getTotalChargers()).isEqualTo(1);
        assertThat(merged.getAvailability().getTotalChargers()).isEqualTo(2);
        assertThat(merged.getAvailability().getAvailableChargers()).isEqualTo(1);
        assertThat(merged.getAvailability().isOperational()).isTrue();
        assertThat(StationFilter.builder().build().matches(merged)).isTrue();
    }

    @Test
    void stationWithoutChargerListKeepsStoredSummary() {
        liveState.updateChargerAvailability("st3", "c1", false, null);

        Station merged = merger.merge(Station.builder().stationId("st3").chargers(List.of()).build());

        assertThat(merged.getAvailableChargerCount()).isZero();
        assertThat(StationFilter.builder().build().matches(merged)).isFalse();
    }

    @Test
    void stationWithoutStatusKeepsProviderData() {
        Station merged = merger.merge(station("st2"));

        assertThat(merged.getAvailability()).isNull();
        assertThat(merged.getChargers()).allMatch(Charger::isAvailable);
        assertThat(merged.getAvailableChargerCount()).isEqualTo(2);
    }

    @Test
    void unreadableStoreKeepsProviderData() {
        LiveStateService broken = mock(LiveStateService.class);
        when(broken.getStationStatus("st1")).thenThrow(new StoreException("store offline"));

        Station merged = new AvailabilityMerger(broken).merge(station("st1"));

        assertThat(merged.getAvailability()).isNull();
        assertThat(merged.getChargers()).allMatch(Charger::isAvailable);
    }

    private static Station station(String id) {
        return Station.builder()
                .stationId(id)
                .chargers(List.of(
                        Charger.builder().chargerId("c1").available(true).build(),
                        Charger.builder().chargerId("c2").available(true).build()))
                .build();
    }
}
