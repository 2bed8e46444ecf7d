package com.example.evcharging.controller;

import com.example.evcharging.config.GlobalExceptionHandler;
import com.example.evcharging.config.IdentityProperties;
import com.example.evcharging.exception.StationNotFoundException;
import com.example.evcharging.exception.UnknownProviderException;
import com.example.evcharging.model.Station;
import com.example.evcharging.model.StationFilter;
import com.example.evcharging.service.ConfiguredTokenIdentityVerifier;
import com.example.evcharging.service.LiveStateService;
import com.example.evcharging.service.ProviderAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StationControllerTest {

    private static final String TOKEN = "Bearer t-1";

    private ProviderAggregator aggregator;
    private LiveStateService liveState;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        aggregator = mock(ProviderAggregator.class);
        liveState = mock(LiveStateService.class);
        IdentityProperties identity = new IdentityProperties();
        identity.setTokens(Map.of("t-1", "u1"));
        when(aggregator.getDefaultRadiusMeters()).thenReturn(5000);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new StationController(aggregator, liveState, new ConfiguredTokenIdentityVerifier(identity)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void nearbyReturnsDiscoveredStations() throws Exception {
        Station station = Station.builder().stationId("cp_001").provider("chargepoint").distanceKm(1.2).build();
        when(aggregator.discoverAsync(anyDouble(), anyDouble(), anyInt(), any(StationFilter.class)))
                .thenReturn(CompletableFuture.completedFuture(List.of(station)));

        MvcResult pending = mockMvc.perform(get("/api/stations/nearby")
                        .header("Authorization", TOKEN)
                        .param("latitude", "37.77")
                        .param("longitude", "-122.41")
                        .param("connectorType", "ccs")
                        .param("minPowerKw", "150"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data[0].stationId").value("cp_001"))
                .andExpect(jsonPath("$.data[0].provider").value("chargepoint"));

        ArgumentCaptor<StationFilter> filter = ArgumentCaptor.forClass(StationFilter.class);
        verify(aggregator).discoverAsync(eq(37.77), eq(-122.41), eq(5000), filter.capture());
        assertThat(filter.getValue().isAvailableOnly()).isTrue();
        assertThat(filter.getValue().getMinPowerKw()).isEqualTo(150.0);
    }

    @Test
    void unknownConnectorIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/stations/nearby")
                        .header("Authorization", TOKEN)
                        .param("latitude", "37.77")
                        .param("longitude", "-122.41")
                        .param("connectorType", "SCART"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("Unknown connector type: SCART"));
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/stations/nearby").param("latitude", "1").param("longitude", "2"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(liveState);
    }

    @Test
    void unknownProviderIsBadRequest() throws Exception {
        when(aggregator.getStationDetails("st1", "nope")).thenThrow(new UnknownProviderException("nope"));

        mockMvc.perform(get("/api/stations/st1").header("Authorization", TOKEN).param("provider", "nope"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingStationIsNotFound() throws Exception {
        when(aggregator.getStationDetails("st1", "evgo")).thenThrow(new StationNotFoundException("st1", "evgo"));

        mockMvc.perform(get("/api/stations/st1").header("Authorization", TOKEN).param("provider", "evgo"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void availabilityWithoutLiveStatusIsNotFound() throws Exception {
        when(liveState.getStationStatus("st1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/stations/st1/availability").header("Authorization", TOKEN))
                .andExpect(status().isNotFound());
    }

    @Test
    void issueReportIsLogged() throws Exception {
        mockMvc.perform(post("/api/stations/st1/report")
                        .header("Authorization", TOKEN)
                        .param("issueType", "broken_connector"))
                .andExpect(status().isOk());

        verify(liveState).logEvent(eq("station_issue"), anyMap());
    }
}
