package com.example.evcharging.provider.evgo;

import com.example.evcharging.config.ProviderProperties;
import com.example.evcharging.exception.ProviderRejectedException;
import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.SessionStatus;
import com.example.evcharging.model.Station;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class EvgoProviderTest {

    private static final String BASE = "http://evgo.test/v1";

    private MockRestServiceServer server;
    private EvgoProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ProviderProperties.Endpoint endpoint = new ProviderProperties.Endpoint(BASE);
        endpoint.setApiKey("evgo-key");
        provider = new EvgoProvider(restTemplate, endpoint);
    }

    @Test
    void searchReadsPortsAndGeo() {
        server.expect(requestTo(BASE + "/locations?latitude=37.7749&longitude=-122.4194&radiusMeters=5000"))
                .andExpect(header("X-Api-Key", "evgo-key"))
                .andRespond(withSuccess("""
                        {"data":[{"id":"evgo_42","locationName":"Mall Garage","streetAddress":"200 Main St",
                          "geo":{"lat":37.78,"lng":-122.41},"hours":"6am-11pm","amenities":["shopping"],
                          "ports":[
                            {"portId":"p1","standard":"CCS","maxKw":350,"status":"AVAILABLE","pricing":{"energy":0.48}},
                            {"portId":"p2","standard":"CHADEMO","maxKw":100,"status":"IN_USE"}
                          ]}]}
                        """, MediaType.APPLICATION_JSON));

        List<Station> stations = provider.searchStations(37.7749, -122.4194, 5000);

        assertThat(stations).singleElement().satisfies(station -> {
            assertThat(station.getStationId()).isEqualTo("evgo_42");
            assertThat(station.getName()).isEqualTo("Mall Garage");
            assertThat(station.getLongitude()).isEqualTo(-122.41);
            assertThat(station.getOperatingHours()).isEqualTo("6am-11pm");
            assertThat(station.getChargers()).extracting("chargerId").containsExactly("p1", "p2");
            assertThat(station.getChargers().get(0).getPricePerKwh()).isEqualTo(0.48);
            assertThat(station.getChargers().get(0).isAvailable()).isTrue();
            assertThat(station.getChargers().get(1).isAvailable()).isFalse();
            assertThat(station.getChargers().get(1).getConnectorType()).isEqualTo(ConnectorType.CHADEMO);
        });
    }

    @Test
    void startAndStopUseDataEnvelope() {
        server.expect(requestTo(BASE + "/charging/start"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.locationId").value("evgo_42"))
                .andExpect(jsonPath("$.portId").value("p1"))
                .andExpect(jsonPath("$.driverRef").value("u1"))
                .andRespond(withSuccess("{\"data\":{\"chargeId\":\"chg_9\",\"state\":\"CHARGING\",\"startTime\":\"2024-05-01T10:00:00Z\"}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/charging/chg_9/stop"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"data":{"chargeId":"chg_9","state":"COMPLETED","endTime":"2024-05-01T10:30:00Z","kwh":18.2,"minutes":30}}
                        """, MediaType.APPLICATION_JSON));

        ChargingSession started = provider.startSession("evgo_42", "p1", "u1");
        ChargingSession stopped = provider.stopSession("chg_9");

        assertThat(started.getSessionId()).isEqualTo("chg_9");
        assertThat(started.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(stopped.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(stopped.getEnergyDeliveredKwh()).isEqualTo(18.2);
        assertThat(stopped.getDurationMinutes()).isEqualTo(30);
        server.verify();
    }

    @Test
    void startWithoutDriverRefStillReachesUpstream() {
        server.expect(requestTo(BASE + "/charging/start"))
                .andExpect(jsonPath("$.locationId").value("evgo_42"))
                .andRespond(withSuccess("{\"data\":{\"chargeId\":\"chg_10\",\"state\":\"CHARGING\"}}",
                        MediaType.APPLICATION_JSON));

        ChargingSession started = provider.startSession("evgo_42", "p1", null);

        assertThat(started.getSessionId()).isEqualTo("chg_10");
        assertThat(started.getUserId()).isNull();
        server.verify();
    }

    @Test
    void unauthorizedIsRejection() {
        server.expect(requestTo(BASE + "/charging/start")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> provider.startSession("evgo_42", "p1", "u1"))
                .isInstanceOf(ProviderRejectedException.class);
    }

    @Test
    void unknownChargeIsEmpty() {
        server.expect(requestTo(BASE + "/charging/nope")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(provider.getSessionStatus("nope")).isEmpty();
    }
}
