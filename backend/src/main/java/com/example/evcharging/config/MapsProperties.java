package com.example.evcharging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "ev.maps")
public class MapsProperties {

    /** Places lookups are skipped when blank */
    private String apiKey = "";

    private String baseUrl = "https://maps.googleapis.com/maps/api/place";

    private Duration timeout = Duration.ofSeconds(3);

    /** Google place type searched around a station */
    private String placeType = "restaurant";
}
