package com.example.evcharging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "ev.aggregator")
public class AggregatorProperties {

    /** Threads shared by all discovery fan-out calls */
    private int poolSize = 16;

    private int defaultRadiusMeters = 5000;

    private int maxRadiusMeters = 50000;
}
