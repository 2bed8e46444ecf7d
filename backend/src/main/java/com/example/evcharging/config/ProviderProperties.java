package com.example.evcharging.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Upstream endpoints and credentials of the charging networks, bound from
 * {@code ev.providers.*} in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ev.providers")
public class ProviderProperties {

    private Endpoint chargepoint = new Endpoint("https://api.chargepoint.com/v1");

    private Endpoint evgo = new Endpoint("https://api.evgo.com/v1");

    private Endpoint electrifyAmerica = new Endpoint("https://api.electrifyamerica.com/v1");

    @Data
    @NoArgsConstructor
    public static class Endpoint {

        /** Disabled providers are not registered at all */
        private boolean enabled = true;

        private String baseUrl;

        /** Bearer token or API key, depending on the network */
        private String apiKey = "";

        private Duration connectTimeout = Duration.ofSeconds(2);

        private Duration readTimeout = Duration.ofSeconds(4);

        /** Upper bound the aggregator waits for one call, queueing included */
        private Duration callTimeout = Duration.ofSeconds(5);

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
