package com.example.evcharging.config;

import com.example.evcharging.provider.chargepoint.ChargePointProvider;
import com.example.evcharging.provider.electrifyamerica.ElectrifyAmericaProvider;
import com.example.evcharging.provider.evgo.EvgoProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Adapter wiring. Each network gets its own RestTemplate so timeouts and credentials never
 * leak between providers. {@link Order} fixes the registry (and discovery result) order.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "ev.providers.chargepoint", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ChargePointProvider chargePointProvider(RestTemplateBuilder builder, ProviderProperties properties) {
        ProviderProperties.Endpoint endpoint = properties.getChargepoint();
        return new ChargePointProvider(restTemplate(builder, endpoint), endpoint);
    }

    @Bean
    @Order(2)
    @ConditionalOnProperty(prefix = "ev.providers.evgo", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EvgoProvider evgoProvider(RestTemplateBuilder builder, ProviderProperties properties) {
        ProviderProperties.Endpoint endpoint = properties.getEvgo();
        return new EvgoProvider(restTemplate(builder, endpoint), endpoint);
    }

    @Bean
    @Order(3)
    @ConditionalOnProperty(prefix = "ev.providers.electrify-america", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ElectrifyAmericaProvider electrifyAmericaProvider(RestTemplateBuilder builder, ProviderProperties properties) {
        ProviderProperties.Endpoint endpoint = properties.getElectrifyAmerica();
        return new ElectrifyAmericaProvider(restTemplate(builder, endpoint), endpoint);
    }

    /** Discovery fan-out pool; tasks are interrupted on shutdown. */
    @Bean(name = "providerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor(AggregatorProperties properties) {
        log.info("Provider call pool size: {}", properties.getPoolSize());
        return Executors.newFixedThreadPool(properties.getPoolSize(), new CustomizableThreadFactory("provider-call-"));
    }

    private static RestTemplate restTemplate(RestTemplateBuilder builder, ProviderProperties.Endpoint endpoint) {
        return builder
                .setConnectTimeout(endpoint.getConnectTimeout())
                .setReadTimeout(endpoint.getReadTimeout())
                .build();
    }
}
