package com.example.evcharging.provider;

import com.example.evcharging.exception.UnknownProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-identifier-keyed lookup of adapters. The only place a provider name selects
 * an implementation.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, ChargingProvider> providersById = new LinkedHashMap<>();

    public ProviderRegistry(List<ChargingProvider> providers) {
        for (ChargingProvider provider : providers) {
            ChargingProvider previous = providersById.putIfAbsent(provider.getProviderId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Multiple adapters registered for provider: " + provider.getProviderId());
            }
        }
        log.info("Registered {} charging providers: {}", providersById.size(), providersById.keySet());
    }

    /**
     * @throws UnknownProviderException when no adapter is registered under {@code providerId}
     */
    public ChargingProvider resolve(String providerId) {
        ChargingProvider provider = providerId == null ? null : providersById.get(providerId);
        if (provider == null) {
            throw new UnknownProviderException(providerId);
        }
        return provider;
    }

    public List<ChargingProvider> getAll() {
        return List.copyOf(providersById.values());
    }

    public List<String> getProviderIds() {
        return List.copyOf(providersById.keySet());
    }
}
