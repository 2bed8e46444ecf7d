package com.example.evcharging.service;

import com.example.evcharging.config.AggregatorProperties;
import com.example.evcharging.exception.InvalidFilterException;
import com.example.evcharging.exception.StationNotFoundException;
import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ProviderResult;
import com.example.evcharging.model.Station;
import com.example.evcharging.model.StationFilter;
import com.example.evcharging.provider.ChargingProvider;
import com.example.evcharging.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans discovery out to every registered provider and dispatches single-provider operations.
 * <p>
 * Each provider call runs on the shared provider pool and is bounded by that provider's own
 * timeout, so the aggregate waits at most as long as the slowest timeout. A provider that
 * fails or times out contributes no stations and never fails the whole discovery.
 */
@Slf4j
@Service
public class ProviderAggregator {

    private static final Comparator<Station> BY_DISTANCE =
            Comparator.comparing(Station::getDistanceKm, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ProviderRegistry registry;
    private final AvailabilityMerger availabilityMerger;
    private final ExecutorService executor;
    private final AggregatorProperties properties;

    public ProviderAggregator(ProviderRegistry registry,
                              AvailabilityMerger availabilityMerger,
                              @Qualifier("providerExecutor") ExecutorService executor,
                              AggregatorProperties properties) {
        this.registry = registry;
        this.availabilityMerger = availabilityMerger;
        this.executor = executor;
        this.properties = properties;
    }

    /* ---------- discovery ---------- */

    public List<Station> discover(double latitude, double longitude, int radiusMeters, StationFilter filter) {
        CompletableFuture<List<Station>> future = discoverAsync(latitude, longitude, radiusMeters, filter);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Discovery interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Discovery failed", e.getCause());
        }
    }

    /**
     * Cancelling the returned future cancels every provider call still in flight.
     *
     * @throws InvalidFilterException when the query itself is invalid; no provider is called
     */
    public CompletableFuture<List<Station>> discoverAsync(double latitude, double longitude, int radiusMeters,
                                                         StationFilter filter) {
        validate(latitude, longitude, radiusMeters, filter);
        StationFilter effective = filter != null ? filter : StationFilter.none();

        List<CompletableFuture<List<Station>>> calls = new ArrayList<>();
        List<CompletableFuture<ProviderResult<List<Station>>>> results = new ArrayList<>();
        for (ChargingProvider provider : registry.getAll()) {
            long started = System.nanoTime();
            CompletableFuture<List<Station>> call = submitSearch(provider, latitude, longitude, radiusMeters);
            calls.add(call);
            results.add(call.handle((stations, ex) -> toResult(provider, stations, ex, started)));
        }

        // combine on the pool, never on the orTimeout delayer thread
        CompletableFuture<List<Station>> aggregate = CompletableFuture
                .allOf(results.toArray(new CompletableFuture<?>[0]))
                .thenApplyAsync(ignored -> combine(results.stream().map(CompletableFuture::join).toList(),
                        latitude, longitude, effective), executor);
        aggregate.whenComplete((stations, ex) -> {
            if (aggregate.isCancelled()) {
                log.info("Discovery cancelled, cancelling {} provider calls", calls.size());
                calls.forEach(call -> call.cancel(true));
            }
        });
        return aggregate;
    }

    private CompletableFuture<List<Station>> submitSearch(ChargingProvider provider,
                                                          double latitude, double longitude, int radiusMeters) {
        CompletableFuture<List<Station>> call = new CompletableFuture<>();
        final Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    call.complete(provider.searchStations(latitude, longitude, radiusMeters));
                } catch (RuntimeException e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
            return call;
        }
        call.orTimeout(provider.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        call.whenComplete((stations, ex) -> {
            if (ex != null) {
                task.cancel(true);
            }
        });
        return call;
    }

    private ProviderResult<List<Station>> toResult(ChargingProvider provider, List<Station> stations,
                                                   Throwable ex, long startedNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        if (ex == null) {
            return ProviderResult.success(provider.getProviderId(), stations == null ? List.of() : stations, elapsedMs);
        }
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String reason;
        if (cause instanceof TimeoutException) {
            reason = "timed out after " + provider.getCallTimeout().toMillis() + " ms";
        } else if (cause instanceof CancellationException) {
            reason = "cancelled";
        } else {
            reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        log.warn("Provider {} skipped in discovery after {} ms: {}", provider.getProviderId(), elapsedMs, reason);
        return ProviderResult.failure(provider.getProviderId(), reason, elapsedMs);
    }

    private List<Station> combine(List<ProviderResult<List<Station>>> results,
                                  double latitude, double longitude, StationFilter filter) {
        List<Station> stations = new ArrayList<>();
        int answered = 0;
        for (ProviderResult<List<Station>> result : results) {
            if (!result.isSuccess()) {
                continue;
            }
            answered++;
            for (Station station : result.getValue()) {
                station.setProvider(result.getProviderId());
                stations.add(station);
            }
            log.debug("Provider {} returned {} stations in {} ms",
                    result.getProviderId(), result.getValue().size(), result.getElapsedMs());
        }

        stations.forEach(availabilityMerger::merge);
        List<Station> filtered = filter.apply(stations);
        filtered.forEach(station -> station.setDistanceKm(GeoDistance.kilometres(latitude, longitude, station)));
        filtered.sort(BY_DISTANCE);

        log.info("Discovery ({}, {}): {} of {} stations kept, {}/{} providers answered",
                latitude, longitude, filtered.size(), stations.size(), answered, results.size());
        return filtered;
    }

    private void validate(double latitude, double longitude, int radiusMeters, StationFilter filter) {
        if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw new InvalidFilterException("Coordinates out of range: " + latitude + ", " + longitude);
        }
        if (radiusMeters <= 0 || radiusMeters > properties.getMaxRadiusMeters()) {
            throw new InvalidFilterException("Radius must be between 1 and " + properties.getMaxRadiusMeters() + " meters");
        }
        if (filter == null) {
            return;
        }
        if (filter.getMinPowerKw() != null && filter.getMinPowerKw() < 0) {
            throw new InvalidFilterException("minPowerKw must not be negative");
        }
        if (filter.getMaxPricePerKwh() != null && filter.getMaxPricePerKwh() < 0) {
            throw new InvalidFilterException("maxPricePerKwh must not be negative");
        }
    }

    public int getDefaultRadiusMeters() {
        return properties.getDefaultRadiusMeters();
    }

    /* ---------- single-provider dispatch ---------- */

    public ChargingProvider requireProvider(String providerId) {
        return registry.resolve(providerId);
    }

    public Station getStationDetails(String stationId, String providerId) {
        ChargingProvider provider = registry.resolve(providerId);
        Station station = provider.getStationDetails(stationId)
                .orElseThrow(() -> new StationNotFoundException(stationId, providerId));
        station.setProvider(provider.getProviderId());
        return availabilityMerger.merge(station);
    }

    public ChargingSession startSession(String stationId, String chargerId, String providerId, String userId) {
        ChargingProvider provider = registry.resolve(providerId);
        ChargingSession session = provider.startSession(stationId, chargerId, userId);
        session.setProvider(provider.getProviderId());
        return session;
    }

    public ChargingSession stopSession(String sessionId, String providerId) {
        ChargingProvider provider = registry.resolve(providerId);
        ChargingSession session = provider.stopSession(sessionId);
        session.setProvider(provider.getProviderId());
        return session;
    }

    public Optional<ChargingSession> getSessionStatus(String sessionId, String providerId) {
        ChargingProvider provider = registry.resolve(providerId);
        return provider.getSessionStatus(sessionId).map(session -> {
            session.setProvider(provider.getProviderId());
            return session;
        });
    }
}
