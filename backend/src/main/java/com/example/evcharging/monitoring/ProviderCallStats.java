package com.example.evcharging.monitoring;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-provider call counters fed by {@link ProviderCallAspect}.
 */
@Component
public class ProviderCallStats {

    private final ConcurrentMap<String, Counters> byProvider = new ConcurrentHashMap<>();

    public void record(String providerId, String operation, long elapsedMs, boolean failed) {
        Counters counters = byProvider.computeIfAbsent(providerId, id -> new Counters());
        counters.calls.incrementAndGet();
        if (failed) {
            counters.failures.incrementAndGet();
        }
        counters.totalLatencyMs.addAndGet(elapsedMs);
        counters.maxLatencyMs.accumulateAndGet(elapsedMs, Math::max);
        counters.byOperation.computeIfAbsent(operation, op -> new AtomicLong()).incrementAndGet();
    }

    public Map<String, Object> snapshot(String providerId) {
        Counters counters = byProvider.get(providerId);
        Map<String, Object> view = new LinkedHashMap<>();
        long calls = counters == null ? 0 : counters.calls.get();
        view.put("calls", calls);
        view.put("failures", counters == null ? 0 : counters.failures.get());
        view.put("avgLatencyMs", calls == 0 ? 0 : counters.totalLatencyMs.get() / calls);
        view.put("maxLatencyMs", counters == null ? 0 : counters.maxLatencyMs.get());
        Map<String, Long> operations = new LinkedHashMap<>();
        if (counters != null) {
            counters.byOperation.forEach((op, count) -> operations.put(op, count.get()));
        }
        view.put("operations", operations);
        return view;
    }

    public void reset() {
        byProvider.clear();
    }

    private static final class Counters {
        private final AtomicLong calls = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong totalLatencyMs = new AtomicLong();
        private final AtomicLong maxLatencyMs = new AtomicLong();
        private final ConcurrentMap<String, AtomicLong> byOperation = new ConcurrentHashMap<>();
    }
}
