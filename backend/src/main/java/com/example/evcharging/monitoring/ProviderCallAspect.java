package com.example.evcharging.monitoring;

import com.example.evcharging.provider.ChargingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Times every upstream call made through a {@link ChargingProvider} and feeds the
 * per-provider counters exposed on {@code /api/providers}.
 */
@Slf4j
@Aspect
@Component
@Order(200) // low priority, stays outside the call
@RequiredArgsConstructor
public class ProviderCallAspect {

    private final ProviderCallStats stats;

    @Around("execution(* com.example.evcharging.provider.ChargingProvider.searchStations(..))"
            + " || execution(* com.example.evcharging.provider.ChargingProvider.getStationDetails(..))"
            + " || execution(* com.example.evcharging.provider.ChargingProvider.startSession(..))"
            + " || execution(* com.example.evcharging.provider.ChargingProvider.stopSession(..))"
            + " || execution(* com.example.evcharging.provider.ChargingProvider.getSessionStatus(..))")
    public Object aroundProviderCall(ProceedingJoinPoint pjp) throws Throwable {
        String providerId = ((ChargingProvider) pjp.getTarget()).getProviderId();
        String operation = pjp.getSignature().getName();
        long started = System.nanoTime();
        boolean failed = true;
        try {
            Object result = pjp.proceed();
            failed = false;
            return result;
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            stats.record(providerId, operation, elapsedMs, failed);
            log.debug("{}.{} took {} ms{}", providerId, operation, elapsedMs, failed ? " (failed)" : "");
        }
    }
}
