package com.example.evcharging.controller;

import com.example.evcharging.dto.ApiResponse;
import com.example.evcharging.monitoring.ProviderCallStats;
import com.example.evcharging.provider.ChargingProvider;
import com.example.evcharging.provider.ProviderRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/providers")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "providers", description = "Registered charging networks")
public class ProviderController {

    private final ProviderRegistry registry;
    private final ProviderCallStats stats;

    @GetMapping
    @Operation(summary = "Registered providers with their call statistics")
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> providers() {
        List<Map<String, Object>> providers = new ArrayList<>();
        for (ChargingProvider provider : registry.getAll()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", provider.getProviderId());
            entry.put("callTimeoutMs", provider.getCallTimeout().toMillis());
            entry.put("stats", stats.snapshot(provider.getProviderId()));
            providers.add(entry);
        }
        return ResponseEntity.ok(ApiResponse.success(providers));
    }
}
