package com.example.evcharging.controller;

import com.example.evcharging.dto.ApiResponse;
import com.example.evcharging.model.Place;
import com.example.evcharging.service.IdentityVerifier;
import com.example.evcharging.service.PlacesClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/places")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "places", description = "Amenities around a location")
public class PlacesController {

    private final PlacesClient placesClient;
    private final IdentityVerifier identityVerifier;

    @GetMapping("/nearby")
    @Operation(summary = "Places near a point, e.g. to pass the time while charging")
    public ResponseEntity<ApiResponse<List<Place>>> nearby(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(defaultValue = "500") int radius,
            @RequestParam(required = false) String type) {
        identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(placesClient.findNearby(latitude, longitude, radius, type)));
    }
}
