package com.example.evcharging.service;

import com.example.evcharging.config.IdentityProperties;
import com.example.evcharging.exception.NotAuthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Accepts the static bearer tokens listed under {@code ev.identity.tokens}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfiguredTokenIdentityVerifier implements IdentityVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityProperties properties;

    @Override
    public String verify(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new NotAuthenticatedException("Missing credentials");
        }
        String token = credential.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                ? credential.substring(BEARER_PREFIX.length()).trim()
                : credential.trim();
        String userId = properties.getTokens().get(token);
        if (userId == null) {
            log.debug("Rejected unknown token");
            throw new NotAuthenticatedException("Invalid credentials");
        }
        return userId;
    }
}
