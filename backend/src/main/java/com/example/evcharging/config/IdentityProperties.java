package com.example.evcharging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static bearer tokens accepted by the API, mapped to the user id they authenticate.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ev.identity")
public class IdentityProperties {

    private Map<String, String> tokens = new LinkedHashMap<>();
}
