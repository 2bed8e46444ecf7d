package com.example.evcharging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Optional on-disk snapshot of the realtime store, loaded at startup and written at shutdown.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ev.store")
public class StoreProperties {

    /** No snapshot is kept when blank */
    private String snapshotFile = "";
}
