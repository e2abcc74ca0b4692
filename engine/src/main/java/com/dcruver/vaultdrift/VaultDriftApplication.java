package com.dcruver.vaultdrift;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Vault Drift.
 *
 * Embeds a note collection once per session date, clusters it, and tracks how notes move
 * through meaning, time and the link graph from one session to the next.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class VaultDriftApplication {

    public static void main(String[] args) {
        log.info("Starting Vault Drift...");
        SpringApplication.run(VaultDriftApplication.class, args);
    }
}
