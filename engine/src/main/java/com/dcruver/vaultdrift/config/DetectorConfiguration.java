package com.dcruver.vaultdrift.config;

import com.dcruver.vaultdrift.detector.ConceptDriftDetector;
import com.dcruver.vaultdrift.detector.DetectorRegistry;
import com.dcruver.vaultdrift.detector.OrphanDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in detectors.
 */
@Configuration
@Slf4j
public class DetectorConfiguration {

    @Bean
    public DetectorRegistry detectorRegistry(EngineProperties properties) {
        EngineProperties.Detectors detectors = properties.getDetectors();
        DetectorRegistry registry = new DetectorRegistry()
            .register("orphans", new OrphanDetector(detectors.getMaxSuggestions()))
            .register("concept_drift", new ConceptDriftDetector(
                detectors.getConceptDriftThreshold(), detectors.getMaxSuggestions()));
        log.info("Registered {} detectors: {}", registry.size(), registry.ids());
        return registry;
    }
}
