package com.dcruver.vaultdrift.detector;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detectors by id, in registration order. Populated explicitly at startup.
 */
@Slf4j
public class DetectorRegistry {

    private final Map<String, Detector> detectors = new LinkedHashMap<>();

    public synchronized DetectorRegistry register(String id, Detector detector) {
        if (detectors.containsKey(id)) {
            throw new IllegalStateException("Detector already registered: " + id);
        }
        detectors.put(id, detector);
        log.debug("Registered detector {}", id);
        return this;
    }

    public Optional<Detector> get(String id) {
        return Optional.ofNullable(detectors.get(id));
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(detectors.keySet());
    }

    public Map<String, Detector> all() {
        return Collections.unmodifiableMap(detectors);
    }

    public int size() {
        return detectors.size();
    }
}
