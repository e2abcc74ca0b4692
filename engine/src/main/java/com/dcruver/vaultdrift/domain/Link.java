package com.dcruver.vaultdrift.domain;

import lombok.Value;

/**
 * Directed edge between two notes. Links carry no payload.
 */
@Value(staticConstructor = "of")
public class Link {
    String sourceId;
    String targetId;
}
