package com.dcruver.vaultdrift.store;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
public class SessionSummary {
    LocalDate sessionDate;
    int noteCount;
    String vaultStateHash;
    Instant createdAt;
}
