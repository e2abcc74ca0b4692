package com.dcruver.vaultdrift.domain;

import java.time.LocalDate;

/**
 * No session has been stored for the requested date.
 */
public class SessionNotFoundException extends VaultDriftException {

    private final LocalDate sessionDate;

    public SessionNotFoundException(LocalDate sessionDate) {
        super("No session stored for " + sessionDate);
        this.sessionDate = sessionDate;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }
}
