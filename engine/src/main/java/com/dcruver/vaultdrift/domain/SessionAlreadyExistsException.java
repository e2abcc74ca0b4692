package com.dcruver.vaultdrift.domain;

import java.time.LocalDate;

/**
 * A session for the date already exists and the write asked not to replace it.
 */
public class SessionAlreadyExistsException extends VaultDriftException {

    private final LocalDate sessionDate;

    public SessionAlreadyExistsException(LocalDate sessionDate) {
        super("Session already stored for " + sessionDate);
        this.sessionDate = sessionDate;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }
}
