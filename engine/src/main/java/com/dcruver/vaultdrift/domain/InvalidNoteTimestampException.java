package com.dcruver.vaultdrift.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A note claims to be created after the session it is analyzed in, by more than the allowed clock skew.
 */
public class InvalidNoteTimestampException extends VaultDriftException {

    public InvalidNoteTimestampException(LocalDateTime created, LocalDate sessionDate) {
        super("Note created " + created + " is later than session " + sessionDate);
    }
}
