package com.dcruver.vaultdrift.domain;

/**
 * The caller's deadline passed before the operation finished.
 */
public class DeadlineExceededException extends VaultDriftException {

    private final String phase;

    public DeadlineExceededException(String phase) {
        super("Deadline exceeded during " + phase);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
