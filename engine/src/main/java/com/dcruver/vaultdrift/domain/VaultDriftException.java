package com.dcruver.vaultdrift.domain;

/**
 * Base exception for the drift engine.
 */
public class VaultDriftException extends RuntimeException {

    public VaultDriftException(String message) {
        super(message);
    }

    public VaultDriftException(String message, Throwable cause) {
        super(message, cause);
    }
}
