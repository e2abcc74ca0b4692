package com.dcruver.vaultdrift.domain;

/**
 * Persisted state is unreadable or has an unexpected schema. Fatal.
 */
public class CacheCorruptionException extends VaultDriftException {

    public CacheCorruptionException(String message) {
        super(message);
    }

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
