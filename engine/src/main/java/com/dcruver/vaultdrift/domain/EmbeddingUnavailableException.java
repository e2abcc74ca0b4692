package com.dcruver.vaultdrift.domain;

/**
 * The embedding provider could not produce a vector for a piece of content.
 * Raised per note; the session continues without that note.
 */
public class EmbeddingUnavailableException extends VaultDriftException {

    public enum Reason {
        PROVIDER_FAILURE,
        TIMEOUT,
        MALFORMED_INPUT
    }

    private final Reason reason;

    public EmbeddingUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EmbeddingUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Only provider failures are worth another attempt.
     */
    public boolean isRetryable() {
        return reason == Reason.PROVIDER_FAILURE;
    }
}
