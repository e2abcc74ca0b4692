package com.dcruver.vaultdrift.store;

/**
 * What a session write does when the date is already stored.
 */
public enum WriteMode {
    /** Fail with SessionAlreadyExistsException */
    REJECT_EXISTING,
    /** Drop the stored session and write the new one in the same transaction */
    REPLACE
}
