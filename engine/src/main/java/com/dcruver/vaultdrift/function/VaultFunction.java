package com.dcruver.vaultdrift.function;

import com.dcruver.vaultdrift.session.SessionHandle;

import java.util.List;

/**
 * Named query callable from suggestion templates. Deterministic for a session date.
 */
@FunctionalInterface
public interface VaultFunction {

    List<String> apply(SessionHandle session, List<String> args);
}
