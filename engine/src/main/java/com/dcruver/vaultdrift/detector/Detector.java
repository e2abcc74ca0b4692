package com.dcruver.vaultdrift.detector;

import com.dcruver.vaultdrift.session.SessionHandle;

import java.util.List;

/**
 * Reads a session and proposes suggestions. Must not modify anything.
 */
@FunctionalInterface
public interface Detector {

    List<Suggestion> suggest(SessionHandle session);
}
