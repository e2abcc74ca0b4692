package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.domain.Embedding;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One note as it was captured in one session.
 */
@Value
@Builder(toBuilder = true)
public class SessionRecord {
    String noteId;
    String contentHash;
    LocalDateTime modified;
    Embedding embedding;
    /** null when the note is noise */
    Integer clusterId;
    String clusterLabel;

    public boolean isNoise() {
        return clusterId == null;
    }
}
