package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.domain.Link;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything stored for one session date. Records are ordered by note id.
 */
@Value
public class SessionSnapshot {
    LocalDate sessionDate;
    String vaultStateHash;
    Map<String, SessionRecord> records;
    List<Link> links;

    public Set<String> noteIds() {
        return records.keySet();
    }

    public Optional<SessionRecord> record(String noteId) {
        return Optional.ofNullable(records.get(noteId));
    }

    public int size() {
        return records.size();
    }
}
