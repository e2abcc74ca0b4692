package com.dcruver.vaultdrift.detector;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A provocation produced by a detector, pointing at one or more notes.
 */
@Value
@Builder(toBuilder = true)
public class Suggestion {
    String text;
    List<String> noteIds;
    String detectorId;
}
