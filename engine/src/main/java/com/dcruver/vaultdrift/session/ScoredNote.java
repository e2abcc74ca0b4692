package com.dcruver.vaultdrift.session;

import lombok.Value;

@Value
public class ScoredNote {
    String noteId;
    double score;
}
