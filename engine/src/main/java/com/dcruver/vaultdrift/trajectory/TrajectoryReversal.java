package com.dcruver.vaultdrift.trajectory;

import lombok.Value;

@Value
public class TrajectoryReversal {
    String noteA;
    String noteB;
    ReversalKind kind;
    double currentSimilarity;
    /** Cosine between the two notes' semantic drift vectors */
    double alignment;
}
