package com.dcruver.vaultdrift.trajectory;

/**
 * Aspects in which a pair of notes can move towards or away from each other between sessions.
 */
public enum Dimension {
    /** Cosine similarity of the semantic parts */
    SEMANTIC,
    /** Cosine similarity of the temporal features */
    TEMPORAL,
    /** 1 / (1 + undirected link distance), 0 when disconnected */
    GRAPH,
    /** How alike the two link degrees are */
    STRUCTURAL,
    /** How alike the two notes' days since last edit are */
    STALENESS
}
