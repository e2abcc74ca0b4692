package com.dcruver.vaultdrift.trajectory;

public enum CorrelationKind {
    STRONGLY_CORRELATED,
    CORRELATED,
    DECOUPLED,
    ANTI_CORRELATED,
    OPPOSING,
    INSUFFICIENT_DATA
}
