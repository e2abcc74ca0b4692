package com.dcruver.vaultdrift.trajectory;

public enum ReversalKind {
    /** Currently similar, drifting in opposite directions */
    CLOSE_DIVERGING,
    /** Currently distant, drifting the same way */
    DISTANT_CONVERGING,
    NONE,
    INSUFFICIENT_DATA
}
