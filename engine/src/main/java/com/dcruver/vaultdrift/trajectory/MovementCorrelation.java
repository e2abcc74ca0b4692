package com.dcruver.vaultdrift.trajectory;

import lombok.Value;

/**
 * How a pair's movement in one dimension tracks its movement in another.
 */
@Value
public class MovementCorrelation {
    Dimension first;
    Dimension second;
    /** Pearson coefficient of the per-step direction signs */
    double coefficient;
    int steps;
    CorrelationKind kind;
}
