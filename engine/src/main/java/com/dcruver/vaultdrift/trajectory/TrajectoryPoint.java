package com.dcruver.vaultdrift.trajectory;

import com.dcruver.vaultdrift.store.SessionRecord;
import lombok.Value;

import java.time.LocalDate;

@Value
public class TrajectoryPoint {
    LocalDate sessionDate;
    SessionRecord record;
}
