package com.dcruver.vaultdrift.trajectory;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Cluster identity across two sessions, matched by membership overlap.
 */
@Value
public class ClusterMigration {
    LocalDate from;
    LocalDate to;
    /** Cluster id in {@code from} to its best match in {@code to} */
    Map<Integer, Integer> matches;
    /** Clusters in {@code to} without a predecessor */
    List<Integer> births;
    /** Clusters in {@code from} without a successor */
    List<Integer> deaths;
    /** Notes whose cluster in {@code to} is not the match of their cluster in {@code from} */
    List<String> migratedNotes;
}
