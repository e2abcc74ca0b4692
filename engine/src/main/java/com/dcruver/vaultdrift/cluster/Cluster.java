package com.dcruver.vaultdrift.cluster;

import lombok.Value;

import java.util.List;

/**
 * A density cluster within one session. Ids mean nothing outside their session.
 */
@Value
public class Cluster {
    int id;
    List<String> memberIds;
    /** Comma separated keywords */
    String keywordLabel;
    double[] centroid;

    public String getLabel() {
        return ClusterLabeler.formatLabel(keywordLabel);
    }

    public int size() {
        return memberIds.size();
    }
}
