package com.dcruver.vaultdrift.session;

import lombok.Value;

/**
 * Two notes with their similarity; first sorts before second.
 */
@Value
public class NotePair {
    String first;
    String second;
    double similarity;
}
