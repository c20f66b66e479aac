package com.dcruver.goldenset.domain.diversity;

import lombok.Value;

/**
 * One corrective replacement: {@code removed} left the pool, {@code added} took its slot.
 */
@Value
public class Swap {
    int swapIdx;
    String removed;
    String added;
    int cluster;
    double maxJaccard;
}
