package com.dcruver.goldenset.domain.topup;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Renumbered pool with every stratum at quota, and the decisions that got it there.
 */
@Value
@Builder
public class TopUpResult {
    List<SpecItem> items;
    List<TopUpTraceEntry> trace;
    int toppedUp;
    int regenerated;
    int trimmed;
}
